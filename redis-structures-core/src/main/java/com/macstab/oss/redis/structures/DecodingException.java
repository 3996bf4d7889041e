/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import lombok.Getter;

/**
 * The encoder rejected a stored value on {@code get}.
 *
 * <p><strong>Delivery:</strong> the value has already been popped from the store when decoding
 * fails. It is not pushed back; {@link #getRawValue()} is the only remaining copy.
 */
public class DecodingException extends StructureException {

  private static final long serialVersionUID = 1L;

  /** The raw value as it was stored. */
  @Getter private final String rawValue;

  public DecodingException(final String encoderName, final String rawValue, final Throwable cause) {
    super(
        "Encoder '" + encoderName + "' failed to decode value of length " + rawValue.length(),
        cause);
    this.rawValue = rawValue;
  }
}
