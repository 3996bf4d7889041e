/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import lombok.Getter;

/**
 * The encoder rejected an item on {@code put}. The item never reached the store.
 */
public class EncodingException extends StructureException {

  private static final long serialVersionUID = 1L;

  /** The item that could not be encoded. */
  @Getter private final transient Object item;

  public EncodingException(final String encoderName, final Object item, final Throwable cause) {
    super("Encoder '" + encoderName + "' failed to encode item of type " + typeOf(item), cause);
    this.item = item;
  }

  private static String typeOf(final Object item) {
    return item == null ? "null" : item.getClass().getName();
  }
}
