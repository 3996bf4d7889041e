/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

/**
 * A list command was rejected by the remote store (for example {@code WRONGTYPE} when the key holds
 * a non-list value).
 */
public class StoreException extends StructureException {

  private static final long serialVersionUID = 1L;

  public StoreException(final String message) {
    super(message);
  }

  public StoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
