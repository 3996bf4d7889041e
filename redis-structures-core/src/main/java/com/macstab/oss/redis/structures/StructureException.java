/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

/**
 * Base type of every failure raised by this library.
 *
 * <p>All subtypes are unchecked. No layer retries: the exception reaches the immediate caller, who
 * owns the retry policy.
 *
 * @see ConnectivityException
 * @see ConfigurationException
 * @see EncodingException
 * @see DecodingException
 * @see RoutingIndexException
 */
public abstract class StructureException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected StructureException(final String message) {
    super(message);
  }

  protected StructureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
