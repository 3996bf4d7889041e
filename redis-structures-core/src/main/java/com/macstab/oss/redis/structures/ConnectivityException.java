/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

/**
 * The remote store is unreachable or did not answer in time.
 *
 * <p>Raised at construction when the liveness check ({@code PING}) fails, and during operations
 * when the connection drops or a command times out. Fatal for the call: no reconnect or retry is
 * attempted at this layer.
 */
public class ConnectivityException extends StoreException {

  private static final long serialVersionUID = 1L;

  public ConnectivityException(final String message) {
    super(message);
  }

  public ConnectivityException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
