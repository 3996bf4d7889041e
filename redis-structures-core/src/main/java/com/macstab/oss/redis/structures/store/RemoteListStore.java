/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.store;

import java.time.Duration;
import java.util.Optional;

/**
 * The list operations structures need from the remote key-value store.
 *
 * <p>Every method is one atomic store operation. Nothing here spans two commands.
 *
 * <p><strong>Blocking pops:</strong> {@code timeout == null} waits without limit. An empty result
 * means the deadline passed with the list still empty.
 *
 * @see LettuceListStore
 */
public interface RemoteListStore extends AutoCloseable {

  /**
   * Verifies the store answers.
   *
   * @throws com.macstab.oss.redis.structures.ConnectivityException if it does not
   */
  void ping();

  /** Length of the list at {@code key}; 0 when the key does not exist. */
  long length(String key);

  void pushRight(String key, String value);

  Optional<String> popLeft(String key);

  Optional<String> popLeft(String key, Duration timeout);

  Optional<String> popRight(String key);

  Optional<String> popRight(String key, Duration timeout);

  /** Releases connections this store owns. Caller-owned connections are left open. */
  @Override
  void close();
}
