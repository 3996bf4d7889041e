/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.redis.structures.store.RemoteListStore;

/** End of a remote list that items are removed from. */
public enum ListEnd {
  LEFT {
    @Override
    Optional<String> pop(
        final RemoteListStore store, final String key, final boolean block, final Duration timeout) {
      return block ? store.popLeft(key, timeout) : store.popLeft(key);
    }
  },

  RIGHT {
    @Override
    Optional<String> pop(
        final RemoteListStore store, final String key, final boolean block, final Duration timeout) {
      return block ? store.popRight(key, timeout) : store.popRight(key);
    }
  };

  abstract Optional<String> pop(
      RemoteListStore store, String key, boolean block, Duration timeout);
}
