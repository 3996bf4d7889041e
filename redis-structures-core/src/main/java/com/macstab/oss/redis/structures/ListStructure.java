/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.store.RemoteListStore;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * List operations shared by {@link RedisQueue} and {@link RedisStack}. Composed, not inherited:
 * the variants hold one of these and differ only in {@link StructureKind#getPopEnd()}.
 */
@Slf4j
final class ListStructure {

  @Getter private final StructureKind kind;
  @Getter private final StructureKey key;
  private final String listKey;
  private final RemoteListStore store;
  private final StructureMetrics metrics;

  ListStructure(
      @NonNull final StructureKind kind,
      @NonNull final StructureKey key,
      @NonNull final RemoteListStore store,
      @NonNull final StructureMetrics metrics) {
    this.kind = kind;
    this.key = key;
    this.listKey = key.toString();
    this.store = store;
    this.metrics = metrics;

    store.ping();

    log.debug("Created {} on list '{}'", kind, listKey);
  }

  long size() {
    return store.length(listKey);
  }

  void put(@NonNull final String item) {
    store.pushRight(listKey, item);
    metrics.recordPut(key.getNamespace(), kind);
  }

  Optional<String> get(final boolean block, final Duration timeout) {
    final var item = kind.getPopEnd().pop(store, listKey, block, timeout);
    metrics.recordGet(key.getNamespace(), kind, item.isPresent());
    return item;
  }
}
