/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.store.RemoteListStore;

import lombok.NonNull;

/**
 * Raw string stack over one remote list: {@code put} pushes right, {@code get} pops right, which
 * gives last-in-first-out order per key.
 *
 * <p>Items are stored as given. Wrap in an {@link
 * com.macstab.oss.redis.structures.codec.EncodingDecorator} to store anything other than strings.
 *
 * @see RedisQueue
 * @see StructureFactory
 */
public final class RedisStack implements Structure<String> {

  private final ListStructure list;

  /**
   * Creates a stack on {@code key} and verifies the store answers.
   *
   * @throws ConnectivityException if the store is unreachable
   */
  public RedisStack(@NonNull final StructureKey key, @NonNull final RemoteListStore store) {
    this(key, store, StructureMetrics.NOOP);
  }

  public RedisStack(
      @NonNull final StructureKey key,
      @NonNull final RemoteListStore store,
      @NonNull final StructureMetrics metrics) {
    this.list = new ListStructure(StructureKind.STACK, key, store, metrics);
  }

  public StructureKey getKey() {
    return list.getKey();
  }

  @Override
  public Optional<StructureKey> storageKey() {
    return Optional.of(list.getKey());
  }

  @Override
  public StructureKind kind() {
    return StructureKind.STACK;
  }

  @Override
  public long size() {
    return list.size();
  }

  @Override
  public void put(final String item) {
    list.put(item);
  }

  @Override
  public Optional<String> get(final boolean block, final Duration timeout) {
    return list.get(block, timeout);
  }

  @Override
  public String toString() {
    return "RedisStack[" + list.getKey() + "]";
  }
}
