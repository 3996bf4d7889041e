/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import java.time.Duration;
import java.util.Optional;

/**
 * A distributed FIFO or LIFO structure backed by one remote list (or, for composites, by several).
 *
 * <p><strong>Contract:</strong>
 *
 * <ul>
 *   <li>{@link #put(Object)} appends to the right end of the list and never blocks beyond one store
 *       round trip.
 *   <li>{@link #get(boolean, Duration)} removes one item. The end it removes from is what
 *       distinguishes the variants ({@link StructureKind}).
 *   <li>{@link #size()} is the store's current length for the key. Approximate under concurrent
 *       writers: there is no snapshot isolation.
 * </ul>
 *
 * <p><strong>Thread safety:</strong> implementations hold no local mutable state beyond their
 * connection. Each individual push/pop is atomic in the store; composite operations (encode then
 * store, record route then store) are not.
 *
 * <p>Implementations compose: {@link com.macstab.oss.redis.structures.codec.EncodingDecorator}
 * wraps a structure to transform items, {@link
 * com.macstab.oss.redis.structures.multi.MultiStructure} spreads items over several structures.
 *
 * @param <T> item type seen by the caller
 */
public interface Structure<T> {

  /** Kind of the structure; composites report the kind of their children. */
  StructureKind kind();

  /** Approximate number of items currently stored. */
  long size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Remote key this structure reads and writes, when it is backed by exactly one list. Wrappers
   * report their delegate's key; composites report empty.
   */
  default Optional<StructureKey> storageKey() {
    return Optional.empty();
  }

  /**
   * Appends an item without blocking.
   *
   * @param item item to store (must not be null)
   */
  void put(T item);

  /**
   * Removes and returns an item.
   *
   * <p>{@code block=true} waits up to {@code timeout} for an item to appear, or indefinitely when
   * {@code timeout} is {@code null}. {@code block=false} attempts one immediate removal and ignores
   * {@code timeout}.
   *
   * <p>An empty result on a blocking call means the deadline passed. This is a normal outcome, not
   * an error.
   *
   * @param block whether to wait for an item
   * @param timeout maximum wait when blocking ({@code null} = no limit)
   * @return the removed item, or empty
   */
  Optional<T> get(boolean block, Duration timeout);

  /** Same as {@code get(block, null)}. */
  default Optional<T> get(final boolean block) {
    return get(block, null);
  }

  /** Blocks until an item is available. */
  default Optional<T> get() {
    return get(true, null);
  }
}
