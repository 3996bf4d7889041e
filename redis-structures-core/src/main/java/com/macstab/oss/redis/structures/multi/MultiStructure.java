/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.multi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.macstab.oss.redis.structures.ConfigurationException;
import com.macstab.oss.redis.structures.RoutingIndexException;
import com.macstab.oss.redis.structures.Structure;
import com.macstab.oss.redis.structures.StructureKey;
import com.macstab.oss.redis.structures.StructureKind;
import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.strategy.ChildSelectionStrategy;
import com.macstab.oss.redis.structures.strategy.RandomStrategy;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Several structures of one kind behind a single {@link Structure}.
 *
 * <p><strong>Load-balancing mode</strong> ({@link #loadBalancing(List)}): {@code put} routes to
 * {@code children[floorMod(hash(item), n)]}; {@code get} reads from a child chosen by a {@link
 * ChildSelectionStrategy} (uniformly random by default). Reads do not reverse the write routing,
 * so a get may return an item other than the one a particular put stored, and FIFO/LIFO order is
 * only kept per child. {@link #size()} is always exact.
 *
 * <p><strong>Preserving mode</strong> ({@link #preserving(Structure, List)}): an extra order
 * structure records, per put, the decimal index of the child that received the item:
 *
 * <pre>
 * put(x):  order.put("1")      then children[1].put(x)
 * get():   order.get() → "1"   then children[1].get()
 * </pre>
 *
 * <p>The order structure has the same kind as the children, so its pop order (FIFO or LIFO)
 * replays the routing decisions in the order the children's pop order needs. The result is the
 * same item order a single structure of that kind would give.
 *
 * <p><strong>Not atomic:</strong> the two writes of a preserving put (and the two pops of a get)
 * are separate store commands. A crash between them leaves a routing record without a payload (get
 * then returns empty and logs a warning) or a payload without a record (never read through this
 * instance). Blocking gets in preserving mode may wait up to twice {@code timeout}: once on the
 * order structure, once on the child.
 *
 * <p><strong>Validation (construction):</strong> at least two data children; all data children,
 * and the order structure, of one kind; the order structure is not also a data child.
 * Violations raise {@link ConfigurationException}.
 *
 * @param <T> item type
 */
@Slf4j
public final class MultiStructure<T> implements Structure<T> {

  public static final String DEFAULT_NAME = "multi";

  private static final int MIN_CHILDREN = 2;

  @Getter private final String name;
  private final List<Structure<T>> children;
  private final Structure<String> orderStructure;
  private final ItemHasher<? super T> hasher;
  @Getter private final ChildSelectionStrategy strategy;
  private final StructureMetrics metrics;
  private final StructureKind kind;

  /**
   * Creates a multi-structure.
   *
   * @param name name for logs and metrics (default {@value #DEFAULT_NAME})
   * @param children data children (at least 2, one kind)
   * @param orderStructure order structure; {@code null} selects load-balancing mode
   * @param hasher put routing hash (default {@link ItemHasher#murmur3()})
   * @param strategy read routing in load-balancing mode (default {@link RandomStrategy})
   * @param metrics metrics sink (default {@link StructureMetrics#NOOP})
   * @throws ConfigurationException if the children are invalid
   */
  @Builder
  private MultiStructure(
      final String name,
      final List<? extends Structure<T>> children,
      final Structure<String> orderStructure,
      final ItemHasher<? super T> hasher,
      final ChildSelectionStrategy strategy,
      final StructureMetrics metrics) {

    this.name = name != null ? name : DEFAULT_NAME;
    this.children = validateChildren(children, orderStructure);
    this.orderStructure = orderStructure;
    this.hasher = hasher != null ? hasher : ItemHasher.murmur3();
    this.strategy = strategy != null ? strategy : new RandomStrategy();
    this.metrics = metrics != null ? metrics : StructureMetrics.NOOP;
    this.kind = this.children.get(0).kind();

    if (orderStructure != null && orderStructure.kind() != kind) {
      throw new ConfigurationException(
          "Order structure is a "
              + orderStructure.kind()
              + " but data children are "
              + kind
              + "; replaying routing records needs the same pop order");
    }

    if (log.isInfoEnabled()) {
      log.info(
          "Created MultiStructure '{}' with {} {} children ({})",
          this.name,
          Integer.valueOf(this.children.size()),
          kind,
          isPreserving() ? "order-preserving" : "load-balancing, reads via " + this.strategy.getName());
    }
  }

  /** Load-balancing mode with MurmurHash3 puts and random gets. */
  public static <T> MultiStructure<T> loadBalancing(
      @NonNull final List<? extends Structure<T>> children) {
    return MultiStructure.<T>builder().children(children).build();
  }

  public static <T> MultiStructure<T> loadBalancing(
      @NonNull final List<? extends Structure<T>> children,
      @NonNull final ItemHasher<? super T> hasher,
      @NonNull final ChildSelectionStrategy strategy) {
    return MultiStructure.<T>builder().children(children).hasher(hasher).strategy(strategy).build();
  }

  /** Preserving mode: {@code order} records the routing of every put. */
  public static <T> MultiStructure<T> preserving(
      @NonNull final Structure<String> order,
      @NonNull final List<? extends Structure<T>> children) {
    return MultiStructure.<T>builder().orderStructure(order).children(children).build();
  }

  public static <T> MultiStructure<T> preserving(
      @NonNull final Structure<String> order,
      @NonNull final List<? extends Structure<T>> children,
      @NonNull final ItemHasher<? super T> hasher) {
    return MultiStructure.<T>builder()
        .orderStructure(order)
        .children(children)
        .hasher(hasher)
        .build();
  }

  /**
   * Preserving mode over string structures: the first structure becomes the order structure, the
   * rest are data children. Needs at least three.
   */
  public static MultiStructure<String> preserving(
      @NonNull final List<? extends Structure<String>> structures) {
    if (structures.size() < MIN_CHILDREN + 1) {
      throw new ConfigurationException(
          "Preserving mode needs an order structure plus at least "
              + MIN_CHILDREN
              + " data structures, got "
              + structures.size()
              + " structures");
    }
    return preserving(structures.get(0), structures.subList(1, structures.size()));
  }

  public boolean isPreserving() {
    return orderStructure != null;
  }

  /** Data children in routing order. Unmodifiable. */
  public List<Structure<T>> getChildren() {
    return children;
  }

  public Optional<Structure<String>> getOrderStructure() {
    return Optional.ofNullable(orderStructure);
  }

  @Override
  public StructureKind kind() {
    return kind;
  }

  /** Sum of the data children's sizes. Routing records in the order structure are not counted. */
  @Override
  public long size() {
    long total = 0;
    for (final var child : children) {
      total += child.size();
    }
    return total;
  }

  @Override
  public void put(@NonNull final T item) {
    final var index = Math.floorMod(hasher.hash(item), children.size());
    checkIndex(index);

    if (orderStructure != null) {
      orderStructure.put(Integer.toString(index));
    }

    children.get(index).put(item);
    metrics.recordRouting(name, index);
  }

  @Override
  public Optional<T> get(final boolean block, final Duration timeout) {
    return orderStructure != null ? getRecorded(block, timeout) : getBalanced(block, timeout);
  }

  @Override
  public String toString() {
    return "MultiStructure["
        + name
        + ", "
        + (isPreserving() ? "preserving" : "load-balancing")
        + ", children="
        + children
        + "]";
  }

  // ==================== Private Methods ====================

  private Optional<T> getRecorded(final boolean block, final Duration timeout) {
    final var record = orderStructure.get(block, timeout);
    if (record.isEmpty()) {
      return Optional.empty();
    }

    final var index = parseIndex(record.get());
    final var item = children.get(index).get(block, timeout);

    if (item.isEmpty()) {
      log.warn(
          "MultiStructure '{}': routing record points to child {} but it returned no item",
          name,
          Integer.valueOf(index));
    } else {
      metrics.recordRouting(name, index);
    }
    return item;
  }

  private Optional<T> getBalanced(final boolean block, final Duration timeout) {
    final var index = strategy.selectChild(children.size());
    checkIndex(index);

    final var item = children.get(index).get(block, timeout);
    if (item.isPresent()) {
      metrics.recordRouting(name, index);
    }
    return item;
  }

  private int parseIndex(final String record) {
    final int index;
    try {
      index = Integer.parseInt(record.trim());
    } catch (final NumberFormatException ex) {
      throw new RoutingIndexException(record, children.size(), ex);
    }
    checkIndex(index);
    return index;
  }

  private void checkIndex(final int index) {
    if (index < 0 || index >= children.size()) {
      throw new RoutingIndexException(Integer.toString(index), children.size());
    }
  }

  private static <T> List<Structure<T>> validateChildren(
      final List<? extends Structure<T>> children, final Structure<String> orderStructure) {

    if (children == null || children.isEmpty()) {
      throw new ConfigurationException("MultiStructure needs child structures, got none");
    }

    if (children.size() < MIN_CHILDREN) {
      throw new ConfigurationException(
          (orderStructure != null
                  ? "Preserving mode needs an order structure plus at least "
                  : "Load-balancing mode needs at least ")
              + MIN_CHILDREN
              + " data structures, got "
              + children.size());
    }

    final List<Structure<T>> copy = new ArrayList<>(children.size());
    final Set<StructureKey> childKeys = new HashSet<>();
    final Optional<StructureKey> orderKey =
        orderStructure != null ? orderStructure.storageKey() : Optional.empty();
    StructureKind expected = null;

    for (final Structure<T> child : children) {
      if (child == null) {
        throw new ConfigurationException("Child structures must not be null");
      }
      if ((Object) child == orderStructure) {
        throw new ConfigurationException("Order structure must not also be a data child");
      }
      final Optional<StructureKey> childKey = child.storageKey();
      if (childKey.isPresent()) {
        if (childKey.equals(orderKey)) {
          throw new ConfigurationException(
              "Order structure and data child share the key '" + childKey.get() + "'");
        }
        if (!childKeys.add(childKey.get())) {
          throw new ConfigurationException(
              "Data children share the key '" + childKey.get() + "'");
        }
      }
      if (expected == null) {
        expected = child.kind();
      } else if (child.kind() != expected) {
        throw new ConfigurationException(
            "All child structures must be of one kind, got " + expected + " and " + child.kind());
      }
      copy.add(child);
    }

    return Collections.unmodifiableList(copy);
  }
}
