/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.store.RemoteListStore;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates queues and stacks on one {@link RemoteListStore}.
 *
 * <p><strong>Default names:</strong> a structure created without a name gets the next value of a
 * per-kind counter owned by this factory ({@code queue:0}, {@code queue:1}, {@code stack:0}, ...).
 * The counters live in the factory, not in static state, so two factories hand out the same names.
 * Names are unique within one factory only; sharing keys across processes must be avoided by
 * passing explicit names.
 *
 * <p><strong>Default namespace:</strong> {@link StructureKind#getDefaultNamespace()}.
 *
 * <p>Thread-safe.
 */
@Slf4j
public final class StructureFactory {

  @Getter private final RemoteListStore store;
  @Getter private final StructureMetrics metrics;
  private final Map<StructureKind, AtomicLong> counters;

  public StructureFactory(@NonNull final RemoteListStore store) {
    this(store, StructureMetrics.NOOP);
  }

  public StructureFactory(
      @NonNull final RemoteListStore store, @NonNull final StructureMetrics metrics) {
    this.store = store;
    this.metrics = metrics;
    this.counters = new EnumMap<>(StructureKind.class);

    for (final var kind : StructureKind.values()) {
      counters.put(kind, new AtomicLong());
    }
  }

  public RedisQueue queue() {
    return queue(nextName(StructureKind.QUEUE));
  }

  public RedisQueue queue(final String name) {
    return queue(StructureKind.QUEUE.getDefaultNamespace(), name);
  }

  public RedisQueue queue(final String namespace, final String name) {
    return new RedisQueue(StructureKey.of(namespace, name), store, metrics);
  }

  public RedisStack stack() {
    return stack(nextName(StructureKind.STACK));
  }

  public RedisStack stack(final String name) {
    return stack(StructureKind.STACK.getDefaultNamespace(), name);
  }

  public RedisStack stack(final String namespace, final String name) {
    return new RedisStack(StructureKey.of(namespace, name), store, metrics);
  }

  /**
   * Creates a structure of the given kind.
   *
   * @param kind queue or stack
   * @param namespace namespace, or {@code null} for the kind's default
   * @param name name, or {@code null} for the next generated name
   */
  public Structure<String> create(
      @NonNull final StructureKind kind, final String namespace, final String name) {
    final var resolvedNamespace = namespace != null ? namespace : kind.getDefaultNamespace();
    final var resolvedName = name != null ? name : nextName(kind);

    switch (kind) {
      case QUEUE:
        return queue(resolvedNamespace, resolvedName);
      case STACK:
        return stack(resolvedNamespace, resolvedName);
      default:
        throw new ConfigurationException("Unsupported structure kind: " + kind);
    }
  }

  private String nextName(final StructureKind kind) {
    final var name = Long.toString(counters.get(kind).getAndIncrement());
    log.debug("Generated {} name '{}'", kind, name);
    return name;
  }
}
