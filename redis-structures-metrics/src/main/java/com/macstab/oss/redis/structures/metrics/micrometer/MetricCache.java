/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics.micrometer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer counters keyed by name and tags.
 *
 * <p>Every put and get records a counter increment. Resolving the counter through the registry
 * matches tags on each call; the cache resolves it once per tag combination.
 *
 * <p><strong>Bounded:</strong> at most {@code maxCacheSize} counters are cached. Beyond that,
 * counters are resolved through the registry on every call (Micrometer returns the already
 * registered meter, so counts stay correct) and a warning is logged once.
 *
 * <p><strong>Key format:</strong> {@code metric.name:tag1=value1:tag2=value2} in the order given.
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;
  private final ConcurrentHashMap<String, Counter> counters;
  private final AtomicInteger cacheSize;
  private volatile boolean overflowLogged;

  /**
   * Creates a cache.
   *
   * @param registry meter registry
   * @param maxCacheSize maximum cached counters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(64);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or registers a counter.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter (cached or resolved through the registry)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter counter(final String name, final String description, final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return register(name, description, tagPairs);
          });
    }

    if (!overflowLogged) {
      overflowLogged = true;
      log.warn(
          "Metric cache full at {} entries, resolving counters through the registry (first: {})",
          Integer.valueOf(maxCacheSize),
          key);
    }
    return register(name, description, tagPairs);
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  private Counter register(final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }
}
