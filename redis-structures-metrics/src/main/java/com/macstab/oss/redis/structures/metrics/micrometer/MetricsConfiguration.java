/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys.
 *
 * <p>Prometheus output (dots become underscores, counters get {@code _total}):
 *
 * <pre>
 * redis.structures.puts           → redis_structures_puts_total
 * redis.structures.gets           → redis_structures_gets_total
 * redis.structures.codec.failures → redis_structures_codec_failures_total
 * redis.structures.routing        → redis_structures_routing_total
 * </pre>
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "redis.structures";

  /** Counter. Tags: {@code namespace}, {@code kind}. */
  public static final String PUTS = PREFIX + ".puts";

  /** Counter. Tags: {@code namespace}, {@code kind}, {@code result} ({@code hit|miss}). */
  public static final String GETS = PREFIX + ".gets";

  /** Counter. Tags: {@code encoder}, {@code phase} ({@code encode|decode}). */
  public static final String CODEC_FAILURES = PREFIX + ".codec.failures";

  /**
   * Counter. Tags: {@code structure.name}, {@code child.index}.
   *
   * <p>Uneven counts across child indexes show a skewed hash or a skewed read strategy.
   */
  public static final String ROUTING = PREFIX + ".routing";

  public static final String TAG_NAMESPACE = "namespace";
  public static final String TAG_KIND = "kind";
  public static final String TAG_RESULT = "result";
  public static final String TAG_ENCODER = "encoder";
  public static final String TAG_PHASE = "phase";
  public static final String TAG_STRUCTURE_NAME = "structure.name";
  public static final String TAG_CHILD_INDEX = "child.index";

  public static final String RESULT_HIT = "hit";
  public static final String RESULT_MISS = "miss";

  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;
}
