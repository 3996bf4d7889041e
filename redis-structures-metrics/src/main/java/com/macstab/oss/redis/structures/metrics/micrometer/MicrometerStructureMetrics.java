/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics.micrometer;

import static com.macstab.oss.redis.structures.metrics.micrometer.MetricsConfiguration.*;

import com.macstab.oss.redis.structures.StructureKind;
import com.macstab.oss.redis.structures.metrics.StructureMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link StructureMetrics}.
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr>
 *       <td>{@code redis.structures.puts}</td>
 *       <td>Counter</td>
 *       <td>namespace, kind</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.structures.gets}</td>
 *       <td>Counter</td>
 *       <td>namespace, kind, result</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.structures.codec.failures}</td>
 *       <td>Counter</td>
 *       <td>encoder, phase</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.structures.routing}</td>
 *       <td>Counter</td>
 *       <td>structure.name, child.index</td>
 *     </tr>
 *   </tbody>
 * </table>
 *
 * <p>Counters are cached in a {@link MetricCache}. Thread-safe.
 */
@Slf4j
public final class MicrometerStructureMetrics implements StructureMetrics {

  private final MetricCache cache;

  public MicrometerStructureMetrics(
      @NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);

    log.debug("Created MicrometerStructureMetrics (maxCacheSize: {})", Integer.valueOf(maxCacheSize));
  }

  public MicrometerStructureMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordPut(final String namespace, final StructureKind kind) {
    cache
        .counter(PUTS, "Items pushed to structures", TAG_NAMESPACE, namespace, TAG_KIND, tag(kind))
        .increment();
  }

  @Override
  public void recordGet(final String namespace, final StructureKind kind, final boolean hit) {
    cache
        .counter(
            GETS,
            "Pop attempts on structures",
            TAG_NAMESPACE,
            namespace,
            TAG_KIND,
            tag(kind),
            TAG_RESULT,
            hit ? RESULT_HIT : RESULT_MISS)
        .increment();
  }

  @Override
  public void recordCodecFailure(final String encoderName, final String phase) {
    cache
        .counter(
            CODEC_FAILURES,
            "Values that failed to encode or decode",
            TAG_ENCODER,
            encoderName,
            TAG_PHASE,
            phase)
        .increment();
  }

  @Override
  public void recordRouting(final String structureName, final int childIndex) {
    if (childIndex < 0) {
      log.warn("Invalid child index: {} (negative), skipping metric", Integer.valueOf(childIndex));
      return;
    }

    cache
        .counter(
            ROUTING,
            "Multi-structure routing decisions per child",
            TAG_STRUCTURE_NAME,
            structureName,
            TAG_CHILD_INDEX,
            Integer.toString(childIndex))
        .increment();
  }

  private static String tag(final StructureKind kind) {
    return kind == null ? "unknown" : kind.getDefaultNamespace();
  }
}
