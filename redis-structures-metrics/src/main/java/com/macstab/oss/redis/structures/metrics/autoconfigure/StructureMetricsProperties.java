/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.structures.metrics.micrometer.MetricsConfiguration;

import lombok.Data;

/**
 * Configuration properties for structure metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     redis-structures:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.redis-structures")
public class StructureMetricsProperties {

  /** Enable Micrometer metrics. When disabled, {@code StructureMetrics.NOOP} is used. */
  private boolean enabled = true;

  /**
   * Maximum cached counters. Counters beyond this are still recorded, through a registry lookup
   * per call.
   */
  private int maxCacheSize = MetricsConfiguration.DEFAULT_MAX_CACHE_SIZE;
}
