/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.metrics.micrometer.MicrometerStructureMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for structure metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath
 *   <li>{@code MeterRegistry} bean exists
 *   <li>{@code management.metrics.redis-structures.enabled=true} (default: true)
 * </ol>
 *
 * <p>Otherwise {@link StructureMetrics#NOOP} is registered. A user-defined {@link
 * StructureMetrics} bean always wins.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(StructureMetricsProperties.class)
public class StructureMetricsAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.redis-structures",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(StructureMetrics.class)
  public StructureMetrics micrometerStructureMetrics(
      final MeterRegistry registry, final StructureMetricsProperties properties) {

    log.info(
        "Activating Redis structure metrics (Micrometer) - maxCacheSize: {}",
        Integer.valueOf(properties.getMaxCacheSize()));

    return new MicrometerStructureMetrics(registry, properties.getMaxCacheSize());
  }

  /** Fallback when metrics are disabled or no registry exists. */
  @Bean
  @ConditionalOnMissingBean(StructureMetrics.class)
  public StructureMetrics noOpStructureMetrics() {
    log.debug("Redis structure metrics disabled - using NOOP");
    return StructureMetrics.NOOP;
  }
}
