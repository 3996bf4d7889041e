/* (C)2026 Macstab GmbH */

/**
 * Micrometer binding of {@link com.macstab.oss.redis.structures.metrics.StructureMetrics}.
 *
 * <p>Usable without Spring:
 *
 * <pre>{@code
 * StructureFactory factory =
 *     new StructureFactory(store, new MicrometerStructureMetrics(meterRegistry));
 * }</pre>
 *
 * @since 1.0.0
 */
package com.macstab.oss.redis.structures.metrics.micrometer;
