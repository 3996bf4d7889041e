/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.metrics;

import com.macstab.oss.redis.structures.StructureKind;

/**
 * Metrics sink for structure operations.
 *
 * <p><strong>Optional dependency:</strong> core has no Micrometer dependency. Every method is a
 * no-op by default, so {@link #NOOP} costs nothing and the JIT removes the calls. The Micrometer
 * implementation lives in {@code redis-structures-metrics}.
 *
 * <p><strong>Cardinality:</strong> operations are tagged by namespace, never by full key. A
 * process may create thousands of structures in one namespace; tagging by key would create a
 * meter per structure.
 *
 * <p>Implementations MUST be thread-safe and MUST NOT throw.
 */
public interface StructureMetrics {

  StructureMetrics NOOP = new StructureMetrics() {};

  /**
   * Records one successful push.
   *
   * @param namespace namespace of the structure
   * @param kind structure kind
   */
  default void recordPut(String namespace, StructureKind kind) {
    // No-op by default
  }

  /**
   * Records one pop attempt.
   *
   * @param namespace namespace of the structure
   * @param kind structure kind
   * @param hit whether an item was returned (false on empty list or timeout)
   */
  default void recordGet(String namespace, StructureKind kind, boolean hit) {
    // No-op by default
  }

  /**
   * Records an encoder failure.
   *
   * @param encoderName {@link com.macstab.oss.redis.structures.codec.Encoder#getName()}
   * @param phase {@code "encode"} or {@code "decode"}
   */
  default void recordCodecFailure(String encoderName, String phase) {
    // No-op by default
  }

  /**
   * Records which child a multi-structure routed a put or get to.
   *
   * @param structureName name of the multi-structure
   * @param childIndex selected child (0-based)
   */
  default void recordRouting(String structureName, int childIndex) {
    // No-op by default
  }
}
