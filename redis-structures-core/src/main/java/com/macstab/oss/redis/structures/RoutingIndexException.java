/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import lombok.Getter;

/**
 * A multi-structure produced or read a child index outside {@code [0, childCount)}, or an order
 * record that is not a decimal integer. Internal invariant violation, never clamped.
 */
public class RoutingIndexException extends StructureException {

  private static final long serialVersionUID = 1L;

  /** The offending index as read or computed. */
  @Getter private final String rawIndex;

  public RoutingIndexException(final String rawIndex, final int childCount) {
    super("Routing index '" + rawIndex + "' outside [0, " + childCount + ")");
    this.rawIndex = rawIndex;
  }

  public RoutingIndexException(
      final String rawIndex, final int childCount, final Throwable cause) {
    super("Routing index '" + rawIndex + "' is not a valid child index for " + childCount, cause);
    this.rawIndex = rawIndex;
  }
}
