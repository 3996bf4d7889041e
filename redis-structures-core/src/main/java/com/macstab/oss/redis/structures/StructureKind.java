/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import lombok.Getter;

/**
 * The two structure variants. Both push onto the right end of the list; they differ only in the
 * end {@code get} pops from.
 */
@Getter
public enum StructureKind {
  /** First in, first out: pops the left end. */
  QUEUE("queue", ListEnd.LEFT),

  /** Last in, first out: pops the right end. */
  STACK("stack", ListEnd.RIGHT);

  /** Namespace used when the caller does not supply one. */
  private final String defaultNamespace;

  private final ListEnd popEnd;

  StructureKind(final String defaultNamespace, final ListEnd popEnd) {
    this.defaultNamespace = defaultNamespace;
    this.popEnd = popEnd;
  }
}
