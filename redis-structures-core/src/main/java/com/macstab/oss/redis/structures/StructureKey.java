/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Immutable list key of a structure: {@code <namespace>:<name>}.
 *
 * <p><strong>Compatibility:</strong> the key string is the only persisted format. Separator and
 * ordering must stay exactly as they are to reach lists written by earlier clients.
 *
 * <p>Uniqueness of {@code (namespace, name)} pairs is the caller's responsibility. Two structures
 * built with the same key share one list.
 */
@Getter
@EqualsAndHashCode
public final class StructureKey {

  public static final char SEPARATOR = ':';

  private final String namespace;
  private final String name;

  private StructureKey(final String namespace, final String name) {
    this.namespace = namespace;
    this.name = name;
  }

  public static StructureKey of(@NonNull final String namespace, @NonNull final String name) {
    if (namespace.isBlank()) {
      throw new ConfigurationException("namespace must not be blank");
    }
    if (name.isBlank()) {
      throw new ConfigurationException("name must not be blank");
    }
    return new StructureKey(namespace, name);
  }

  /** The list key as stored: {@code namespace + ":" + name}. */
  @Override
  public String toString() {
    return namespace + SEPARATOR + name;
  }
}
