/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

/**
 * Invalid construction arguments: blank key parts, too few children, mixed structure kinds,
 * inconsistent connection settings. Never silently corrected.
 */
public class ConfigurationException extends StructureException {

  private static final long serialVersionUID = 1L;

  public ConfigurationException(final String message) {
    super(message);
  }
}
