/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.spring3;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.structures.store.RedisConnectionSettings;

import lombok.Getter;
import lombok.Setter;

/**
 * Redis structures configuration properties.
 *
 * <pre>{@code
 * spring:
 *   data:
 *     redis:
 *       host: localhost
 *       timeout: 60s
 *       structures:
 *         enabled: true       # default
 *         blocking-slice: 10s # must be shorter than spring.data.redis.timeout
 *         blocking-connections: 8
 * }</pre>
 *
 * <p>Host, port, database, credentials, client name and command timeout come from Spring Boot's
 * standard {@code spring.data.redis.*} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "spring.data.redis.structures")
public class RedisStructuresProperties {

  /** Creates the structure store and factory beans. */
  private boolean enabled = true;

  /** Maximum length of one BLPOP/BRPOP call while a blocking get waits. */
  private Duration blockingSlice = RedisConnectionSettings.DEFAULT_BLOCKING_SLICE;

  /**
   * Maximum number of blocking gets waiting at once. Each holds a Redis connection of its own, apart
   * from the one used for puts.
   */
  private int blockingConnections = RedisConnectionSettings.DEFAULT_BLOCKING_CONNECTIONS;
}
