/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.spring3;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import com.macstab.oss.redis.structures.StructureFactory;
import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.store.LettuceListStore;
import com.macstab.oss.redis.structures.store.RedisConnectionSettings;
import com.macstab.oss.redis.structures.store.RemoteListStore;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for Redis-backed queues and stacks.
 *
 * <p>Active unless {@code spring.data.redis.structures.enabled=false}. Creates:
 *
 * <ul>
 *   <li>{@link RedisConnectionSettings} from {@code spring.data.redis.*} ({@code url} overrides
 *       host, port, database and credentials)
 *   <li>{@link LettuceListStore} with its own Lettuce client and connection, closed on shutdown
 *   <li>{@link StructureFactory} over the store, using the {@link StructureMetrics} bean when one
 *       exists
 * </ul>
 *
 * <p>Each bean backs off when the application defines its own. The store connects eagerly, so an
 * unreachable Redis fails startup with a {@code ConnectivityException}.
 *
 * <pre>{@code
 * @Service
 * class Jobs {
 *   private final RedisQueue queue;
 *
 *   Jobs(StructureFactory factory) {
 *     this.queue = factory.queue("jobs");
 *   }
 * }
 * }</pre>
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.redis.structures.metrics.autoconfigure.StructureMetricsAutoConfiguration")
@ConditionalOnClass(RedisClient.class)
@ConditionalOnProperty(
    prefix = "spring.data.redis.structures",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties({RedisProperties.class, RedisStructuresProperties.class})
public class RedisStructuresAutoConfiguration {

  /**
   * Maps Spring Boot Redis properties to store settings.
   *
   * @throws com.macstab.oss.redis.structures.ConfigurationException if the blocking slice is not
   *     shorter than {@code spring.data.redis.timeout}
   */
  @Bean
  @ConditionalOnMissingBean(RedisConnectionSettings.class)
  public RedisConnectionSettings redisStructuresConnectionSettings(
      final RedisProperties redisProperties, final RedisStructuresProperties properties) {

    final var builder = RedisConnectionSettings.builder();

    if (StringUtils.hasText(redisProperties.getUrl())) {
      applyUrl(builder, redisProperties.getUrl());
    } else {
      builder
          .host(redisProperties.getHost())
          .port(redisProperties.getPort())
          .database(redisProperties.getDatabase());

      if (StringUtils.hasText(redisProperties.getUsername())) {
        builder.username(redisProperties.getUsername());
      }
      if (StringUtils.hasText(redisProperties.getPassword())) {
        builder.password(redisProperties.getPassword());
      }
    }

    if (redisProperties.getTimeout() != null) {
      builder.commandTimeout(redisProperties.getTimeout());
    }
    if (StringUtils.hasText(redisProperties.getClientName())) {
      builder.clientName(redisProperties.getClientName());
    }
    if (properties.getBlockingSlice() != null) {
      builder.blockingSlice(properties.getBlockingSlice());
    }
    builder.blockingConnections(properties.getBlockingConnections());

    final var settings = builder.build();
    settings.validate();
    return settings;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(RemoteListStore.class)
  public LettuceListStore redisStructuresListStore(final RedisConnectionSettings settings) {
    return LettuceListStore.connect(settings);
  }

  @Bean
  @ConditionalOnMissingBean(StructureFactory.class)
  public StructureFactory structureFactory(
      final RemoteListStore store, final ObjectProvider<StructureMetrics> metricsProvider) {

    final var metrics = metricsProvider.getIfAvailable(() -> StructureMetrics.NOOP);

    if (log.isInfoEnabled()) {
      log.info(
          "Redis structures enabled: store={}, metrics={}",
          store.getClass().getSimpleName(),
          metrics == StructureMetrics.NOOP ? "disabled" : "enabled");
    }

    return new StructureFactory(store, metrics);
  }

  @SuppressWarnings("deprecation") // Lettuce RedisURI credential getters
  private static void applyUrl(
      final RedisConnectionSettings.RedisConnectionSettingsBuilder builder, final String url) {
    final RedisURI uri = RedisURI.create(url);

    builder.host(uri.getHost()).port(uri.getPort()).database(uri.getDatabase());

    if (uri.getUsername() != null) {
      builder.username(uri.getUsername());
    }
    if (uri.getPassword() != null && uri.getPassword().length > 0) {
      builder.password(new String(uri.getPassword()));
    }
  }
}
