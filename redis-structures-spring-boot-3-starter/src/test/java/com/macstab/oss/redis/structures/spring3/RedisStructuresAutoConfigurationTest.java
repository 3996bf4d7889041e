/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.spring3;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.redis.structures.ConfigurationException;
import com.macstab.oss.redis.structures.StructureFactory;
import com.macstab.oss.redis.structures.metrics.StructureMetrics;
import com.macstab.oss.redis.structures.metrics.autoconfigure.StructureMetricsAutoConfiguration;
import com.macstab.oss.redis.structures.metrics.micrometer.MicrometerStructureMetrics;
import com.macstab.oss.redis.structures.store.InMemoryListStore;
import com.macstab.oss.redis.structures.store.LettuceListStore;
import com.macstab.oss.redis.structures.store.RedisConnectionSettings;
import com.macstab.oss.redis.structures.store.RemoteListStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link RedisStructuresAutoConfiguration} without a Redis server.
 *
 * <p>A user-defined in-memory {@link RemoteListStore} replaces the Lettuce store, so property
 * mapping and bean wiring are verified without connecting.
 */
@DisplayName("RedisStructuresAutoConfiguration")
class RedisStructuresAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(RedisStructuresAutoConfiguration.class))
          .withUserConfiguration(InMemoryStoreConfiguration.class);

  @Nested
  @DisplayName("Bean wiring")
  class BeanWiring {

    @Test
    @DisplayName("Should create a StructureFactory over the user-defined store")
    void shouldCreateFactoryOverUserStore() {
      // Arrange & Act
      contextRunner.run(
          context -> {
            // Assert
            assertThat(context).hasSingleBean(StructureFactory.class);
            assertThat(context).doesNotHaveBean(LettuceListStore.class);

            final var factory = context.getBean(StructureFactory.class);
            assertThat(factory.getStore()).isSameAs(context.getBean(RemoteListStore.class));
            assertThat(factory.getMetrics()).isSameAs(StructureMetrics.NOOP);
          });
    }

    @Test
    @DisplayName("Should produce working structures")
    void shouldProduceWorkingStructures() {
      contextRunner.run(
          context -> {
            // Arrange
            final var queue = context.getBean(StructureFactory.class).queue("jobs");

            // Act
            queue.put("job-1");

            // Assert
            assertThat(context.getBean(InMemoryListStore.class).contents("queue:jobs"))
                .containsExactly("job-1");
            assertThat(queue.get(false)).contains("job-1");
          });
    }

    @Test
    @DisplayName("Should use Micrometer metrics when the metrics auto-configuration is active")
    void shouldUseMicrometerMetrics() {
      // Arrange & Act
      contextRunner
          .withConfiguration(AutoConfigurations.of(StructureMetricsAutoConfiguration.class))
          .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
          .run(
              context -> {
                // Assert
                assertThat(context.getBean(StructureFactory.class).getMetrics())
                    .isInstanceOf(MicrometerStructureMetrics.class);
              });
    }

    @Test
    @DisplayName("Should back off when the user defines a StructureFactory")
    void shouldBackOffForUserFactory() {
      contextRunner
          .withBean(
              "customFactory",
              StructureFactory.class,
              () -> new StructureFactory(new InMemoryListStore()))
          .run(
              context -> {
                assertThat(context).hasSingleBean(StructureFactory.class);
                assertThat(context).hasBean("customFactory");
              });
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldCreateNothingWhenDisabled() {
      // Arrange & Act
      contextRunner
          .withPropertyValues("spring.data.redis.structures.enabled=false")
          .run(
              context -> {
                // Assert
                assertThat(context).doesNotHaveBean(StructureFactory.class);
                assertThat(context).doesNotHaveBean(RedisConnectionSettings.class);
              });
    }
  }

  @Nested
  @DisplayName("Property mapping")
  class PropertyMapping {

    @Test
    @DisplayName("Should map spring.data.redis properties to connection settings")
    void shouldMapStandardProperties() {
      // Arrange & Act
      contextRunner
          .withPropertyValues(
              "spring.data.redis.host=redis.internal",
              "spring.data.redis.port=6380",
              "spring.data.redis.database=4",
              "spring.data.redis.username=app",
              "spring.data.redis.password=secret",
              "spring.data.redis.timeout=20s",
              "spring.data.redis.client-name=orders-service",
              "spring.data.redis.structures.blocking-slice=5s",
              "spring.data.redis.structures.blocking-connections=3")
          .run(
              context -> {
                // Assert
                final var settings = context.getBean(RedisConnectionSettings.class);
                assertThat(settings.getHost()).isEqualTo("redis.internal");
                assertThat(settings.getPort()).isEqualTo(6380);
                assertThat(settings.getDatabase()).isEqualTo(4);
                assertThat(settings.getUsername()).isEqualTo("app");
                assertThat(settings.getPassword()).isEqualTo("secret");
                assertThat(settings.getCommandTimeout()).isEqualTo(Duration.ofSeconds(20));
                assertThat(settings.getClientName()).isEqualTo("orders-service");
                assertThat(settings.getBlockingSlice()).isEqualTo(Duration.ofSeconds(5));
                assertThat(settings.getBlockingConnections()).isEqualTo(3);
              });
    }

    @Test
    @DisplayName("Should keep defaults when nothing is configured")
    void shouldKeepDefaults() {
      contextRunner.run(
          context -> {
            final var settings = context.getBean(RedisConnectionSettings.class);
            assertThat(settings.getHost()).isEqualTo("localhost");
            assertThat(settings.getPort()).isEqualTo(6379);
            assertThat(settings.getCommandTimeout())
                .isEqualTo(RedisConnectionSettings.DEFAULT_COMMAND_TIMEOUT);
            assertThat(settings.getBlockingSlice())
                .isEqualTo(RedisConnectionSettings.DEFAULT_BLOCKING_SLICE);
            assertThat(settings.getBlockingConnections())
                .isEqualTo(RedisConnectionSettings.DEFAULT_BLOCKING_CONNECTIONS);
          });
    }

    @Test
    @DisplayName("Should let spring.data.redis.url override individual properties")
    void shouldApplyUrl() {
      // Arrange & Act
      contextRunner
          .withPropertyValues(
              "spring.data.redis.url=redis://:pw@cache.internal:6390/2",
              "spring.data.redis.host=ignored")
          .run(
              context -> {
                // Assert
                final var settings = context.getBean(RedisConnectionSettings.class);
                assertThat(settings.getHost()).isEqualTo("cache.internal");
                assertThat(settings.getPort()).isEqualTo(6390);
                assertThat(settings.getDatabase()).isEqualTo(2);
                assertThat(settings.getPassword()).isEqualTo("pw");
              });
    }

    @Test
    @DisplayName("Should fail startup when the blocking slice is not shorter than the timeout")
    void shouldFailOnSliceLongerThanTimeout() {
      // Arrange & Act
      contextRunner
          .withPropertyValues(
              "spring.data.redis.timeout=5s", "spring.data.redis.structures.blocking-slice=5s")
          .run(
              context -> {
                // Assert
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(ConfigurationException.class);
              });
    }

    @Test
    @DisplayName("Should fail startup when no blocking connections are allowed")
    void shouldFailOnZeroBlockingConnections() {
      contextRunner
          .withPropertyValues("spring.data.redis.structures.blocking-connections=0")
          .run(
              context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(ConfigurationException.class);
              });
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class InMemoryStoreConfiguration {
    @Bean
    InMemoryListStore inMemoryListStore() {
      return new InMemoryListStore();
    }
  }
}
