/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.store;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.redis.structures.RedisQueue;
import com.macstab.oss.redis.structures.RedisStack;
import com.macstab.oss.redis.structures.StoreException;
import com.macstab.oss.redis.structures.StructureFactory;
import com.macstab.oss.redis.structures.StructureKey;
import com.macstab.oss.redis.structures.codec.CompressionEncoder;
import com.macstab.oss.redis.structures.codec.EncodingDecorator;
import com.macstab.oss.redis.structures.multi.MultiStructure;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;

/**
 * Integration tests with real Redis (Testcontainers).
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("LettuceListStore Integration Tests (Real Redis)")
class LettuceListStoreIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
          .withExposedPorts(6379)
          .withStartupTimeout(Duration.ofSeconds(30));

  private RedisClient adminClient;
  private StatefulRedisConnection<String, String> admin;
  private LettuceListStore store;

  @BeforeEach
  void setUp() {
    final var uri =
        RedisURI.builder().withHost(REDIS.getHost()).withPort(REDIS.getFirstMappedPort()).build();
    adminClient = RedisClient.create(uri);
    admin = adminClient.connect(StringCodec.UTF8);
    admin.sync().flushdb();

    store = LettuceListStore.connect(settings());
  }

  @AfterEach
  void tearDown() {
    store.close();
    admin.close();
    adminClient.shutdown();
  }

  private static RedisConnectionSettings settings() {
    return RedisConnectionSettings.builder()
        .host(REDIS.getHost())
        .port(REDIS.getFirstMappedPort())
        .clientName("structures-it")
        .blockingSlice(Duration.ofMillis(200))
        .build();
  }

  @Nested
  @DisplayName("List commands")
  class ListCommands {

    @Test
    @DisplayName("pushRight appends to a Redis list read back with LRANGE")
    void pushRight_AppendsToList() {
      // Act
      store.pushRight("jobs", "a");
      store.pushRight("jobs", "b");

      // Assert
      assertThat(admin.sync().lrange("jobs", 0, -1)).containsExactly("a", "b");
      assertThat(store.length("jobs")).isEqualTo(2);
    }

    @Test
    @DisplayName("popLeft and popRight take opposite ends")
    void pops_TakeOppositeEnds() {
      // Arrange
      admin.sync().rpush("jobs", "1", "2", "3");

      // Act & Assert
      assertThat(store.popLeft("jobs")).contains("1");
      assertThat(store.popRight("jobs")).contains("3");
      assertThat(store.popLeft("jobs")).contains("2");
      assertThat(store.popLeft("jobs")).isEmpty();
    }

    @Test
    @DisplayName("missing key has length 0")
    void length_MissingKey_IsZero() {
      assertThat(store.length("absent")).isZero();
    }

    @Test
    @DisplayName("command against a non-list key is a StoreException")
    void wrongType_IsStoreException() {
      // Arrange
      admin.sync().set("plain", "value");

      // Act & Assert
      assertThatThrownBy(() -> store.length("plain"))
          .isExactlyInstanceOf(StoreException.class)
          .hasMessageContaining("WRONGTYPE");
    }
  }

  @Nested
  @DisplayName("Blocking pops")
  class BlockingPops {

    @Test
    @DisplayName("timed pop on an empty list returns empty after the timeout")
    void timedPop_Empty_ReturnsEmptyAfterTimeout() {
      // Act
      final long start = System.nanoTime();
      final var result = store.popLeft("empty", Duration.ofMillis(700));
      final long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

      // Assert: 700ms spans several 200ms slices
      assertThat(result).isEmpty();
      assertThat(elapsedMillis).isGreaterThanOrEqualTo(600);
    }

    @Test
    @DisplayName("indefinite pop survives slices and wakes on a later push to the same store")
    void indefinitePop_WakesOnPush() throws Exception {
      // Arrange
      final CompletableFuture<Optional<String>> pending =
          CompletableFuture.supplyAsync(() -> store.popRight("wake", null));

      // Act: push after several slices have expired
      Thread.sleep(700);
      assertThat(pending).isNotDone();
      store.pushRight("wake", "late");

      // Assert
      await().atMost(5, SECONDS).until(pending::isDone);
      assertThat(pending.get()).contains("late");
    }

    @Test
    @DisplayName("a put on the same factory is not held up by a parked consumer")
    void putDuringBlockingGet_SameFactory_ReturnsPromptly() throws Exception {
      // Arrange: a slice far longer than the expected hand-off
      try (var shared =
          LettuceListStore.connect(
              RedisConnectionSettings.builder()
                  .host(REDIS.getHost())
                  .port(REDIS.getFirstMappedPort())
                  .blockingSlice(Duration.ofSeconds(5))
                  .build())) {
        final var factory = new StructureFactory(shared);
        final var queue = factory.queue("handoff");
        final CompletableFuture<Optional<String>> consumer =
            CompletableFuture.supplyAsync(() -> queue.get(true, Duration.ofSeconds(5)));
        await()
            .atMost(5, SECONDS)
            .untilAsserted(
                () -> assertThat(admin.sync().clientList()).contains("cmd=blpop"));

        // Act
        final long start = System.nanoTime();
        queue.put("item");
        final long putMillis = (System.nanoTime() - start) / 1_000_000;
        final var received = consumer.get(5, SECONDS);
        final long wakeMillis = (System.nanoTime() - start) / 1_000_000;

        // Assert
        assertThat(putMillis).isLessThan(1_000);
        assertThat(wakeMillis).isLessThan(1_000);
        assertThat(received).contains("item");
      }
    }

    @Test
    @DisplayName("concurrent blocking pops each hold their own connection up to the limit")
    void concurrentPops_UseBoundedLanes() throws Exception {
      // Arrange
      try (var limited =
          LettuceListStore.connect(
              RedisConnectionSettings.builder()
                  .host(REDIS.getHost())
                  .port(REDIS.getFirstMappedPort())
                  .clientName("lanes-it")
                  .blockingSlice(Duration.ofMillis(500))
                  .blockingConnections(2)
                  .build())) {
        final List<CompletableFuture<Optional<String>>> consumers = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
          consumers.add(
              CompletableFuture.supplyAsync(() -> limited.popLeft("lanes", Duration.ofSeconds(5))));
        }
        await()
            .atMost(5, SECONDS)
            .untilAsserted(
                () ->
                    assertThat(admin.sync().clientList().split("\n"))
                        .filteredOn(line -> line.contains("name=lanes-it"))
                        .hasSize(3));

        // Act: a third caller finds every lane busy until its deadline
        final var third = limited.popLeft("lanes", Duration.ofMillis(300));
        limited.pushRight("lanes", "a");
        limited.pushRight("lanes", "b");

        // Assert
        assertThat(third).isEmpty();
        final List<String> received = new ArrayList<>();
        for (final var consumer : consumers) {
          received.add(consumer.get(5, SECONDS).orElseThrow());
        }
        assertThat(received).containsExactlyInAnyOrder("a", "b");
      }
    }
  }

  @Nested
  @DisplayName("Structures on Redis")
  class StructuresOnRedis {

    @Test
    @DisplayName("queue is FIFO and stack is LIFO")
    void queueAndStack_Order() {
      // Arrange
      final var queue = new RedisQueue(StructureKey.of("queue", "t1"), store);
      final var stack = new RedisStack(StructureKey.of("stack", "t1"), store);

      // Act
      for (final var item : List.of("A", "B", "C")) {
        queue.put(item);
        stack.put(item);
      }

      // Assert
      assertThat(List.of(queue.get().orElseThrow(), queue.get().orElseThrow(), queue.get().orElseThrow()))
          .containsExactly("A", "B", "C");
      assertThat(List.of(stack.get().orElseThrow(), stack.get().orElseThrow(), stack.get().orElseThrow()))
          .containsExactly("C", "B", "A");
    }

    @Test
    @DisplayName("order-preserving multi-structure over compressed children keeps FIFO")
    void preservingMulti_CompressedChildren() {
      // Arrange
      final var factory = new StructureFactory(store);
      final var encoder = CompressionEncoder.strings();
      final var multi =
          MultiStructure.preserving(
              factory.queue("route"),
              List.of(
                  new EncodingDecorator<>(factory.queue("c0"), encoder),
                  new EncodingDecorator<>(factory.queue("c1"), encoder),
                  new EncodingDecorator<>(factory.queue("c2"), encoder)));
      final List<String> input = new ArrayList<>();
      for (int i = 0; i < 30; i++) {
        input.add("payload-" + i + "-" + "x".repeat(i * 10));
      }

      // Act
      input.forEach(multi::put);
      final List<String> output = new ArrayList<>();
      while (!multi.isEmpty()) {
        output.add(multi.get(false).orElseThrow());
      }

      // Assert
      assertThat(output).containsExactlyElementsOf(input);
      assertThat(admin.sync().llen("queue:route")).isZero();
    }
  }
}
