/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.macstab.oss.redis.structures.ConfigurationException;
import com.macstab.oss.redis.structures.ConnectivityException;
import com.macstab.oss.redis.structures.StoreException;

import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RemoteListStore} over Lettuce connections.
 *
 * <p><strong>Command mapping:</strong>
 *
 * <ul>
 *   <li>{@code length} → {@code LLEN}
 *   <li>{@code pushRight} → {@code RPUSH}
 *   <li>{@code popLeft} / {@code popRight} → {@code LPOP} / {@code RPOP}
 *   <li>blocking variants → {@code BLPOP} / {@code BRPOP}
 * </ul>
 *
 * <p>Fractional-second {@code BLPOP}/{@code BRPOP} timeouts require Redis 6.0 or later. Older
 * servers reject them with {@code ERR timeout is not an integer}, which surfaces as {@link
 * StoreException}.
 *
 * <p><strong>Connections:</strong> {@code PING}, {@code LLEN}, {@code RPUSH} and the non-blocking
 * pops share one command connection. Blocking pops never run on it. A {@code BLPOP} parks its
 * connection, and RESP matches replies positionally, so a producer queued behind a consumer would
 * wait out the consumer's whole slice. Each blocking pop instead takes an exclusive lane from a
 * pool of at most {@code blockingConnections} extra connections, opened on demand. When every lane
 * is busy, the caller waits for one until its own deadline and then falls back to a non-blocking
 * pop.
 *
 * <p><strong>Blocking pops are sliced:</strong> Lettuce applies its command timeout to {@code
 * BLPOP} like to any other command. A single {@code BLPOP key 0} (wait forever) would therefore
 * fail with {@link RedisCommandTimeoutException} after the command timeout. Instead, the wait is
 * split into calls of at most {@code blockingSlice}, re-issued until an item arrives or the
 * caller's deadline passes. Redis reads a timeout of {@code 0} as "forever", so a remaining wait
 * below one millisecond becomes a non-blocking pop.
 *
 * <p><strong>Ownership:</strong> {@link #connect(RedisConnectionSettings)} creates the {@link
 * RedisClient} and shuts it down in {@link #close()}. The public constructor opens its connections
 * on a caller-owned client. {@link #close()} then closes those connections and leaves the client
 * running.
 */
@Slf4j
public final class LettuceListStore implements RemoteListStore {

  private final RedisClient client;
  private final boolean ownsClient;
  private final StatefulRedisConnection<String, String> connection;
  private final RedisCommands<String, String> commands;
  private final BlockingLanes lanes;
  private final Duration blockingSlice;
  private volatile boolean closed;

  /**
   * Opens a command connection on a caller-owned client and verifies it with {@code PING}.
   *
   * @param client client to open connections on (must not be null, not shut down by this store)
   * @param blockingSlice maximum length of one blocking pop call (must be &gt;= 1ms)
   * @param blockingConnections maximum number of concurrent blocking pops (must be &gt;= 1)
   * @throws ConfigurationException if a limit is out of range
   * @throws ConnectivityException if the store does not answer
   */
  public LettuceListStore(
      @NonNull final RedisClient client,
      @NonNull final Duration blockingSlice,
      final int blockingConnections) {
    this(client, false, blockingSlice, blockingConnections);
  }

  private LettuceListStore(
      final RedisClient client,
      final boolean ownsClient,
      final Duration blockingSlice,
      final int blockingConnections) {

    if (blockingSlice.toMillis() < 1) {
      throw new ConfigurationException("blockingSlice must be >= 1ms, got: " + blockingSlice);
    }

    this.client = client;
    this.ownsClient = ownsClient;
    this.blockingSlice = blockingSlice;
    this.lanes = new BlockingLanes(() -> open(client), blockingConnections);
    this.connection = open(client);
    this.commands = connection.sync();
    this.closed = false;

    try {
      ping();
    } catch (final RuntimeException ex) {
      connection.close();
      throw ex;
    }
  }

  /**
   * Creates a client and its connections from settings.
   *
   * @param settings connection settings (must not be null)
   * @return connected store owning its client
   * @throws ConfigurationException if the settings are invalid
   * @throws ConnectivityException if Redis is unreachable or does not answer {@code PING}
   */
  public static LettuceListStore connect(@NonNull final RedisConnectionSettings settings) {
    final var client = RedisClient.create(settings.toRedisUri());

    try {
      final var store =
          new LettuceListStore(
              client, true, settings.getBlockingSlice(), settings.getBlockingConnections());

      if (log.isInfoEnabled()) {
        log.info(
            "Connected LettuceListStore to {}:{} (database: {}, blockingSlice: {}, "
                + "blockingConnections: {})",
            settings.getHost(),
            Integer.valueOf(settings.getPort()),
            Integer.valueOf(settings.getDatabase()),
            settings.getBlockingSlice(),
            Integer.valueOf(settings.getBlockingConnections()));
      }
      return store;
    } catch (final ConnectivityException ex) {
      client.shutdown();
      throw new ConnectivityException(
          "Cannot connect to Redis at " + settings.getHost() + ":" + settings.getPort(), ex);
    } catch (final RuntimeException ex) {
      client.shutdown();
      throw ex;
    }
  }

  @Override
  public void ping() {
    final var reply = execute(connection, "PING", null, commands::ping);
    if (!"PONG".equalsIgnoreCase(reply)) {
      throw new ConnectivityException("Unexpected PING reply: " + reply);
    }
  }

  @Override
  public long length(final String key) {
    final Long length = execute(connection, "LLEN", key, () -> commands.llen(key));
    return length == null ? 0L : length.longValue();
  }

  @Override
  public void pushRight(final String key, final String value) {
    execute(connection, "RPUSH", key, () -> commands.rpush(key, value));
  }

  @Override
  public Optional<String> popLeft(final String key) {
    return Optional.ofNullable(execute(connection, "LPOP", key, () -> commands.lpop(key)));
  }

  @Override
  public Optional<String> popLeft(final String key, final Duration timeout) {
    return blockingPop(
        "BLPOP", key, timeout, (lane, seconds) -> lane.blpop(seconds, key), () -> popLeft(key));
  }

  @Override
  public Optional<String> popRight(final String key) {
    return Optional.ofNullable(execute(connection, "RPOP", key, () -> commands.rpop(key)));
  }

  @Override
  public Optional<String> popRight(final String key, final Duration timeout) {
    return blockingPop(
        "BRPOP", key, timeout, (lane, seconds) -> lane.brpop(seconds, key), () -> popRight(key));
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }

    closed = true;

    try {
      lanes.close();
      connection.close();

      if (ownsClient) {
        client.shutdown();
      }

      if (log.isInfoEnabled()) {
        log.info("Closed LettuceListStore");
      }
    } catch (final Exception e) {
      log.error("Error while closing LettuceListStore", e);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  // ==================== Private Methods ====================

  private Optional<String> blockingPop(
      final String command,
      final String key,
      final Duration timeout,
      final BlockingCall call,
      final Supplier<Optional<String>> nonBlocking) {

    final long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();

    if (timeout != null && deadline - System.nanoTime() < TimeUnit.MILLISECONDS.toNanos(1)) {
      return nonBlocking.get();
    }

    final var lane =
        execute(
            connection,
            command,
            key,
            () -> lanes.acquire(timeout == null ? null : remaining(deadline)));
    if (lane == null) {
      log.debug("No blocking lane freed up in time for {} on '{}'", command, key);
      return nonBlocking.get();
    }

    try {
      final var laneCommands = lane.sync();

      while (true) {
        var sliceMillis = blockingSlice.toMillis();

        if (timeout != null) {
          final var remainingMillis = remaining(deadline).toMillis();
          if (remainingMillis < 1) {
            return nonBlocking.get();
          }
          sliceMillis = Math.min(sliceMillis, remainingMillis);
        }

        final double seconds = sliceMillis / 1000.0;
        final KeyValue<String, String> result =
            execute(lane, command, key, () -> call.pop(laneCommands, seconds));

        if (result != null && result.hasValue()) {
          return Optional.of(result.getValue());
        }

        log.trace("{} slice of {}ms expired on '{}'", command, Long.valueOf(sliceMillis), key);
      }
    } finally {
      lanes.release(lane);
    }
  }

  private <R> R execute(
      final StatefulRedisConnection<String, String> target,
      final String command,
      final String key,
      final Supplier<R> call) {
    if (closed) {
      throw new IllegalStateException("LettuceListStore has been closed");
    }

    try {
      return call.get();
    } catch (final RedisConnectionException | RedisCommandTimeoutException ex) {
      throw new ConnectivityException(describe(command, key) + " failed: store unreachable", ex);
    } catch (final RedisException ex) {
      if (!target.isOpen()) {
        throw new ConnectivityException(describe(command, key) + " failed: connection closed", ex);
      }
      throw new StoreException(describe(command, key) + " rejected: " + ex.getMessage(), ex);
    }
  }

  private static Duration remaining(final long deadline) {
    return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
  }

  private static StatefulRedisConnection<String, String> open(final RedisClient client) {
    try {
      return client.connect(StringCodec.UTF8);
    } catch (final RedisException ex) {
      throw new ConnectivityException("Cannot open Redis connection", ex);
    }
  }

  private static String describe(final String command, final String key) {
    return key == null ? command : command + " '" + key + "'";
  }

  @FunctionalInterface
  private interface BlockingCall {
    KeyValue<String, String> pop(RedisCommands<String, String> lane, double timeoutSeconds);
  }
}
