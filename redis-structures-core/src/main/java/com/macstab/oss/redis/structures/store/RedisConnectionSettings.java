/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.store;

import java.time.Duration;

import com.macstab.oss.redis.structures.ConfigurationException;

import io.lettuce.core.RedisURI;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Connection parameters for {@link LettuceListStore}, forwarded verbatim to the Lettuce {@link
 * RedisURI}.
 *
 * <pre>{@code
 * RedisConnectionSettings settings =
 *     RedisConnectionSettings.builder()
 *         .host("redis.internal")
 *         .database(2)
 *         .password("secret")
 *         .blockingSlice(Duration.ofSeconds(5))
 *         .build();
 * }</pre>
 *
 * <p><strong>Blocking slice:</strong> blocking pops are issued as repeated {@code BLPOP}/{@code
 * BRPOP} calls of at most this length. Each call is still subject to the Lettuce command timeout,
 * so the slice must be shorter than {@link #getCommandTimeout()}.
 *
 * <p><strong>Blocking connections:</strong> each blocking pop holds one connection of its own for
 * its whole wait, apart from the connection that carries puts and lengths. {@link
 * #getBlockingConnections()} caps how many such pops run at once. Further blocking callers wait for
 * a free connection within their own timeout.
 */
@Getter
@Builder
@ToString(exclude = "password")
public final class RedisConnectionSettings {

  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_BLOCKING_SLICE = Duration.ofSeconds(10);
  public static final int DEFAULT_BLOCKING_CONNECTIONS = 8;

  @Builder.Default private final String host = "localhost";
  @Builder.Default private final int port = RedisURI.DEFAULT_REDIS_PORT;
  @Builder.Default private final int database = 0;

  /** ACL user name (Redis 6+). {@code null} authenticates with the password only. */
  private final String username;

  private final String password;
  private final String clientName;

  @Builder.Default private final Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
  @Builder.Default private final Duration blockingSlice = DEFAULT_BLOCKING_SLICE;
  @Builder.Default private final int blockingConnections = DEFAULT_BLOCKING_CONNECTIONS;

  /** Settings for {@code localhost:6379}, database 0, no authentication. */
  public static RedisConnectionSettings defaults() {
    return builder().build();
  }

  /**
   * Checks the settings for consistency.
   *
   * @throws ConfigurationException if a value is out of range
   */
  public void validate() {
    if (host == null || host.isBlank()) {
      throw new ConfigurationException("host must not be blank");
    }
    if (port < 1 || port > 65_535) {
      throw new ConfigurationException("port must be in [1, 65535], got: " + port);
    }
    if (database < 0) {
      throw new ConfigurationException("database must be >= 0, got: " + database);
    }
    if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
      throw new ConfigurationException("commandTimeout must be positive, got: " + commandTimeout);
    }
    if (blockingSlice == null || blockingSlice.toMillis() < 1) {
      throw new ConfigurationException("blockingSlice must be >= 1ms, got: " + blockingSlice);
    }
    if (blockingSlice.compareTo(commandTimeout) >= 0) {
      throw new ConfigurationException(
          "blockingSlice ("
              + blockingSlice
              + ") must be shorter than commandTimeout ("
              + commandTimeout
              + ")");
    }
    if (blockingConnections < 1) {
      throw new ConfigurationException(
          "blockingConnections must be >= 1, got: " + blockingConnections);
    }
  }

  /** Builds the Lettuce URI. Validates first. */
  public RedisURI toRedisUri() {
    validate();

    final var builder =
        RedisURI.builder()
            .withHost(host)
            .withPort(port)
            .withDatabase(database)
            .withTimeout(commandTimeout);

    if (username != null && password != null) {
      builder.withAuthentication(username, password);
    } else if (password != null) {
      builder.withPassword(password.toCharArray());
    }

    if (clientName != null) {
      builder.withClientName(clientName);
    }

    return builder.build();
  }
}
