/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.store;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.macstab.oss.redis.structures.ConfigurationException;
import com.macstab.oss.redis.structures.StoreException;

import io.lettuce.core.api.StatefulRedisConnection;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded set of connections reserved for blocking pops.
 *
 * <p>A {@code BLPOP} parks its connection until an item arrives or the timeout passes. RESP matches
 * replies positionally, so any command written behind it on the same connection waits as long. A
 * lane is therefore held exclusively by one blocking call at a time and never carries other
 * commands.
 *
 * <p>Lanes are opened lazily, up to {@code maxLanes}. A lane whose connection is no longer open
 * when released is closed and forgotten. The next acquisition opens a fresh one.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
final class BlockingLanes implements AutoCloseable {

  Supplier<StatefulRedisConnection<String, String>> connector;
  @Getter int maxLanes;
  Semaphore permits;
  Deque<StatefulRedisConnection<String, String>> idle = new ConcurrentLinkedDeque<>();
  Set<StatefulRedisConnection<String, String>> opened = ConcurrentHashMap.newKeySet();

  @NonFinal volatile boolean closed;

  BlockingLanes(
      @NonNull final Supplier<StatefulRedisConnection<String, String>> connector,
      final int maxLanes) {
    if (maxLanes < 1) {
      throw new ConfigurationException("blockingConnections must be >= 1, got: " + maxLanes);
    }
    this.connector = connector;
    this.maxLanes = maxLanes;
    this.permits = new Semaphore(maxLanes, true);
  }

  /**
   * Takes a lane for exclusive use.
   *
   * @param maxWait how long to wait for a free lane ({@code null} = no limit)
   * @return the lane, or {@code null} if none became free within {@code maxWait}
   * @throws StoreException if the calling thread is interrupted while waiting
   */
  StatefulRedisConnection<String, String> acquire(final Duration maxWait) {
    if (closed) {
      throw new IllegalStateException("Blocking lanes have been closed");
    }

    try {
      if (maxWait == null) {
        permits.acquire();
      } else if (!permits.tryAcquire(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
        return null;
      }
    } catch (final InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while waiting for a blocking connection", ex);
    }

    try {
      return take();
    } catch (final RuntimeException ex) {
      permits.release();
      throw ex;
    }
  }

  /** Returns a lane taken with {@link #acquire(Duration)}. */
  void release(@NonNull final StatefulRedisConnection<String, String> lane) {
    try {
      if (closed || !lane.isOpen()) {
        discard(lane);
      } else {
        idle.offerFirst(lane);
      }
    } finally {
      permits.release();
    }
  }

  /** Number of lane connections currently open. */
  int openCount() {
    return opened.size();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }

    closed = true;
    idle.clear();

    for (final var lane : opened) {
      discard(lane);
    }
  }

  private StatefulRedisConnection<String, String> take() {
    var lane = idle.pollFirst();

    while (lane != null && !lane.isOpen()) {
      discard(lane);
      lane = idle.pollFirst();
    }

    if (lane == null) {
      lane = connector.get();
      opened.add(lane);

      if (log.isDebugEnabled()) {
        log.debug(
            "Opened blocking lane {} of {}",
            Integer.valueOf(opened.size()),
            Integer.valueOf(maxLanes));
      }
    }

    return lane;
  }

  private void discard(final StatefulRedisConnection<String, String> lane) {
    opened.remove(lane);
    try {
      lane.close();
    } catch (final RuntimeException ex) {
      log.warn("Error while closing blocking lane", ex);
    }
  }
}
