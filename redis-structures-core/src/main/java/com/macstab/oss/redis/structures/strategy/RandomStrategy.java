/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.strategy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniformly random child. Default for load-balancing reads.
 *
 * <p>{@link ThreadLocalRandom}: no shared state, no contention between consumer threads.
 */
public final class RandomStrategy implements ChildSelectionStrategy {

  @Override
  public int selectChild(final int numChildren) {
    return ThreadLocalRandom.current().nextInt(numChildren);
  }

  @Override
  public String getName() {
    return "random";
  }
}
