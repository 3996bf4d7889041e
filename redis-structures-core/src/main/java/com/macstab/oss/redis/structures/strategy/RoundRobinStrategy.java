/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.strategy;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.atomic.AtomicInteger;

import lombok.experimental.FieldDefaults;

/**
 * Cycles through children in order: 0, 1, ..., n-1, 0, ...
 *
 * <p>Useful when consumers should drain children evenly instead of statistically evenly. With many
 * consumers sharing one instance each consumer sees a sub-sequence; the union is still exactly
 * cyclic.
 *
 * <p><strong>Overflow:</strong> the counter wraps at {@code Integer.MAX_VALUE}. Masking the sign
 * bit keeps the index non-negative; with a power-of-two child count the cycle continues without a
 * gap.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RoundRobinStrategy implements ChildSelectionStrategy {

  AtomicInteger counter;

  public RoundRobinStrategy() {
    this.counter = new AtomicInteger(0);
  }

  @Override
  public int selectChild(final int numChildren) {
    return (counter.getAndIncrement() & Integer.MAX_VALUE) % numChildren;
  }

  @Override
  public String getName() {
    return "round-robin";
  }

  /** Selections made so far (wraps at {@code Integer.MAX_VALUE}). */
  public int getTotalSelections() {
    return counter.get();
  }
}
