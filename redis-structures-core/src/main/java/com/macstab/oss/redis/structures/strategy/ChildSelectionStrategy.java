/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.strategy;

/**
 * Picks the child a load-balancing {@link com.macstab.oss.redis.structures.multi.MultiStructure}
 * reads from.
 *
 * <p><strong>Reads are not routed like writes:</strong> puts go to {@code hash(item) mod n}, gets
 * go wherever the strategy says. Total size accounting stays exact, but a get is not guaranteed to
 * return the item any particular put stored, and FIFO/LIFO order holds only within each child.
 * Callers that need order use preserving mode, which never consults a strategy.
 *
 * <p><strong>Thread safety requirement:</strong> implementations MUST be thread-safe. {@code
 * selectChild()} is called concurrently by every consumer thread. Lock-free algorithms (CAS,
 * thread-local state) preferred over synchronized blocks.
 *
 * @see RandomStrategy
 * @see RoundRobinStrategy
 */
public interface ChildSelectionStrategy {

  /**
   * Selects a child for the next read.
   *
   * @param numChildren number of data children (always &gt;= 2)
   * @return child index in {@code [0, numChildren)}
   */
  int selectChild(int numChildren);

  /** Strategy name for logging and metrics (e.g. "random"). */
  String getName();
}
