/* (C)2026 Macstab GmbH */

/**
 * Access to remote list storage.
 *
 * <p>{@link com.macstab.oss.redis.structures.store.RemoteListStore} is the only seam between the
 * structures and Redis. {@link com.macstab.oss.redis.structures.store.LettuceListStore} implements
 * it over a Lettuce connection; tests substitute an in-memory implementation.
 *
 * @since 1.0.0
 */
package com.macstab.oss.redis.structures.store;
