/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.multi;

import java.nio.charset.StandardCharsets;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Hash used to route puts to a child of a {@link MultiStructure}.
 *
 * <p>Only distribution matters: the result is reduced with {@code floorMod(hash, childCount)}, so
 * negative values are fine.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemHasher<T> {

  int hash(T item);

  /**
   * MurmurHash3 (x86, 32-bit, seed 0) over the UTF-8 bytes of {@code String.valueOf(item)}.
   *
   * <p>Well distributed and non-cryptographic. Equal string forms always route to the same child,
   * in any process.
   */
  static <T> ItemHasher<T> murmur3() {
    final HashFunction murmur3 = Hashing.murmur3_32_fixed();
    return item -> murmur3.hashString(String.valueOf(item), StandardCharsets.UTF_8).asInt();
  }
}
