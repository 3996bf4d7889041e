/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.codec;

import java.io.IOException;

/**
 * Stateless, invertible transform between items and the strings stored in a remote list.
 *
 * <p><strong>Round-trip law:</strong> for every item {@code x} the encoder accepts, {@code
 * decode(encode(x))} equals {@code x}. Lossy transforms are not encoders.
 *
 * <p>Implementations MUST be thread-safe; one instance is shared by every caller of a decorated
 * structure.
 *
 * @param <T> item type
 * @see EncodingDecorator
 */
public interface Encoder<T> {

  String encode(T item) throws IOException;

  T decode(String encoded) throws IOException;

  /** Short name used in error messages and metrics tags. */
  String getName();

  /** Passes strings through unchanged. */
  static Encoder<String> identity() {
    return IdentityEncoder.INSTANCE;
  }
}
