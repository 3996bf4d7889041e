/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.codec;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.redis.structures.DecodingException;
import com.macstab.oss.redis.structures.EncodingException;
import com.macstab.oss.redis.structures.Structure;
import com.macstab.oss.redis.structures.StructureKey;
import com.macstab.oss.redis.structures.StructureKind;
import com.macstab.oss.redis.structures.metrics.StructureMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Structure that transforms items through an {@link Encoder} on the way in and out.
 *
 * <p><strong>Put:</strong> {@code encode(item)}, then {@code delegate.put(encoded)}. If encoding
 * fails the delegate is never called and {@link EncodingException} carries the item.
 *
 * <p><strong>Get:</strong> {@code delegate.get(...)}, then {@code decode(raw)}. An empty result is
 * returned as-is, without calling the decoder. If decoding fails {@link DecodingException} carries
 * the raw value. The value is already gone from the store at that point.
 *
 * <p><strong>Chaining:</strong> decorators nest. The outermost encoder runs first on put and last
 * on get:
 *
 * <pre>{@code
 * Structure<String> queue = factory.queue("orders");
 * Structure<String> compressed = new EncodingDecorator<>(queue, CompressionEncoder.strings());
 * Structure<Object> orders = new EncodingDecorator<>(compressed, JsonEncoder.generic());
 *
 * orders.put(Map.of("id", 42));   // JSON, then deflate, then RPUSH
 * orders.get();                   // LPOP, then inflate, then JSON parse
 * }</pre>
 *
 * <p>{@code size()}, {@code isEmpty()}, {@code kind()} and {@code storageKey()} delegate unchanged.
 *
 * @param <T> item type seen by the caller
 */
@Slf4j
public final class EncodingDecorator<T> implements Structure<T> {

  @Getter private final Structure<String> delegate;
  @Getter private final Encoder<T> encoder;
  private final StructureMetrics metrics;

  public EncodingDecorator(
      @NonNull final Structure<String> delegate, @NonNull final Encoder<T> encoder) {
    this(delegate, encoder, StructureMetrics.NOOP);
  }

  public EncodingDecorator(
      @NonNull final Structure<String> delegate,
      @NonNull final Encoder<T> encoder,
      @NonNull final StructureMetrics metrics) {
    this.delegate = delegate;
    this.encoder = encoder;
    this.metrics = metrics;
  }

  @Override
  public StructureKind kind() {
    return delegate.kind();
  }

  @Override
  public Optional<StructureKey> storageKey() {
    return delegate.storageKey();
  }

  @Override
  public long size() {
    return delegate.size();
  }

  @Override
  public void put(@NonNull final T item) {
    final String encoded;
    try {
      encoded = encoder.encode(item);
    } catch (final IOException | RuntimeException ex) {
      metrics.recordCodecFailure(encoder.getName(), "encode");
      throw new EncodingException(encoder.getName(), item, ex);
    }

    if (encoded == null) {
      metrics.recordCodecFailure(encoder.getName(), "encode");
      throw new EncodingException(
          encoder.getName(), item, new IllegalStateException("Encoder returned null"));
    }

    delegate.put(encoded);
  }

  @Override
  public Optional<T> get(final boolean block, final Duration timeout) {
    final var raw = delegate.get(block, timeout);
    if (raw.isEmpty()) {
      return Optional.empty();
    }

    try {
      return Optional.ofNullable(encoder.decode(raw.get()));
    } catch (final IOException | RuntimeException ex) {
      metrics.recordCodecFailure(encoder.getName(), "decode");
      log.debug("Decoding with '{}' failed, popped value dropped", encoder.getName(), ex);
      throw new DecodingException(encoder.getName(), raw.get(), ex);
    }
  }

  @Override
  public String toString() {
    return "EncodingDecorator[" + encoder.getName() + " → " + delegate + "]";
  }
}
