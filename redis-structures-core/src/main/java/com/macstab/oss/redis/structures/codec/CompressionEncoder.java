/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

import lombok.NonNull;

/**
 * Serializes an item with an inner encoder, deflates the UTF-8 bytes and stores them as Base64.
 *
 * <p><strong>Reconstruction is structural:</strong> decode inflates the bytes and hands the text
 * back to the inner encoder's parser. The decompressed text is never evaluated.
 *
 * <p><strong>Why Base64:</strong> the list store is used through a UTF-8 string codec. Raw deflate
 * output is not valid UTF-8 and would be mangled on the way in.
 *
 * <pre>{@code
 * Encoder<Object> json = CompressionEncoder.json();       // JSON, then deflate
 * Encoder<String> text = CompressionEncoder.strings();    // deflate only
 * Encoder<Order> typed = CompressionEncoder.of(JsonEncoder.of(Order.class));
 * }</pre>
 *
 * @param <T> item type
 */
public final class CompressionEncoder<T> implements Encoder<T> {

  private final Encoder<T> serializer;

  private CompressionEncoder(final Encoder<T> serializer) {
    this.serializer = serializer;
  }

  public static <T> CompressionEncoder<T> of(@NonNull final Encoder<T> serializer) {
    return new CompressionEncoder<>(serializer);
  }

  /** Compressed generic JSON. */
  public static CompressionEncoder<Object> json() {
    return of(JsonEncoder.generic());
  }

  /** Compresses strings as they are. */
  public static CompressionEncoder<String> strings() {
    return of(Encoder.identity());
  }

  @Override
  public String encode(final T item) throws IOException {
    final var text = serializer.encode(item);
    final var buffer = new ByteArrayOutputStream();

    try (var deflater = new DeflaterOutputStream(buffer)) {
      deflater.write(text.getBytes(StandardCharsets.UTF_8));
    }

    return Base64.getEncoder().encodeToString(buffer.toByteArray());
  }

  @Override
  public T decode(final String encoded) throws IOException {
    final byte[] compressed;
    try {
      compressed = Base64.getDecoder().decode(encoded);
    } catch (final IllegalArgumentException ex) {
      throw new IOException("Not a Base64 payload", ex);
    }

    final byte[] text;
    try (var inflater = new InflaterInputStream(new ByteArrayInputStream(compressed))) {
      text = inflater.readAllBytes();
    }

    return serializer.decode(new String(text, StandardCharsets.UTF_8));
  }

  @Override
  public String getName() {
    return "deflate+" + serializer.getName();
  }
}
