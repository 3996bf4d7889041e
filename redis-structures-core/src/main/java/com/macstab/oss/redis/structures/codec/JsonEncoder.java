/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.codec;

import java.io.IOException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import lombok.NonNull;

/**
 * JSON encoder backed by Jackson.
 *
 * <p>{@link #generic()} accepts nested maps, lists, strings, numbers, booleans and {@code null},
 * and decodes to the same shapes ({@code LinkedHashMap}, {@code ArrayList}, {@code Integer}/{@code
 * Long}/{@code Double}, ...). Typed encoders bind to a class or type reference.
 *
 * <p>Malformed input fails in {@link #decode(String)} with Jackson's {@link
 * com.fasterxml.jackson.core.JsonProcessingException}. Content after the first complete JSON value
 * is malformed too ({@link DeserializationFeature#FAIL_ON_TRAILING_TOKENS} is always on, also for
 * caller-supplied mappers).
 *
 * @param <T> item type
 */
public final class JsonEncoder<T> implements Encoder<T> {

  private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

  private final ObjectMapper mapper;
  private final ObjectReader reader;

  private JsonEncoder(final ObjectMapper mapper, final JavaType type) {
    this.mapper = mapper;
    this.reader = mapper.readerFor(type).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Untyped JSON: any value Jackson maps to plain maps, lists and scalars.
   *
   * <p><strong>Numeric boxing is not preserved:</strong> numbers decode to the smallest fitting
   * type, so {@code 5L} comes back as {@code Integer 5} and {@code 1.5f} as {@code Double 1.5}. Use
   * {@link #of(Class)} or {@link #of(TypeReference)} when exact types must round-trip.
   */
  public static JsonEncoder<Object> generic() {
    return of(Object.class);
  }

  public static <T> JsonEncoder<T> of(@NonNull final Class<T> type) {
    return of(DEFAULT_MAPPER, type);
  }

  public static <T> JsonEncoder<T> of(@NonNull final TypeReference<T> type) {
    return new JsonEncoder<>(DEFAULT_MAPPER, DEFAULT_MAPPER.getTypeFactory().constructType(type));
  }

  /** Uses a caller-configured mapper (modules, naming strategy, ...). */
  public static <T> JsonEncoder<T> of(
      @NonNull final ObjectMapper mapper, @NonNull final Class<T> type) {
    return new JsonEncoder<>(mapper, mapper.getTypeFactory().constructType(type));
  }

  @Override
  public String encode(final T item) throws IOException {
    return mapper.writeValueAsString(item);
  }

  @Override
  public T decode(final String encoded) throws IOException {
    return reader.readValue(encoded);
  }

  @Override
  public String getName() {
    return "json";
  }
}
