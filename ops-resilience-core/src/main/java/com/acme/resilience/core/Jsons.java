package com.acme.resilience.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/** Shared JSON codec for envelopes. Timestamps are written as ISO-8601 strings. */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static byte[] toBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot read " + clazz.getSimpleName() + " from JSON", e);
    }
  }

  public static <T> T fromBytes(byte[] json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot read " + clazz.getSimpleName() + " from JSON", e);
    }
  }

  /**
   * Convert an object to a Map&lt;String, Object&gt; by serializing through Jackson. Used to carry
   * a typed value as an envelope payload.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> toMap(Object o) {
    try {
      return M.convertValue(o, Map.class);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot convert " + o.getClass().getSimpleName(), e);
    }
  }

  /** Inverse of {@link #toMap(Object)}. */
  public static <T> T convert(Map<String, ?> map, Class<T> clazz) {
    try {
      return M.convertValue(map, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot convert map to " + clazz.getSimpleName(), e);
    }
  }
}
