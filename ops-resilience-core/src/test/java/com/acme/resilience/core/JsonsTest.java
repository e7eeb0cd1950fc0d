package com.acme.resilience.core;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for Jsons utility class */
class JsonsTest {

  @Nested
  @DisplayName("toJson Tests")
  class ToJsonTests {

    @Test
    @DisplayName("Should serialize empty map to JSON")
    void testToJsonEmptyMap() {
      assertThat(Jsons.toJson(Map.of())).isEqualTo("{}");
    }

    @Test
    @DisplayName("Should serialize null values")
    void testToJsonWithNull() {
      Map<String, Object> map = new HashMap<>();
      map.put("key", null);

      assertThat(Jsons.toJson(map)).isEqualTo("{\"key\":null}");
    }

    @Test
    @DisplayName("Should write instants as ISO-8601 strings")
    void testToJsonInstant() {
      Instant instant = Instant.parse("2025-01-01T00:00:00Z");

      String json = Jsons.toJson(instant);

      assertThat(json).isEqualTo("\"2025-01-01T00:00:00Z\"");
      assertThat(Jsons.fromJson(json, Instant.class)).isEqualTo(instant);
    }
  }

  @Nested
  @DisplayName("fromJson Tests")
  class FromJsonTests {

    @Test
    @DisplayName("Should read bytes and strings alike")
    void testFromJson() {
      assertThat(Jsons.fromJson("{\"a\":1}", Map.class)).containsEntry("a", 1);
      assertThat(Jsons.fromBytes("[1,2]".getBytes(), List.class)).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void testMalformed() {
      assertThatThrownBy(() -> Jsons.fromJson("{not json", Map.class))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("Map");
    }
  }

  @Nested
  @DisplayName("Map conversion Tests")
  class MapConversionTests {

    record Sample(String name, Instant at) {}

    @Test
    @DisplayName("Should convert an object to a map and back")
    void testToMapAndConvert() {
      Sample sample = new Sample("x", Instant.parse("2025-01-01T00:00:00Z"));

      Map<String, Object> map = Jsons.toMap(sample);

      assertThat(map).containsEntry("name", "x").containsEntry("at", "2025-01-01T00:00:00Z");
      assertThat(Jsons.convert(map, Sample.class)).isEqualTo(sample);
    }
  }
}
