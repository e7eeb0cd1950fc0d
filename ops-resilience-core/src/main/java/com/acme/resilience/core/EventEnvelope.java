package com.acme.resilience.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The canonical wrapper for a message on the bus. Immutable; identity is {@code eventId}, which is
 * generated along with {@code timestamp} when not supplied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("source") String source,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("timestamp") Instant timestamp) {

  public EventEnvelope {
    Objects.requireNonNull(eventType, "event_type");
    Objects.requireNonNull(source, "source");
    if (eventId == null) {
      eventId = UUID.randomUUID().toString();
    }
    if (timestamp == null) {
      timestamp = Instant.now();
    }
    payload =
        payload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public static EventEnvelope create(String eventType, String source, Map<String, ?> payload) {
    return create(eventType, source, payload, null);
  }

  public static EventEnvelope create(
      String eventType, String source, Map<String, ?> payload, String correlationId) {
    return new EventEnvelope(
        null,
        eventType,
        source,
        payload == null ? null : new LinkedHashMap<>(payload),
        correlationId,
        null);
  }

  public byte[] serialize() {
    return Jsons.toBytes(this);
  }

  public String toJson() {
    return Jsons.toJson(this);
  }

  /**
   * @throws IllegalArgumentException if the bytes are not an envelope
   */
  public static EventEnvelope deserialize(byte[] data) {
    return Jsons.fromBytes(data, EventEnvelope.class);
  }
}
