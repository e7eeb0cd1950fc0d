package com.acme.resilience.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A failed event with the diagnostics needed to triage and replay it. The original event is held
 * by value and never modified. Travels as the payload of a {@code dlq.failed} carrier envelope.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DlqEnvelope(
    @JsonProperty("dlq_id") String dlqId,
    @JsonProperty("original_event") EventEnvelope originalEvent,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("error_type") String errorType,
    @JsonProperty("source_topic") String sourceTopic,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("failed_at") Instant failedAt) {

  public static final int DEFAULT_MAX_RETRIES = 3;

  public DlqEnvelope {
    Objects.requireNonNull(originalEvent, "original_event");
    if (dlqId == null) {
      dlqId = UUID.randomUUID().toString();
    }
    if (failedAt == null) {
      failedAt = Instant.now();
    }
  }

  public static DlqEnvelope of(
      EventEnvelope originalEvent,
      String errorMessage,
      String errorType,
      String sourceTopic,
      int retryCount,
      int maxRetries) {
    return new DlqEnvelope(
        null, originalEvent, errorMessage, errorType, sourceTopic, retryCount, maxRetries, null);
  }

  public static DlqEnvelope of(
      EventEnvelope originalEvent, String errorMessage, String errorType, String sourceTopic) {
    return of(originalEvent, errorMessage, errorType, sourceTopic, 0, DEFAULT_MAX_RETRIES);
  }

  public Map<String, Object> toPayload() {
    return Jsons.toMap(this);
  }

  /**
   * @throws IllegalArgumentException if the payload is not a DLQ envelope
   */
  public static DlqEnvelope fromPayload(Map<String, ?> payload) {
    return Jsons.convert(payload, DlqEnvelope.class);
  }
}
