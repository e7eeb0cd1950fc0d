package com.acme.resilience.breaker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only snapshot of a {@link CircuitBreaker}. {@code halfOpenCalls} is non-zero only while the
 * state is {@link CircuitState#HALF_OPEN}; {@code openedAt} is set iff the breaker has tripped
 * since its last reset. On the wire the reset timeout is written as {@code reset_timeout_seconds}.
 */
public record CircuitStats(
    @JsonProperty("name") String name,
    @JsonProperty("state") CircuitState state,
    @JsonProperty("failure_count") int failureCount,
    @JsonProperty("success_count") int successCount,
    @JsonProperty("total_calls") long totalCalls,
    @JsonProperty("last_failure_time") Instant lastFailureTime,
    @JsonProperty("last_success_time") Instant lastSuccessTime,
    @JsonProperty("opened_at") Instant openedAt,
    @JsonProperty("half_open_calls") int halfOpenCalls,
    @JsonProperty("failure_threshold") int failureThreshold,
    @JsonIgnore Duration resetTimeout,
    @JsonProperty("half_open_max_calls") int halfOpenMaxCalls) {

  @JsonProperty("reset_timeout_seconds")
  public double resetTimeoutSeconds() {
    return resetTimeout.toMillis() / 1000.0;
  }
}
