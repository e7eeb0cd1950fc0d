package com.acme.resilience.core;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.acme.resilience.breaker.CircuitBreaker;
import com.acme.resilience.breaker.CircuitOpenException;
import com.acme.resilience.breaker.CircuitState;
import com.acme.resilience.breaker.MutableClock;
import com.acme.resilience.retry.RetryWithBackoff;
import com.acme.resilience.spi.EventPublisher;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResilientPublisherTest {

  @Mock private EventPublisher delegate;

  private CircuitBreaker breaker;
  private ResilientPublisher publisher;
  private final EventEnvelope envelope = EventEnvelope.create("t", "s", Map.of());

  @BeforeEach
  void setUp() {
    breaker = new CircuitBreaker("dlq-publisher", 2, Duration.ofSeconds(30), 1, new MutableClock());
    RetryWithBackoff retry =
        RetryWithBackoff.builder("dlq-publish")
            .maxRetries(2)
            .jitter(false)
            .retryOn(TransientException.class)
            .sleeper(d -> {})
            .build();
    publisher = new ResilientPublisher(delegate, breaker, retry);
  }

  @Test
  @DisplayName("should retry a transient publish failure")
  void testRetriesTransientFailure() {
    doThrow(new PublishException("not acked", null))
        .doNothing()
        .when(delegate)
        .publish(Topics.DLQ, envelope);

    publisher.publish(Topics.DLQ, envelope);

    verify(delegate, times(2)).publish(Topics.DLQ, envelope);
    assertThat(breaker.stats().successCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should count an exhausted retry sequence as one breaker failure")
  void testExhaustedCountsOnce() {
    doThrow(new PublishException("not acked", null)).when(delegate).publish(any(), any());

    assertThatThrownBy(() -> publisher.publish(Topics.DLQ, envelope))
        .isInstanceOf(PublishException.class);

    verify(delegate, times(3)).publish(eq(Topics.DLQ), any());
    assertThat(breaker.stats().failureCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should fail fast without publishing once the breaker is open")
  void testOpenBreaker() {
    doThrow(new PublishException("not acked", null)).when(delegate).publish(any(), any());
    assertThatThrownBy(() -> publisher.publish(Topics.DLQ, envelope))
        .isInstanceOf(PublishException.class);
    assertThatThrownBy(() -> publisher.publish(Topics.DLQ, envelope))
        .isInstanceOf(PublishException.class);
    assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    clearInvocations(delegate);

    assertThatThrownBy(() -> publisher.publish(Topics.DLQ, envelope))
        .isInstanceOf(CircuitOpenException.class);
    verifyNoInteractions(delegate);
  }
}
