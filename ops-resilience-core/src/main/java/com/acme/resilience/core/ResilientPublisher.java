package com.acme.resilience.core;

import com.acme.resilience.breaker.CircuitBreaker;
import com.acme.resilience.retry.RetryWithBackoff;
import com.acme.resilience.spi.EventPublisher;

/**
 * Publishes through a circuit breaker and a retry policy. The breaker sits outside the retries, so
 * one exhausted retry sequence counts as one failure and an open breaker is not retried.
 */
public class ResilientPublisher implements EventPublisher {

  private final EventPublisher delegate;
  private final CircuitBreaker breaker;
  private final RetryWithBackoff retry;

  public ResilientPublisher(EventPublisher delegate, CircuitBreaker breaker, RetryWithBackoff retry) {
    this.delegate = delegate;
    this.breaker = breaker;
    this.retry = retry;
  }

  @Override
  public void publish(String topic, EventEnvelope envelope) {
    try {
      breaker.call(
          () ->
              retry.execute(
                  () -> {
                    delegate.publish(topic, envelope);
                    return null;
                  }));
    } catch (RuntimeException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PublishException("Interrupted publishing to " + topic, e);
    } catch (Exception e) {
      throw new PublishException("Failed to publish to " + topic, e);
    }
  }
}
