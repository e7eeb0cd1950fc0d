package com.acme.resilience.kafka;

import com.acme.resilience.core.DlqEnvelope;
import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.EventTypeConstants;
import com.acme.resilience.core.Topics;
import com.acme.resilience.spi.EventPublisher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Parks events that exhausted their retry budget on {@link Topics#DLQ}. Each failed event is
 * wrapped in a {@link DlqEnvelope} and published as the payload of a {@code dlq.failed} carrier
 * envelope that keeps the original correlation id.
 */
@Slf4j
public class DeadLetterQueue {

  public static final int DEFAULT_MAX_RETRIES = DlqEnvelope.DEFAULT_MAX_RETRIES;

  private final EventPublisher publisher;
  @Getter private final int maxRetries;

  public DeadLetterQueue(EventPublisher publisher) {
    this(publisher, DEFAULT_MAX_RETRIES);
  }

  public DeadLetterQueue(EventPublisher publisher, int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    this.publisher = publisher;
    this.maxRetries = maxRetries;
  }

  /** Whether an event that has failed {@code count} times may be redelivered again. */
  public boolean shouldRetry(int count) {
    return count < maxRetries;
  }

  /**
   * Publishes {@code event} to the DLQ topic.
   *
   * @throws com.acme.resilience.core.PublishException if the publisher fails
   */
  public DlqEnvelope sendToDlq(
      EventEnvelope event, Throwable error, String sourceTopic, int retryCount) {
    DlqEnvelope dlqEnvelope =
        DlqEnvelope.of(
            event,
            errorMessage(error),
            error.getClass().getSimpleName(),
            sourceTopic,
            retryCount,
            maxRetries);
    EventEnvelope carrier =
        EventEnvelope.create(
            EventTypeConstants.DLQ_FAILED,
            EventTypeConstants.DLQ_SOURCE,
            dlqEnvelope.toPayload(),
            event.correlationId());
    publisher.publish(Topics.DLQ, carrier);
    log.error(
        "Event sent to DLQ: eventId={}, type={}, sourceTopic={}, retryCount={}, error={}",
        event.eventId(),
        event.eventType(),
        sourceTopic,
        retryCount,
        dlqEnvelope.errorType());
    return dlqEnvelope;
  }

  private static String errorMessage(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.toString();
  }
}
