package com.acme.resilience.kafka;

import com.acme.resilience.breaker.CircuitBreakerRegistry;
import com.acme.resilience.config.MessagingConfig;
import com.acme.resilience.config.RetryConfig;
import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.ResilientPublisher;
import com.acme.resilience.core.Topics;
import com.acme.resilience.retry.RetryWithBackoff;
import com.acme.resilience.spi.EventPublisher;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One producer, one consumer on the application topics and, when enabled, a dead-letter queue
 * that publishes through the bus's own producer. The bus owns all three. The DLQ publishes through
 * {@link EventProducer#strictPublisher()}, so a stopped producer surfaces as a failed DLQ publish
 * and the consumer keeps the event's retry count.
 */
@Slf4j
@Getter
public class EventBus implements AutoCloseable {

  public static final String DLQ_PUBLISHER_BREAKER = "dlq-publisher";

  private final EventProducer producer;
  private final EventConsumer consumer;
  /** {@code null} when the DLQ is disabled. */
  private final DeadLetterQueue dlq;

  EventBus(EventProducer producer, EventConsumer consumer, DeadLetterQueue dlq) {
    this.producer = producer;
    this.consumer = consumer;
    this.dlq = dlq;
  }

  /** A bus whose DLQ, if enabled, publishes straight through the producer. */
  public static EventBus create(KafkaClientFactory clients, MessagingConfig config) {
    return create(clients, config, null, null);
  }

  /**
   * A bus whose DLQ publishes through the {@value #DLQ_PUBLISHER_BREAKER} breaker of {@code
   * breakers} with {@code retry} backoff. With a {@code null} registry the DLQ publishes directly.
   */
  public static EventBus create(
      KafkaClientFactory clients,
      MessagingConfig config,
      CircuitBreakerRegistry breakers,
      RetryConfig retry) {
    EventProducer producer = new EventProducer(clients::createProducer, config.getSendTimeout());
    DeadLetterQueue dlq = null;
    if (config.getDlq().isEnabled()) {
      EventPublisher dlqPublisher = producer.strictPublisher();
      if (breakers != null) {
        dlqPublisher =
            new ResilientPublisher(
                dlqPublisher,
                breakers.register(DLQ_PUBLISHER_BREAKER),
                RetryWithBackoff.from(
                    "dlq-publish", retry != null ? retry : new RetryConfig()));
      }
      dlq = new DeadLetterQueue(dlqPublisher, config.getDlq().getMaxRetries());
    }
    EventConsumer consumer =
        new EventConsumer(
            () -> clients.createConsumer(config.getGroupId()),
            Topics.APPLICATION,
            config.getPollTimeout(),
            dlq);
    log.info(
        "Event bus created: bootstrapServers={}, groupId={}, dlqEnabled={}",
        clients.getBootstrapServers(),
        config.getGroupId(),
        dlq != null);
    return new EventBus(producer, consumer, dlq);
  }

  public boolean isDlqEnabled() {
    return dlq != null;
  }

  public void start() {
    producer.start();
    consumer.start();
  }

  /**
   * Stops the consumer, waiting for an active poll loop to finish its current records, then the
   * producer. Events dead-lettered during that wait still go out through the producer.
   */
  public void stop() {
    consumer.stop();
    producer.stop();
  }

  public EventEnvelope publish(String eventType, Map<String, ?> payload) {
    return producer.publishEvent(eventType, payload);
  }

  public EventEnvelope publish(String eventType, Map<String, ?> payload, String source) {
    return producer.publishEvent(eventType, payload, source);
  }

  @Override
  public void close() {
    stop();
  }
}
