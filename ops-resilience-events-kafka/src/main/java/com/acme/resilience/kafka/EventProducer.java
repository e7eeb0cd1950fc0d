package com.acme.resilience.kafka;

import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.EventTypeConstants;
import com.acme.resilience.core.PublishException;
import com.acme.resilience.core.Topics;
import com.acme.resilience.spi.EventPublisher;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;

/**
 * Publishes envelopes to Kafka and waits for the broker acknowledgement. Records are keyed by
 * correlation id so one flow stays on one partition. No retries of its own.
 *
 * <p>Publishing before {@link #start()} or after {@link #stop()} logs a warning and drops the
 * envelope.
 */
@Slf4j
public class EventProducer implements EventPublisher, AutoCloseable {

  private final Supplier<Producer<String, EventEnvelope>> producerFactory;
  private final Duration sendTimeout;
  private volatile Producer<String, EventEnvelope> producer;

  public EventProducer(
      Supplier<Producer<String, EventEnvelope>> producerFactory, Duration sendTimeout) {
    this.producerFactory = producerFactory;
    this.sendTimeout = sendTimeout;
  }

  public synchronized void start() {
    if (producer != null) {
      return;
    }
    producer = producerFactory.get();
    log.info("Event producer started");
  }

  public synchronized void stop() {
    Producer<String, EventEnvelope> current = producer;
    if (current == null) {
      return;
    }
    producer = null;
    try {
      current.flush();
    } finally {
      current.close(sendTimeout);
    }
    log.info("Event producer stopped");
  }

  public boolean isRunning() {
    return producer != null;
  }

  /**
   * @throws PublishException if the broker does not acknowledge the record within the send timeout
   */
  @Override
  public void publish(String topic, EventEnvelope envelope) {
    send(topic, envelope, false);
  }

  /**
   * A view of this producer that raises {@link PublishException} instead of dropping the envelope
   * when the producer is not started. Used where a dropped publish would lose data, such as the
   * dead-letter queue.
   */
  public EventPublisher strictPublisher() {
    return (topic, envelope) -> send(topic, envelope, true);
  }

  private void send(String topic, EventEnvelope envelope, boolean failWhenStopped) {
    Producer<String, EventEnvelope> current = producer;
    if (current == null) {
      if (failWhenStopped) {
        throw new PublishException(
            "Producer not started, cannot publish event " + envelope.eventId() + " to " + topic,
            null);
      }
      log.warn(
          "Producer not started, dropping event: topic={}, eventId={}, type={}",
          topic,
          envelope.eventId(),
          envelope.eventType());
      return;
    }
    ProducerRecord<String, EventEnvelope> record =
        new ProducerRecord<>(topic, envelope.correlationId(), envelope);
    try {
      RecordMetadata metadata =
          current.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug(
          "Published event: topic={}, partition={}, offset={}, eventId={}",
          metadata.topic(),
          metadata.partition(),
          metadata.offset(),
          envelope.eventId());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PublishException("Interrupted publishing to Kafka topic " + topic, e);
    } catch (ExecutionException e) {
      throw new PublishException("Failed to publish to Kafka topic " + topic, e.getCause());
    } catch (TimeoutException e) {
      throw new PublishException("Timed out publishing to Kafka topic " + topic, e);
    } catch (KafkaException e) {
      throw new PublishException("Failed to publish to Kafka topic " + topic, e);
    }
  }

  public EventEnvelope publishEvent(String eventType, Map<String, ?> payload) {
    return publishEvent(eventType, payload, EventTypeConstants.DEFAULT_SOURCE);
  }

  /** Publishes an application event to {@link Topics#EVENTS}. */
  public EventEnvelope publishEvent(String eventType, Map<String, ?> payload, String source) {
    EventEnvelope envelope = EventEnvelope.create(eventType, source, payload);
    publish(Topics.EVENTS, envelope);
    return envelope;
  }

  /** Publishes an agent's result to {@link Topics#AGENT_RESULTS}. */
  public EventEnvelope publishResult(
      String agentType, Map<String, ?> result, String correlationId) {
    EventEnvelope envelope =
        EventEnvelope.create(
            EventTypeConstants.AGENT_RESULT_PREFIX + agentType,
            EventTypeConstants.AGENT_SOURCE_PREFIX + agentType,
            result,
            correlationId);
    publish(Topics.AGENT_RESULTS, envelope);
    return envelope;
  }

  /** Publishes an audit record to {@link Topics#AUDIT}. */
  public EventEnvelope publishAudit(String action, Map<String, ?> details) {
    EventEnvelope envelope =
        EventEnvelope.create(
            EventTypeConstants.AUDIT_PREFIX + action, EventTypeConstants.AUDIT_SOURCE, details);
    publish(Topics.AUDIT, envelope);
    return envelope;
  }

  @Override
  public void close() {
    stop();
  }
}
