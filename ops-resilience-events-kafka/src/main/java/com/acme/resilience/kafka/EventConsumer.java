package com.acme.resilience.kafka;

import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.spi.BatchEventHandler;
import com.acme.resilience.spi.EventHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;

/**
 * Consumes application events and escalates repeated failures to the dead-letter queue.
 *
 * <p>Failures are counted per event id across redeliveries. An event is sent to the DLQ on the
 * failure after its {@code maxRetries} redeliveries are used up, so with {@code maxRetries = 2}
 * the third failure dead-letters it. Until then the failure is logged and the event is left for
 * the broker to present again. The counters live in this instance only and are lost on restart.
 * Without a DLQ failures are only logged.
 *
 * <p>A handler throwing any {@link Exception} or {@link Error} counts as a failure; only a {@link
 * VirtualMachineError} ends the loop. At most {@value #DEFAULT_MAX_TRACKED_EVENTS} counters are
 * kept by default; past that the least recently failed event loses its count.
 */
@Slf4j
public class EventConsumer extends AbstractEnvelopeConsumer {

  public static final int DEFAULT_MAX_TRACKED_EVENTS = 10_000;

  private final DeadLetterQueue dlq;
  // only touched by the poll loop thread
  private final Map<String, Integer> retryCounts;

  /**
   * @param dlq dead-letter queue for exhausted events, or {@code null} to only log failures
   */
  public EventConsumer(
      Supplier<Consumer<String, EventEnvelope>> consumerFactory,
      Collection<String> topics,
      Duration pollTimeout,
      DeadLetterQueue dlq) {
    this(consumerFactory, topics, pollTimeout, dlq, DEFAULT_MAX_TRACKED_EVENTS);
  }

  EventConsumer(
      Supplier<Consumer<String, EventEnvelope>> consumerFactory,
      Collection<String> topics,
      Duration pollTimeout,
      DeadLetterQueue dlq,
      int maxTrackedEvents) {
    super(consumerFactory, topics, pollTimeout);
    if (maxTrackedEvents < 1) {
      throw new IllegalArgumentException("maxTrackedEvents must be >= 1: " + maxTrackedEvents);
    }
    this.dlq = dlq;
    this.retryCounts =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
            if (size() <= maxTrackedEvents) {
              return false;
            }
            log.warn(
                "Retry counter limit {} reached, dropping count for eventId={}, failures={}",
                maxTrackedEvents,
                eldest.getKey(),
                eldest.getValue());
            return true;
          }
        };
  }

  public DeadLetterQueue getDlq() {
    return dlq;
  }

  /** Failure count recorded for an event id, 0 when none. */
  public int retryCount(String eventId) {
    return retryCounts.getOrDefault(eventId, 0);
  }

  /** Invokes {@code handler} for each delivered event until {@link #stop()}. */
  public void consume(EventHandler handler) {
    runLoop(
        records -> {
          for (ConsumerRecord<String, EventEnvelope> record : records) {
            process(record, handler);
          }
        });
  }

  /**
   * Invokes {@code handler} once per partition batch until {@link #stop()}. A failed batch is sent
   * to the DLQ event by event, regardless of earlier failures.
   */
  public void consumeBatch(BatchEventHandler handler) {
    runLoop(records -> processBatches(records, handler));
  }

  void process(ConsumerRecord<String, EventEnvelope> record, EventHandler handler) {
    EventEnvelope envelope = record.value();
    if (envelope == null) {
      log.warn(
          "Skipping empty record: topic={}, partition={}, offset={}",
          record.topic(),
          record.partition(),
          record.offset());
      return;
    }
    try {
      handler.handle(envelope);
      retryCounts.remove(envelope.eventId());
      log.debug("Processed event: eventId={}, type={}", envelope.eventId(), envelope.eventType());
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable e) {
      onFailure(envelope, record.topic(), e);
    }
  }

  private void onFailure(EventEnvelope envelope, String topic, Throwable error) {
    int count = retryCounts.merge(envelope.eventId(), 1, Integer::sum);
    // count failures mean count - 1 redeliveries have already been spent
    if (dlq != null && !dlq.shouldRetry(count - 1)) {
      try {
        dlq.sendToDlq(envelope, error, topic, count);
        retryCounts.remove(envelope.eventId());
      } catch (RuntimeException dlqError) {
        log.error(
            "Failed to send event to DLQ, keeping retry count: eventId={}, retryCount={}",
            envelope.eventId(),
            count,
            dlqError);
      }
      return;
    }
    log.warn(
        "Event handling failed, awaiting redelivery: eventId={}, type={}, topic={}, failures={}",
        envelope.eventId(),
        envelope.eventType(),
        topic,
        count,
        error);
  }

  private void processBatches(
      ConsumerRecords<String, EventEnvelope> records, BatchEventHandler handler) {
    for (TopicPartition partition : records.partitions()) {
      List<ConsumerRecord<String, EventEnvelope>> partitionRecords = records.records(partition);
      List<EventEnvelope> batch = new ArrayList<>(partitionRecords.size());
      for (ConsumerRecord<String, EventEnvelope> record : partitionRecords) {
        if (record.value() != null) {
          batch.add(record.value());
        }
      }
      if (batch.isEmpty()) {
        continue;
      }
      try {
        handler.handle(batch);
        log.debug("Processed batch: partition={}, size={}", partition, batch.size());
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable e) {
        onBatchFailure(partition, batch, e);
      }
    }
  }

  private void onBatchFailure(
      TopicPartition partition, List<EventEnvelope> batch, Throwable error) {
    if (dlq == null) {
      log.error("Batch handling failed: partition={}, size={}", partition, batch.size(), error);
      return;
    }
    log.error(
        "Batch handling failed, sending {} events to DLQ: partition={}",
        batch.size(),
        partition,
        error);
    for (EventEnvelope envelope : batch) {
      try {
        dlq.sendToDlq(envelope, error, partition.topic(), 1);
      } catch (RuntimeException dlqError) {
        log.error("Failed to send event to DLQ: eventId={}", envelope.eventId(), dlqError);
      }
    }
  }
}
