package com.acme.resilience.kafka;

import com.acme.resilience.core.DlqEnvelope;
import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.Topics;
import com.acme.resilience.spi.DlqEventHandler;
import com.acme.resilience.spi.EventPublisher;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Reads the dead-letter topic. Handlers receive the decoded {@link DlqEnvelope}, never the carrier
 * envelope. {@link #replay} republishes original events to the topics they failed on.
 */
@Slf4j
public class DlqConsumer extends AbstractEnvelopeConsumer {

  public static final String DEFAULT_GROUP_ID = "ops-dlq";

  public DlqConsumer(Supplier<Consumer<String, EventEnvelope>> consumerFactory, Duration pollTimeout) {
    super(consumerFactory, List.of(Topics.DLQ), pollTimeout);
  }

  /** Invokes {@code handler} for each dead-lettered event until {@link #stop()}. */
  public void consume(DlqEventHandler handler) {
    runLoop(
        records -> {
          for (ConsumerRecord<String, EventEnvelope> record : records) {
            DlqEnvelope dlqEnvelope = decode(record);
            if (dlqEnvelope == null) {
              continue;
            }
            try {
              handler.handle(dlqEnvelope);
            } catch (VirtualMachineError e) {
              throw e;
            } catch (Throwable e) {
              log.error("DLQ handler failed: dlqId={}", dlqEnvelope.dlqId(), e);
            }
          }
        });
  }

  public int replay(EventPublisher publisher) {
    return replay(publisher, null);
  }

  /**
   * Republishes the original event of every currently available DLQ entry accepted by {@code
   * filter} ({@code null} accepts all) to its source topic. A failed publish is logged and skipped.
   *
   * <p>Offsets are committed for every entry read, including entries the filter rejects and
   * entries whose publish failed. A later replay in the same consumer group starts after them; to
   * revisit skipped entries, replay from a fresh group id.
   *
   * @return the number of events successfully republished
   */
  public int replay(EventPublisher publisher, Predicate<DlqEnvelope> filter) {
    AtomicInteger replayed = new AtomicInteger();
    drain(
        records -> {
          for (ConsumerRecord<String, EventEnvelope> record : records) {
            DlqEnvelope dlqEnvelope = decode(record);
            if (dlqEnvelope == null || (filter != null && !filter.test(dlqEnvelope))) {
              continue;
            }
            EventEnvelope original = dlqEnvelope.originalEvent();
            try {
              publisher.publish(dlqEnvelope.sourceTopic(), original);
              replayed.incrementAndGet();
              log.info(
                  "Replayed event: eventId={}, topic={}, dlqId={}",
                  original.eventId(),
                  dlqEnvelope.sourceTopic(),
                  dlqEnvelope.dlqId());
            } catch (RuntimeException e) {
              log.error(
                  "Replay failed: eventId={}, topic={}, dlqId={}",
                  original.eventId(),
                  dlqEnvelope.sourceTopic(),
                  dlqEnvelope.dlqId(),
                  e);
            }
          }
        });
    log.info("DLQ replay finished: replayed={}", replayed.get());
    return replayed.get();
  }

  private static DlqEnvelope decode(ConsumerRecord<String, EventEnvelope> record) {
    EventEnvelope carrier = record.value();
    if (carrier == null) {
      return null;
    }
    try {
      return DlqEnvelope.fromPayload(carrier.payload());
    } catch (IllegalArgumentException e) {
      log.error(
          "Skipping malformed DLQ entry: partition={}, offset={}, eventId={}",
          record.partition(),
          record.offset(),
          carrier.eventId(),
          e);
      return null;
    }
  }
}
