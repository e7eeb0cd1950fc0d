package com.acme.resilience.kafka;

import com.acme.resilience.core.DlqEnvelope;
import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.EventTypeConstants;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;

/** MockConsumer and MockProducer helpers shared by the consumer tests. */
final class KafkaTestSupport {

  private KafkaTestSupport() {}

  static MockConsumer<String, EventEnvelope> mockConsumer() {
    return new MockConsumer<>(OffsetResetStrategy.EARLIEST);
  }

  static MockProducer<String, EventEnvelope> mockProducer() {
    return new MockProducer<>(true, new StringSerializer(), new EnvelopeSerializer());
  }

  /** Assigns partition 0 of {@code topic} and makes its records available to the next poll. */
  static void deliver(
      MockConsumer<String, EventEnvelope> consumer, String topic, List<EventEnvelope> envelopes) {
    TopicPartition partition = new TopicPartition(topic, 0);
    if (!consumer.assignment().contains(partition)) {
      consumer.rebalance(List.of(partition));
      consumer.updateBeginningOffsets(Map.of(partition, 0L));
    }
    long offset = consumer.position(partition);
    for (EventEnvelope envelope : envelopes) {
      consumer.addRecord(
          new ConsumerRecord<>(topic, 0, offset++, envelope.correlationId(), envelope));
    }
  }

  static EventEnvelope event(String type) {
    return EventEnvelope.create(type, "test", Map.of("n", 1), "corr-" + type);
  }

  static EventEnvelope dlqCarrier(DlqEnvelope dlqEnvelope) {
    return EventEnvelope.create(
        EventTypeConstants.DLQ_FAILED,
        EventTypeConstants.DLQ_SOURCE,
        dlqEnvelope.toPayload(),
        dlqEnvelope.originalEvent().correlationId());
  }
}
