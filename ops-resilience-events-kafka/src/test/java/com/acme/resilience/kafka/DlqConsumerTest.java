package com.acme.resilience.kafka;

import static com.acme.resilience.kafka.KafkaTestSupport.deliver;
import static com.acme.resilience.kafka.KafkaTestSupport.dlqCarrier;
import static com.acme.resilience.kafka.KafkaTestSupport.event;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.acme.resilience.core.DlqEnvelope;
import com.acme.resilience.core.EventEnvelope;
import com.acme.resilience.core.PublishException;
import com.acme.resilience.core.Topics;
import com.acme.resilience.spi.EventPublisher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DlqConsumer Tests")
class DlqConsumerTest {

  @Mock private EventPublisher publisher;

  private MockConsumer<String, EventEnvelope> mockConsumer;
  private DlqConsumer dlqConsumer;

  @BeforeEach
  void setUp() {
    mockConsumer = KafkaTestSupport.mockConsumer();
    dlqConsumer = new DlqConsumer(() -> mockConsumer, Duration.ofMillis(10));
  }

  private static DlqEnvelope dead(String type, String sourceTopic) {
    return DlqEnvelope.of(event(type), "fail", "RuntimeException", sourceTopic, 3, 3);
  }

  @Test
  @DisplayName("should subscribe to the DLQ topic only")
  void testTopics() {
    assertThat(dlqConsumer.getTopics()).containsExactly(Topics.DLQ);
    assertThat(DlqConsumer.DEFAULT_GROUP_ID).isEqualTo("ops-dlq");
  }

  @Test
  @DisplayName("should be a no-op when not started")
  void testNotStarted() {
    List<DlqEnvelope> seen = new ArrayList<>();

    dlqConsumer.stop();
    dlqConsumer.consume(seen::add);

    assertThat(dlqConsumer.replay(publisher)).isZero();
    assertThat(seen).isEmpty();
    verifyNoInteractions(publisher);
  }

  @Test
  @DisplayName("should hand decoded DLQ envelopes to the handler")
  void testConsume() {
    DlqEnvelope first = dead("a", Topics.EVENTS);
    DlqEnvelope second = dead("b", Topics.AUDIT);
    List<DlqEnvelope> seen = new ArrayList<>();
    dlqConsumer.start();
    mockConsumer.schedulePollTask(
        () -> deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(first), dlqCarrier(second))));
    mockConsumer.schedulePollTask(dlqConsumer::stop);

    dlqConsumer.consume(seen::add);

    assertThat(seen).containsExactly(first, second);
  }

  @Test
  @DisplayName("should skip carriers that do not hold a DLQ envelope")
  void testMalformedCarrier() {
    DlqEnvelope valid = dead("a", Topics.EVENTS);
    EventEnvelope malformed = EventEnvelope.create("dlq.failed", "ops.dlq", Map.of("x", 1));
    List<DlqEnvelope> seen = new ArrayList<>();
    dlqConsumer.start();
    mockConsumer.schedulePollTask(
        () -> deliver(mockConsumer, Topics.DLQ, List.of(malformed, dlqCarrier(valid))));
    mockConsumer.schedulePollTask(dlqConsumer::stop);

    dlqConsumer.consume(seen::add);

    assertThat(seen).containsExactly(valid);
  }

  @Test
  @DisplayName("should keep consuming after a handler throws an Error")
  void testHandlerError() {
    DlqEnvelope first = dead("a", Topics.EVENTS);
    DlqEnvelope second = dead("b", Topics.EVENTS);
    List<DlqEnvelope> seen = new ArrayList<>();
    dlqConsumer.start();
    mockConsumer.schedulePollTask(
        () -> deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(first), dlqCarrier(second))));
    mockConsumer.schedulePollTask(dlqConsumer::stop);

    dlqConsumer.consume(
        d -> {
          if (d.equals(first)) {
            throw new AssertionError("handler bug");
          }
          seen.add(d);
        });

    assertThat(seen).containsExactly(second);
    assertThat(mockConsumer.closed()).isTrue();
  }

  @Nested
  @DisplayName("Replay")
  class Replay {

    @Test
    @DisplayName("should republish every original event to its source topic")
    void testReplayAll() {
      DlqEnvelope first = dead("a", Topics.EVENTS);
      DlqEnvelope second = dead("b", Topics.AGENT_RESULTS);
      dlqConsumer.start();
      deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(first), dlqCarrier(second)));

      int replayed = dlqConsumer.replay(publisher);

      assertThat(replayed).isEqualTo(2);
      verify(publisher).publish(Topics.EVENTS, first.originalEvent());
      verify(publisher).publish(Topics.AGENT_RESULTS, second.originalEvent());
    }

    @Test
    @DisplayName("should only republish entries accepted by the filter")
    void testReplayFiltered() {
      DlqEnvelope keep = dead("keep", Topics.EVENTS);
      DlqEnvelope skip = dead("skip", Topics.EVENTS);
      dlqConsumer.start();
      deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(keep), dlqCarrier(skip)));

      int replayed =
          dlqConsumer.replay(
              publisher, d -> d.originalEvent().eventType().equals("keep"));

      assertThat(replayed).isEqualTo(1);
      verify(publisher).publish(Topics.EVENTS, keep.originalEvent());
      verify(publisher, never()).publish(any(), eq(skip.originalEvent()));
    }

    @Test
    @DisplayName("should commit past entries the filter rejected")
    void testReplayFilteredCommitsRejected() {
      DlqEnvelope skip = dead("skip", Topics.EVENTS);
      DlqEnvelope keep = dead("keep", Topics.EVENTS);
      TopicPartition partition = new TopicPartition(Topics.DLQ, 0);
      dlqConsumer.start();
      deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(skip), dlqCarrier(keep)));

      dlqConsumer.replay(publisher, d -> d.originalEvent().eventType().equals("keep"));

      Map<TopicPartition, OffsetAndMetadata> committed = mockConsumer.committed(Set.of(partition));
      assertThat(committed.get(partition).offset()).isEqualTo(2L);
      verify(publisher, never()).publish(any(), eq(skip.originalEvent()));
    }

    @Test
    @DisplayName("should count only successful publishes and keep going after a failure")
    void testReplayPartialFailure() {
      DlqEnvelope failing = dead("failing", Topics.EVENTS);
      DlqEnvelope ok = dead("ok", Topics.EVENTS);
      lenient()
          .doThrow(new PublishException("broker down", null))
          .when(publisher)
          .publish(Topics.EVENTS, failing.originalEvent());
      dlqConsumer.start();
      deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(failing), dlqCarrier(ok)));

      int replayed = dlqConsumer.replay(publisher);

      assertThat(replayed).isEqualTo(1);
      verify(publisher).publish(Topics.EVENTS, ok.originalEvent());
    }

    @Test
    @DisplayName("should leave the consumer usable after replay")
    void testReplayKeepsConsumerOpen() {
      dlqConsumer.start();
      deliver(mockConsumer, Topics.DLQ, List.of(dlqCarrier(dead("a", Topics.EVENTS))));

      dlqConsumer.replay(publisher);

      assertThat(mockConsumer.closed()).isFalse();
      assertThat(dlqConsumer.isRunning()).isTrue();
      dlqConsumer.stop();
      assertThat(mockConsumer.closed()).isTrue();
    }
  }
}
