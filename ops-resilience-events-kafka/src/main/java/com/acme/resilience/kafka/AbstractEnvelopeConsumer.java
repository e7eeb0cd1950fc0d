package com.acme.resilience.kafka;

import com.acme.resilience.core.EventEnvelope;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.WakeupException;

/**
 * Base class for envelope consumers. Owns the Kafka consumer lifecycle and a single poll loop per
 * instance.
 *
 * <p>{@link #start()} creates and subscribes the consumer. Poll loops run on the caller's thread
 * until {@link #stop()}, which may be called from any thread. It wakes a blocked poll and waits
 * for the loop to finish the records it is handling. The Kafka consumer is only touched by the
 * thread running the loop; it is closed by the loop when the loop is active and by {@code stop()}
 * otherwise. Offsets are committed after each processed poll, so delivery is at least once.
 */
@Slf4j
public abstract class AbstractEnvelopeConsumer implements AutoCloseable {

  static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

  private final Supplier<Consumer<String, EventEnvelope>> consumerFactory;
  private final List<String> topics;
  private final Duration pollTimeout;

  private final Object lifecycle = new Object();
  // guarded by lifecycle
  private Consumer<String, EventEnvelope> consumer;
  private boolean polling;
  private Thread loopThread;
  private CountDownLatch loopExited;
  private volatile boolean running;

  protected AbstractEnvelopeConsumer(
      Supplier<Consumer<String, EventEnvelope>> consumerFactory,
      Collection<String> topics,
      Duration pollTimeout) {
    this.consumerFactory = consumerFactory;
    this.topics = List.copyOf(topics);
    this.pollTimeout = pollTimeout;
  }

  public List<String> getTopics() {
    return topics;
  }

  public boolean isRunning() {
    return running;
  }

  public void start() {
    synchronized (lifecycle) {
      if (consumer != null) {
        return;
      }
      consumer = consumerFactory.get();
      consumer.subscribe(topics);
      running = true;
    }
    log.info("{} started: topics={}", getClass().getSimpleName(), topics);
  }

  /**
   * Stops the loop and closes the consumer. Safe to call when never started.
   *
   * <p>When a loop is active on another thread this blocks until the loop has handled its current
   * records and closed the consumer, for at most {@link #STOP_TIMEOUT}. Called from the loop
   * thread itself (from a handler), it only signals the loop and returns.
   */
  public void stop() {
    Consumer<String, EventEnvelope> toClose = null;
    CountDownLatch awaitExit = null;
    synchronized (lifecycle) {
      if (consumer == null) {
        return;
      }
      running = false;
      if (polling) {
        consumer.wakeup();
        if (loopThread != Thread.currentThread()) {
          awaitExit = loopExited;
        }
      } else {
        toClose = consumer;
        consumer = null;
      }
    }
    if (toClose != null) {
      closeQuietly(toClose);
    } else if (awaitExit != null) {
      awaitLoopExit(awaitExit);
    }
  }

  private void awaitLoopExit(CountDownLatch exited) {
    try {
      if (!exited.await(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "{} poll loop still running {} after stop", getClass().getSimpleName(), STOP_TIMEOUT);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted waiting for {} poll loop to exit", getClass().getSimpleName());
    }
  }

  @Override
  public void close() {
    stop();
  }

  /** Receives each non-empty poll result on the loop thread. */
  @FunctionalInterface
  protected interface PollHandler {
    void onRecords(ConsumerRecords<String, EventEnvelope> records);
  }

  /**
   * Polls until {@link #stop()}. Returns at once if the consumer is not started or another loop
   * is already active.
   */
  protected void runLoop(PollHandler handler) {
    Consumer<String, EventEnvelope> active = enterLoop();
    if (active == null) {
      return;
    }
    try {
      while (running) {
        ConsumerRecords<String, EventEnvelope> records = pollOnce(active);
        if (records == null || records.isEmpty()) {
          continue;
        }
        handler.onRecords(records);
        commit(active);
      }
    } catch (WakeupException e) {
      if (running) {
        throw e;
      }
    } finally {
      exitLoop(active);
    }
  }

  /**
   * Polls until a poll returns nothing, handing every non-empty result to {@code handler}. Used
   * for draining what is currently available.
   */
  protected void drain(PollHandler handler) {
    Consumer<String, EventEnvelope> active = enterLoop();
    if (active == null) {
      return;
    }
    try {
      while (running) {
        ConsumerRecords<String, EventEnvelope> records = pollOnce(active);
        if (records == null) {
          continue;
        }
        if (records.isEmpty()) {
          break;
        }
        handler.onRecords(records);
        commit(active);
      }
    } catch (WakeupException e) {
      if (running) {
        throw e;
      }
    } finally {
      exitLoop(active);
    }
  }

  private Consumer<String, EventEnvelope> enterLoop() {
    synchronized (lifecycle) {
      if (consumer == null || !running) {
        log.warn("{} not started, nothing to consume", getClass().getSimpleName());
        return null;
      }
      if (polling) {
        log.warn("{} already has an active poll loop", getClass().getSimpleName());
        return null;
      }
      polling = true;
      loopThread = Thread.currentThread();
      loopExited = new CountDownLatch(1);
      return consumer;
    }
  }

  private void exitLoop(Consumer<String, EventEnvelope> active) {
    boolean close;
    CountDownLatch exited;
    synchronized (lifecycle) {
      polling = false;
      loopThread = null;
      exited = loopExited;
      loopExited = null;
      close = !running && consumer == active;
      if (close) {
        consumer = null;
      }
    }
    try {
      if (close) {
        closeQuietly(active);
      }
    } finally {
      exited.countDown();
    }
  }

  /** Returns {@code null} when an undecodable record was skipped and the poll should be repeated. */
  private ConsumerRecords<String, EventEnvelope> pollOnce(Consumer<String, EventEnvelope> active) {
    try {
      return active.poll(pollTimeout);
    } catch (RecordDeserializationException e) {
      log.error(
          "Skipping undecodable record: topic={}, partition={}, offset={}",
          e.topicPartition().topic(),
          e.topicPartition().partition(),
          e.offset(),
          e);
      active.seek(e.topicPartition(), e.offset() + 1);
      return null;
    } catch (WakeupException e) {
      throw e;
    } catch (KafkaException e) {
      log.error("Poll failed on topics {}", topics, e);
      return ConsumerRecords.empty();
    }
  }

  private void commit(Consumer<String, EventEnvelope> active) {
    try {
      active.commitSync();
    } catch (WakeupException e) {
      throw e;
    } catch (KafkaException e) {
      log.warn("Offset commit failed on topics {}, records may be redelivered", topics, e);
    }
  }

  private void closeQuietly(Consumer<String, EventEnvelope> toClose) {
    try {
      toClose.close();
      log.info("{} stopped", getClass().getSimpleName());
    } catch (KafkaException e) {
      log.warn("Error closing {}", getClass().getSimpleName(), e);
    }
  }
}
