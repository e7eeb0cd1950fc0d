package com.acme.resilience.kafka;

import com.acme.resilience.config.MessagingConfig;
import com.acme.resilience.core.Topics;
import com.acme.resilience.retry.RetryWithBackoff;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.TopicExistsException;

/**
 * Creates the bus topics on application startup. Existing topics are left alone, so running it
 * repeatedly is harmless. Disabled with {@code resilience.messaging.topics.provision=false}.
 */
@Slf4j
@Singleton
@Requires(property = "resilience.messaging.topics.provision", notEquals = "false")
public class KafkaTopicInitializer implements ApplicationEventListener<StartupEvent> {

  private static final long TIMEOUT_SECONDS = 30;

  private final String bootstrapServers;
  private final List<String> topics;
  private final int partitions;
  private final short replicationFactor;
  private final Supplier<Admin> adminFactory;
  private final RetryWithBackoff retry =
      RetryWithBackoff.builder("kafka-topic-provisioning")
          .maxRetries(2)
          .baseDelay(Duration.ofSeconds(1))
          .retryOn(ExecutionException.class, TimeoutException.class, KafkaException.class)
          .build();

  @Inject
  public KafkaTopicInitializer(MessagingConfig config) {
    this(
        config.getBootstrapServers(),
        String.join(",", Topics.ALL),
        config.getTopics().getPartitions(),
        config.getTopics().getReplicationFactor());
  }

  public KafkaTopicInitializer(
      String bootstrapServers, String topics, int partitions, int replicationFactor) {
    this(bootstrapServers, topics, partitions, replicationFactor, null);
  }

  KafkaTopicInitializer(
      String bootstrapServers,
      String topics,
      int partitions,
      int replicationFactor,
      Supplier<Admin> adminFactory) {
    String servers = KafkaClientFactory.normalizeBootstrapServers(bootstrapServers);
    this.bootstrapServers = servers;
    this.topics = parseTopics(topics);
    this.partitions = partitions;
    this.replicationFactor = (short) replicationFactor;
    this.adminFactory =
        adminFactory != null
            ? adminFactory
            : () -> Admin.create(KafkaClientFactory.adminProperties(servers));
  }

  List<String> getTopics() {
    return topics;
  }

  String getBootstrapServers() {
    return bootstrapServers;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    try {
      ensureTopics();
    } catch (IllegalStateException e) {
      log.error("Kafka topic provisioning failed, continuing startup", e);
    }
  }

  /**
   * Creates every configured topic that does not exist yet.
   *
   * @throws IllegalStateException if the broker cannot be reached after retries
   */
  public void ensureTopics() {
    if (topics.isEmpty()) {
      log.info("No Kafka topics configured, skipping provisioning");
      return;
    }
    try (Admin admin = adminFactory.get()) {
      retry.execute(
          () -> {
            createMissing(admin);
            return null;
          });
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted provisioning Kafka topics", e);
    } catch (Exception e) {
      throw new IllegalStateException(
          "Failed to provision Kafka topics " + topics + " on " + bootstrapServers, e);
    }
  }

  private void createMissing(Admin admin)
      throws ExecutionException, InterruptedException, TimeoutException {
    Set<String> existing = admin.listTopics().names().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    List<NewTopic> missing =
        topics.stream()
            .filter(t -> !existing.contains(t))
            .map(t -> new NewTopic(t, partitions, replicationFactor))
            .collect(Collectors.toList());
    if (missing.isEmpty()) {
      log.info("All Kafka topics exist: {}", topics);
      return;
    }
    try {
      admin.createTopics(missing).all().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
      log.info(
          "Created Kafka topics: {} (partitions={}, replicationFactor={})",
          missing.stream().map(NewTopic::name).collect(Collectors.toList()),
          partitions,
          replicationFactor);
    } catch (ExecutionException e) {
      if (!(e.getCause() instanceof TopicExistsException)) {
        throw e;
      }
      log.info("Kafka topics created concurrently by another instance: {}", missing);
    }
  }

  private static List<String> parseTopics(String topics) {
    if (topics == null || topics.isBlank()) {
      return List.of();
    }
    return Arrays.stream(topics.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .collect(Collectors.toList());
  }
}
