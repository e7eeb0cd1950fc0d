package com.acme.resilience.kafka;

import com.acme.resilience.config.MessagingConfig;
import com.acme.resilience.core.EventEnvelope;
import java.util.Arrays;
import java.util.Properties;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Creates Kafka clients for the event bus. Producers are idempotent with {@code acks=all};
 * consumers commit offsets explicitly after each poll.
 */
@Slf4j
public class KafkaClientFactory {

  static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";

  private final MessagingConfig config;
  private final String bootstrapServers;

  public KafkaClientFactory(MessagingConfig config) {
    this.config = config;
    this.bootstrapServers = normalizeBootstrapServers(config.getBootstrapServers());
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public Producer<String, EventEnvelope> createProducer() {
    log.debug("Creating Kafka producer for {}", bootstrapServers);
    return new KafkaProducer<>(producerProperties());
  }

  public Consumer<String, EventEnvelope> createConsumer(String groupId) {
    log.debug("Creating Kafka consumer for {} in group {}", bootstrapServers, groupId);
    return new KafkaConsumer<>(consumerProperties(groupId));
  }

  public Admin createAdmin() {
    return Admin.create(adminProperties(bootstrapServers));
  }

  Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, EnvelopeSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(
        ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) config.getSendTimeout().toMillis());
    props.put(
        ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG,
        (int) Math.min(config.getSendTimeout().toMillis(), 30_000));
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    return props;
  }

  Properties consumerProperties(String groupId) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(
        ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, EnvelopeDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, config.getMaxPollRecords());
    return props;
  }

  static Properties adminProperties(String bootstrapServers) {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, 10_000);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, 15_000);
    return props;
  }

  /**
   * Trims entries, drops empty ones and adds the default port to entries without one. Blank input
   * yields {@code localhost:9092}.
   */
  static String normalizeBootstrapServers(String servers) {
    if (servers == null || servers.isBlank()) {
      return DEFAULT_BOOTSTRAP_SERVERS;
    }
    String normalized =
        Arrays.stream(servers.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.contains(":") ? s : (s.matches("\\d+") ? "localhost:" + s : s + ":9092"))
            .collect(Collectors.joining(","));
    return normalized.isEmpty() ? DEFAULT_BOOTSTRAP_SERVERS : normalized;
  }
}
