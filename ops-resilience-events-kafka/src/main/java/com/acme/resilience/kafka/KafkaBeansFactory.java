package com.acme.resilience.kafka;

import com.acme.resilience.breaker.CircuitBreakerRegistry;
import com.acme.resilience.config.BreakerConfig;
import com.acme.resilience.config.MessagingConfig;
import com.acme.resilience.config.RetryConfig;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for the resilience and event bus beans.
 *
 * <p>The core module stays free of framework dependencies; this factory binds its configuration
 * POJOs to {@code resilience.*} properties and wires them into Micronaut.
 */
@Factory
public class KafkaBeansFactory {

  /** Creates MessagingConfig bean populated from resilience.messaging.* properties */
  @Singleton
  @ConfigurationProperties("resilience.messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  /** Creates BreakerConfig bean populated from resilience.breaker.* properties */
  @Singleton
  @ConfigurationProperties("resilience.breaker")
  public BreakerConfig breakerConfig() {
    return new BreakerConfig();
  }

  /** Creates RetryConfig bean populated from resilience.retry.* properties */
  @Singleton
  @ConfigurationProperties("resilience.retry")
  public RetryConfig retryConfig() {
    return new RetryConfig();
  }

  @Singleton
  public CircuitBreakerRegistry circuitBreakerRegistry(BreakerConfig breakerConfig) {
    return new CircuitBreakerRegistry(breakerConfig);
  }

  @Singleton
  public KafkaClientFactory kafkaClientFactory(MessagingConfig messagingConfig) {
    return new KafkaClientFactory(messagingConfig);
  }

  /** Creates the EventBus; it is stopped when the context shuts down. */
  @Singleton
  @Bean(preDestroy = "stop")
  public EventBus eventBus(
      KafkaClientFactory clients,
      MessagingConfig messagingConfig,
      CircuitBreakerRegistry breakers,
      RetryConfig retryConfig) {
    return EventBus.create(clients, messagingConfig, breakers, retryConfig);
  }

  /** Creates a DlqConsumer in the configured DLQ group; not started. */
  @Singleton
  @Bean(preDestroy = "stop")
  public DlqConsumer dlqConsumer(KafkaClientFactory clients, MessagingConfig messagingConfig) {
    return new DlqConsumer(
        () -> clients.createConsumer(messagingConfig.getDlq().getGroupId()),
        messagingConfig.getPollTimeout());
  }
}
