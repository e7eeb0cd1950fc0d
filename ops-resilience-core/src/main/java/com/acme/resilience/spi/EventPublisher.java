package com.acme.resilience.spi;

import com.acme.resilience.core.EventEnvelope;

/**
 * Appends envelopes to a topic. Implementations do not retry; callers wanting more than the
 * broker's own delivery guarantees decorate them (see {@code ResilientPublisher}).
 */
public interface EventPublisher {
  void publish(String topic, EventEnvelope envelope);
}
