package com.acme.resilience.spi;

import com.acme.resilience.core.EventEnvelope;

@FunctionalInterface
public interface EventHandler {
  void handle(EventEnvelope envelope) throws Exception;
}
