package com.acme.resilience.spi;

import com.acme.resilience.core.EventEnvelope;
import java.util.List;

/** Handles a batch as a unit: a failure is attributed to every envelope in it. */
@FunctionalInterface
public interface BatchEventHandler {
  void handle(List<EventEnvelope> batch) throws Exception;
}
