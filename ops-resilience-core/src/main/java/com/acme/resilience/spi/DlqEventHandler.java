package com.acme.resilience.spi;

import com.acme.resilience.core.DlqEnvelope;

@FunctionalInterface
public interface DlqEventHandler {
  void handle(DlqEnvelope envelope) throws Exception;
}
