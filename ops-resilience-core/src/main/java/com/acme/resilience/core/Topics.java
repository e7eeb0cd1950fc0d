package com.acme.resilience.core;

import java.util.List;

/** The closed set of topics the bus reads and writes. */
public final class Topics {

  public static final String EVENTS = "ops.events";
  public static final String AGENT_RESULTS = "ops.agent.results";
  public static final String AUDIT = "ops.audit";
  public static final String DLQ = "ops.dlq";

  /** Topics carrying application events; what an event bus consumer subscribes to. */
  public static final List<String> APPLICATION = List.of(EVENTS, AGENT_RESULTS, AUDIT);

  /** Every topic, including the DLQ. Used for provisioning. */
  public static final List<String> ALL = List.of(EVENTS, AGENT_RESULTS, AUDIT, DLQ);

  private Topics() {}
}
