package com.acme.resilience.core;

/**
 * Central constants for event types and sources written by the event bus. These constants
 * eliminate magic strings shared by producers, the dead-letter queue and its consumers.
 */
public final class EventTypeConstants {

  // Event types
  public static final String DLQ_FAILED = "dlq.failed";
  public static final String AGENT_RESULT_PREFIX = "agent.result.";
  public static final String AUDIT_PREFIX = "audit.";

  // Sources
  public static final String DEFAULT_SOURCE = "ops";
  public static final String DLQ_SOURCE = "ops.dlq";
  public static final String AUDIT_SOURCE = "ops.audit";
  public static final String AGENT_SOURCE_PREFIX = "agent.";

  private EventTypeConstants() {
    // Utility class - prevent instantiation
  }
}
