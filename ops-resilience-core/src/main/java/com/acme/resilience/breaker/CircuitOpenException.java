package com.acme.resilience.breaker;

import java.util.Locale;

/**
 * Raised instead of running a guarded operation while a breaker is OPEN or its HALF_OPEN trial
 * budget is used up. Carries no stack trace; it is raised on every rejected call.
 */
public class CircuitOpenException extends RuntimeException {

  private final String name;
  private final double retryAfterSeconds;

  public CircuitOpenException(String name) {
    this(name, 0.0);
  }

  public CircuitOpenException(String name, double retryAfterSeconds) {
    super(
        String.format(
            Locale.ROOT, "Circuit breaker '%s' is OPEN. Retry after %.1fs", name, retryAfterSeconds),
        null,
        false,
        false);
    this.name = name;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public String getName() {
    return name;
  }

  public double getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
