package com.acme.resilience.breaker;

import com.fasterxml.jackson.annotation.JsonValue;

/** Circuit breaker states. The wire value is the lowercase name used in stats and logs. */
public enum CircuitState {
  CLOSED("closed"),
  OPEN("open"),
  HALF_OPEN("half_open");

  private final String value;

  CircuitState(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
