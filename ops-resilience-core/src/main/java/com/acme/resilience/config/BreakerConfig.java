package com.acme.resilience.config;

import java.time.Duration;

/** Circuit breaker defaults. Pure POJO - no framework dependencies. */
public class BreakerConfig {

  private int failureThreshold = 5;
  private Duration resetTimeout = Duration.ofSeconds(30);
  private int halfOpenMaxCalls = 3;

  public int getFailureThreshold() {
    return failureThreshold;
  }

  public void setFailureThreshold(int failureThreshold) {
    this.failureThreshold = failureThreshold;
  }

  public Duration getResetTimeout() {
    return resetTimeout;
  }

  public void setResetTimeout(Duration resetTimeout) {
    this.resetTimeout = resetTimeout;
  }

  public int getHalfOpenMaxCalls() {
    return halfOpenMaxCalls;
  }

  public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
    this.halfOpenMaxCalls = halfOpenMaxCalls;
  }
}
