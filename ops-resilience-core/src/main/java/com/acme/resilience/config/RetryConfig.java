package com.acme.resilience.config;

import java.time.Duration;

/**
 * Retry-with-backoff settings. {@code maxRetries} counts attempts after the first, so 3 means up to
 * 4 invocations.
 */
public class RetryConfig {

  private int maxRetries = 3;
  private Duration baseDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(60);
  private double exponentialBase = 2.0;
  private boolean jitter = true;

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getBaseDelay() {
    return baseDelay;
  }

  public void setBaseDelay(Duration baseDelay) {
    this.baseDelay = baseDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public void setMaxDelay(Duration maxDelay) {
    this.maxDelay = maxDelay;
  }

  public double getExponentialBase() {
    return exponentialBase;
  }

  public void setExponentialBase(double exponentialBase) {
    this.exponentialBase = exponentialBase;
  }

  public boolean isJitter() {
    return jitter;
  }

  public void setJitter(boolean jitter) {
    this.jitter = jitter;
  }
}
