package com.acme.resilience.retry;

import java.time.Duration;

/** Pause between retry attempts. Replaced in tests to observe delays without waiting. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
