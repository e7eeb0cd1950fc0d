package com.acme.resilience.breaker;

import com.acme.resilience.config.BreakerConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named circuit breakers for a process. Registration is idempotent by name: the first call creates
 * the breaker, later calls return it unchanged and ignore their configuration.
 */
public class CircuitBreakerRegistry {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final BreakerConfig defaults;
  private final Clock clock;

  public CircuitBreakerRegistry() {
    this(new BreakerConfig(), Clock.systemUTC());
  }

  public CircuitBreakerRegistry(BreakerConfig defaults) {
    this(defaults, Clock.systemUTC());
  }

  public CircuitBreakerRegistry(BreakerConfig defaults, Clock clock) {
    this.defaults = defaults;
    this.clock = clock;
  }

  /** Registers a breaker with the registry defaults. */
  public CircuitBreaker register(String name) {
    return register(
        name,
        defaults.getFailureThreshold(),
        defaults.getResetTimeout(),
        defaults.getHalfOpenMaxCalls());
  }

  public CircuitBreaker register(
      String name, int failureThreshold, Duration resetTimeout, int halfOpenMaxCalls) {
    return breakers.computeIfAbsent(
        name,
        n -> {
          log.info(
              "Registering circuit breaker: name={}, failureThreshold={}, resetTimeout={}",
              n,
              failureThreshold,
              resetTimeout);
          return new CircuitBreaker(n, failureThreshold, resetTimeout, halfOpenMaxCalls, clock);
        });
  }

  /** Returns the breaker or {@code null} if none is registered under {@code name}. */
  public CircuitBreaker get(String name) {
    return breakers.get(name);
  }

  public CircuitBreaker getOrThrow(String name) {
    CircuitBreaker breaker = breakers.get(name);
    if (breaker == null) {
      throw new IllegalArgumentException("No circuit breaker registered: " + name);
    }
    return breaker;
  }

  public List<String> names() {
    return new ArrayList<>(breakers.keySet());
  }

  public Map<String, CircuitStats> allStats() {
    Map<String, CircuitStats> stats = new LinkedHashMap<>();
    breakers.forEach((name, breaker) -> stats.put(name, breaker.stats()));
    return stats;
  }

  /** Resets the named breaker. Returns false when no such breaker exists. */
  public boolean reset(String name) {
    CircuitBreaker breaker = breakers.get(name);
    if (breaker == null) {
      return false;
    }
    breaker.reset();
    return true;
  }

  public void resetAll() {
    log.warn("Resetting all {} circuit breakers", breakers.size());
    breakers.values().forEach(CircuitBreaker::reset);
  }
}
