package com.acme.resilience.policy;

import com.acme.resilience.breaker.CircuitBreaker;
import com.acme.resilience.breaker.CircuitBreakerRegistry;
import com.acme.resilience.breaker.CircuitOpenException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards policy evaluation with a circuit breaker and fails closed: an open breaker or any
 * evaluation error yields a denial, never an exception.
 */
public class PolicyGate {
  private static final Logger log = LoggerFactory.getLogger(PolicyGate.class);

  public static final String DEFAULT_BREAKER = "opa";

  private final PolicyEvaluator evaluator;
  private final CircuitBreaker breaker;

  public PolicyGate(PolicyEvaluator evaluator, CircuitBreakerRegistry registry) {
    this(
        evaluator,
        registry.register(
            DEFAULT_BREAKER,
            CircuitBreaker.DEFAULT_FAILURE_THRESHOLD,
            Duration.ofSeconds(30),
            CircuitBreaker.DEFAULT_HALF_OPEN_MAX_CALLS));
  }

  public PolicyGate(PolicyEvaluator evaluator, CircuitBreaker breaker) {
    this.evaluator = evaluator;
    this.breaker = breaker;
  }

  public CircuitBreaker getBreaker() {
    return breaker;
  }

  public PolicyDecision evaluate(Map<String, Object> input) {
    try {
      return breaker.call(() -> evaluator.evaluate(input));
    } catch (CircuitOpenException e) {
      log.warn("Policy evaluation skipped, {}", e.getMessage());
      return PolicyDecision.deny(
          String.format(
              Locale.ROOT,
              "Policy engine unavailable (circuit breaker open, retry after %.1fs)",
              e.getRetryAfterSeconds()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PolicyDecision.deny("Policy evaluation interrupted");
    } catch (Exception e) {
      log.error("Policy evaluation failed, denying", e);
      return PolicyDecision.deny("Policy evaluation error: " + e.getMessage());
    }
  }
}
