package com.acme.resilience.breaker;

import com.acme.resilience.config.BreakerConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure circuit breaker for one named dependency.
 *
 * <p>CLOSED lets calls through and counts failures; {@code failureThreshold} failures trip it to
 * OPEN. Successes while CLOSED never reduce the failure count. OPEN rejects every call with {@link
 * CircuitOpenException} until {@code resetTimeout} has elapsed, after which the breaker reports
 * HALF_OPEN. There is no timer: the transition is evaluated whenever the state is queried or a
 * call is attempted. HALF_OPEN admits at most {@code halfOpenMaxCalls} trial calls; the first
 * trial call to succeed closes the breaker and the first to fail reopens it.
 *
 * <p>Equivalent entry points share the state machine. {@link #call(Callable)} and {@link
 * #run(CheckedRunnable)} wrap an operation and record success on normal return:
 *
 * <pre>{@code
 * breaker.run(() -> client.send(request));
 * }</pre>
 *
 * {@link #acquirePermit()} guards a scoped block. The permit cannot see how the block ended, so
 * the block must call {@link Permit#succeeded()} as its last statement. <b>A permit closed
 * without {@code succeeded()} is recorded as a failure</b>, even when the block returned
 * normally:
 *
 * <pre>{@code
 * try (CircuitBreaker.Permit permit = breaker.acquirePermit()) {
 *   client.send(request);
 *   permit.succeeded();
 * }
 * }</pre>
 *
 * Rejected calls are not counted. Operations that end in {@link InterruptedException} or {@link
 * CancellationException} are treated as cancelled: they release their trial slot and are not
 * recorded as a success or a failure.
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;

  private final String name;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final int halfOpenMaxCalls;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();

  // guarded by lock
  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private int successCount;
  private long totalCalls;
  private Instant lastFailureTime;
  private Instant lastSuccessTime;
  private Instant openedAt;
  private int halfOpenCalls;

  public CircuitBreaker(String name) {
    this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT, DEFAULT_HALF_OPEN_MAX_CALLS);
  }

  public CircuitBreaker(String name, BreakerConfig config) {
    this(
        name,
        config.getFailureThreshold(),
        config.getResetTimeout(),
        config.getHalfOpenMaxCalls(),
        Clock.systemUTC());
  }

  public CircuitBreaker(
      String name, int failureThreshold, Duration resetTimeout, int halfOpenMaxCalls) {
    this(name, failureThreshold, resetTimeout, halfOpenMaxCalls, Clock.systemUTC());
  }

  public CircuitBreaker(
      String name, int failureThreshold, Duration resetTimeout, int halfOpenMaxCalls, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
    }
    if (halfOpenMaxCalls < 1) {
      throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1: " + halfOpenMaxCalls);
    }
    if (resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must not be negative: " + resetTimeout);
    }
    this.failureThreshold = failureThreshold;
    this.halfOpenMaxCalls = halfOpenMaxCalls;
  }

  public String getName() {
    return name;
  }

  public int getFailureThreshold() {
    return failureThreshold;
  }

  public Duration getResetTimeout() {
    return resetTimeout;
  }

  public int getHalfOpenMaxCalls() {
    return halfOpenMaxCalls;
  }

  /** Current state, applying the OPEN to HALF_OPEN transition if the reset timeout has passed. */
  public CircuitState state() {
    lock.lock();
    try {
      return currentState();
    } finally {
      lock.unlock();
    }
  }

  /** Seconds until an OPEN breaker will admit a trial call; 0 when not OPEN. */
  public double retryAfterSeconds() {
    lock.lock();
    try {
      return currentState() == CircuitState.OPEN ? remainingOpenSeconds() : 0.0;
    } finally {
      lock.unlock();
    }
  }

  public CircuitStats stats() {
    lock.lock();
    try {
      return new CircuitStats(
          name,
          currentState(),
          failureCount,
          successCount,
          totalCalls,
          lastFailureTime,
          lastSuccessTime,
          openedAt,
          halfOpenCalls,
          failureThreshold,
          resetTimeout,
          halfOpenMaxCalls);
    } finally {
      lock.unlock();
    }
  }

  /** Forces CLOSED and clears the failure count, the trip time and the trial call counter. */
  public void reset() {
    lock.lock();
    try {
      failureCount = 0;
      openedAt = null;
      halfOpenCalls = 0;
      transitionTo(CircuitState.CLOSED);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs {@code operation} if the breaker admits it, recording the outcome.
   *
   * @throws CircuitOpenException if the breaker is OPEN or out of HALF_OPEN trial calls; the
   *     operation is not run
   * @throws Exception whatever the operation throws, unchanged
   */
  public <T> T call(Callable<T> operation) throws Exception {
    Permit permit = acquirePermit();
    T result;
    try {
      result = operation.call();
    } catch (Throwable t) {
      permit.settle(t);
      throw t;
    }
    permit.succeeded();
    return result;
  }

  /** {@link #call(Callable)} for an operation without a result. */
  public void run(CheckedRunnable operation) throws Exception {
    call(
        () -> {
          operation.run();
          return null;
        });
  }

  /**
   * Asynchronous form of {@link #call(Callable)}. A rejection is reported through the returned
   * future rather than thrown.
   */
  public <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
    Permit permit;
    CompletionStage<T> stage;
    try {
      permit = acquirePermit();
    } catch (CircuitOpenException e) {
      return CompletableFuture.failedFuture(e);
    }
    try {
      stage = operation.get();
    } catch (RuntimeException | Error e) {
      permit.settle(e);
      return CompletableFuture.failedFuture(e);
    }
    return stage
        .toCompletableFuture()
        .whenComplete(
            (value, error) -> {
              if (error == null) {
                permit.succeeded();
              } else {
                permit.settle(unwrap(error));
              }
            });
  }

  /**
   * Admits one call or throws {@link CircuitOpenException}. The returned permit must be settled:
   * call {@link Permit#succeeded()} at the end of the guarded block. Closing an unsettled permit
   * records a failure, so prefer {@link #run(CheckedRunnable)} unless the block needs the permit.
   */
  public Permit acquirePermit() {
    lock.lock();
    try {
      CircuitState current = currentState();
      if (current == CircuitState.OPEN) {
        throw new CircuitOpenException(name, remainingOpenSeconds());
      }
      if (current == CircuitState.HALF_OPEN) {
        if (halfOpenCalls >= halfOpenMaxCalls) {
          throw new CircuitOpenException(name, 0.0);
        }
        halfOpenCalls++;
        return new Permit(true);
      }
      return new Permit(false);
    } finally {
      lock.unlock();
    }
  }

  private void onSuccess() {
    lock.lock();
    try {
      totalCalls++;
      successCount++;
      lastSuccessTime = clock.instant();
      if (state == CircuitState.HALF_OPEN) {
        failureCount = 0;
        halfOpenCalls = 0;
        transitionTo(CircuitState.CLOSED);
      }
    } finally {
      lock.unlock();
    }
  }

  private void onFailure() {
    lock.lock();
    try {
      Instant now = clock.instant();
      totalCalls++;
      failureCount++;
      lastFailureTime = now;
      if (state == CircuitState.HALF_OPEN) {
        openedAt = now;
        halfOpenCalls = 0;
        transitionTo(CircuitState.OPEN);
      } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
        openedAt = now;
        transitionTo(CircuitState.OPEN);
      }
    } finally {
      lock.unlock();
    }
  }

  private void onCancelled(boolean trial) {
    lock.lock();
    try {
      if (trial && state == CircuitState.HALF_OPEN && halfOpenCalls > 0) {
        halfOpenCalls--;
      }
    } finally {
      lock.unlock();
    }
  }

  private CircuitState currentState() {
    if (state == CircuitState.OPEN
        && openedAt != null
        && !clock.instant().isBefore(openedAt.plus(resetTimeout))) {
      halfOpenCalls = 0;
      transitionTo(CircuitState.HALF_OPEN);
    }
    return state;
  }

  private double remainingOpenSeconds() {
    if (openedAt == null) {
      return 0.0;
    }
    Duration remaining = Duration.between(clock.instant(), openedAt.plus(resetTimeout));
    return remaining.isNegative() ? 0.0 : remaining.toMillis() / 1000.0;
  }

  private void transitionTo(CircuitState newState) {
    CircuitState oldState = state;
    if (oldState == newState) {
      return;
    }
    state = newState;
    log.atInfo()
        .setMessage("circuit_breaker_state_change")
        .addKeyValue("name", name)
        .addKeyValue("old_state", oldState.value())
        .addKeyValue("new_state", newState.value())
        .log();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static boolean isCancellation(Throwable error) {
    return error instanceof InterruptedException
        || error instanceof CancellationException
        || Thread.currentThread().isInterrupted();
  }

  @Override
  public String toString() {
    return "CircuitBreaker{name='" + name + "', state=" + state() + "}";
  }

  /** An operation guarded by {@link #run(CheckedRunnable)}. */
  @FunctionalInterface
  public interface CheckedRunnable {
    void run() throws Exception;
  }

  /**
   * One admitted call. Settles exactly once: the first of {@link #succeeded()}, {@link
   * #failed()}, {@link #cancelled()} or {@link #close()} wins.
   */
  public final class Permit implements AutoCloseable {
    private final boolean trial;
    private final AtomicBoolean settled = new AtomicBoolean();

    private Permit(boolean trial) {
      this.trial = trial;
    }

    public void succeeded() {
      if (settled.compareAndSet(false, true)) {
        onSuccess();
      }
    }

    public void failed() {
      if (settled.compareAndSet(false, true)) {
        onFailure();
      }
    }

    public void cancelled() {
      if (settled.compareAndSet(false, true)) {
        onCancelled(trial);
      }
    }

    /**
     * Closing without {@link #succeeded()} counts as a failure, or as a cancellation on an
     * interrupted thread.
     */
    @Override
    public void close() {
      if (Thread.currentThread().isInterrupted()) {
        cancelled();
      } else {
        failed();
      }
    }

    void settle(Throwable error) {
      if (isCancellation(error)) {
        cancelled();
      } else {
        failed();
      }
    }
  }
}
