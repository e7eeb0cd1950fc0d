package com.acme.resilience.retry;

import com.acme.resilience.config.RetryConfig;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a fallible operation with exponential backoff.
 *
 * <p>The delay before retry {@code i} (0-indexed) is {@code min(baseDelay * exponentialBase^i,
 * maxDelay)}, multiplied by a uniform factor in [0.5, 1.5] when jitter is on. Only exceptions
 * accepted by the retry predicate are retried; anything else propagates at once. When all attempts
 * fail the last exception is rethrown unchanged. {@link InterruptedException} is never retried.
 *
 * <pre>{@code
 * RetryWithBackoff retry = RetryWithBackoff.builder("opa-evaluate")
 *     .maxRetries(2)
 *     .retryOn(IOException.class)
 *     .build();
 * Decision decision = retry.execute(() -> client.evaluate(input));
 * }</pre>
 */
public final class RetryWithBackoff {
  private static final Logger log = LoggerFactory.getLogger(RetryWithBackoff.class);

  private final String name;
  private final int maxRetries;
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final double exponentialBase;
  private final boolean jitter;
  private final Predicate<Throwable> retryable;
  private final Sleeper sleeper;
  private final Random random;

  private RetryWithBackoff(Builder builder) {
    this.name = builder.name;
    this.maxRetries = builder.maxRetries;
    this.baseDelay = builder.baseDelay;
    this.maxDelay = builder.maxDelay;
    this.exponentialBase = builder.exponentialBase;
    this.jitter = builder.jitter;
    this.retryable = builder.retryable;
    this.sleeper = builder.sleeper;
    this.random = builder.random;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** A policy with the given settings, retrying every {@link Exception}. */
  public static RetryWithBackoff from(String name, RetryConfig config) {
    return builder(name)
        .maxRetries(config.getMaxRetries())
        .baseDelay(config.getBaseDelay())
        .maxDelay(config.getMaxDelay())
        .exponentialBase(config.getExponentialBase())
        .jitter(config.isJitter())
        .build();
  }

  public String getName() {
    return name;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public <T> T execute(Callable<T> operation) throws Exception {
    Exception last = null;
    for (int attempt = 0; attempt <= maxRetries; attempt++) {
      try {
        return operation.call();
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        if (!retryable.test(e)) {
          throw e;
        }
        last = e;
        if (attempt == maxRetries) {
          break;
        }
        Duration delay = delayFor(attempt);
        log.atInfo()
            .setMessage("retry_attempt")
            .addKeyValue("operation", name)
            .addKeyValue("attempt", attempt + 1)
            .addKeyValue("max_retries", maxRetries)
            .addKeyValue("delay_seconds", delay.toMillis() / 1000.0)
            .addKeyValue("error", String.valueOf(e))
            .log();
        sleeper.sleep(delay);
      }
    }
    log.atWarn()
        .setMessage("retry_exhausted")
        .addKeyValue("operation", name)
        .addKeyValue("attempts", maxRetries + 1)
        .addKeyValue("error", String.valueOf(last))
        .log();
    throw last;
  }

  /** The operation decorated with this policy. */
  public <T> Callable<T> wrap(Callable<T> operation) {
    return () -> execute(operation);
  }

  /** Backoff before retry {@code attempt} (0-indexed), including jitter when enabled. */
  Duration delayFor(int attempt) {
    double seconds =
        Math.min(
            toSeconds(baseDelay) * Math.pow(exponentialBase, attempt), toSeconds(maxDelay));
    if (jitter) {
      Random source = random != null ? random : ThreadLocalRandom.current();
      seconds *= 0.5 + source.nextDouble();
    }
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  private static double toSeconds(Duration duration) {
    return duration.toNanos() / 1_000_000_000d;
  }

  public static final class Builder {
    private final String name;
    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(60);
    private double exponentialBase = 2.0;
    private boolean jitter = true;
    private Predicate<Throwable> retryable = e -> e instanceof Exception;
    private Sleeper sleeper = Sleeper.THREAD;
    private Random random;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder maxRetries(int maxRetries) {
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
      }
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder baseDelay(Duration baseDelay) {
      this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
      return this;
    }

    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
      return this;
    }

    public Builder exponentialBase(double exponentialBase) {
      this.exponentialBase = exponentialBase;
      return this;
    }

    public Builder jitter(boolean jitter) {
      this.jitter = jitter;
      return this;
    }

    /** Retry only these exception types and their subclasses. */
    @SafeVarargs
    public final Builder retryOn(Class<? extends Exception>... types) {
      List<Class<? extends Exception>> retryOn = List.of(types);
      this.retryable = e -> retryOn.stream().anyMatch(type -> type.isInstance(e));
      return this;
    }

    public Builder retryIf(Predicate<Throwable> retryable) {
      this.retryable = Objects.requireNonNull(retryable, "retryable");
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    public Builder random(Random random) {
      this.random = random;
      return this;
    }

    public RetryWithBackoff build() {
      return new RetryWithBackoff(this);
    }
  }
}
