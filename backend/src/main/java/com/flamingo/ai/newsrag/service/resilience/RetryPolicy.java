package com.flamingo.ai.newsrag.service.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry schedule shared by network-calling components.
 *
 * <p>Every attempt is preceded by a wait: attempt 1 waits {@code baseDelay}, attempt {@code n > 1}
 * waits {@code baseDelay + 2^(n-1) * backoffUnit}. The first wait is paid here, the later ones are
 * driven by a Resilience4j {@link Retry} whose interval function encodes the same formula. Errors
 * rejected by the retryable predicate propagate immediately.
 */
@Slf4j
public class RetryPolicy {

  private final String name;
  private final int maxAttempts;
  private final Duration baseDelay;
  private final Duration backoffUnit;
  private final Retry retry;

  public RetryPolicy(
      String name,
      int maxAttempts,
      Duration baseDelay,
      Duration backoffUnit,
      Predicate<Throwable> retryable) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.name = name;
    this.maxAttempts = maxAttempts;
    this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
    this.backoffUnit = Objects.requireNonNull(backoffUnit, "backoffUnit");

    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalBiFunction((attempt, outcome) -> delayBeforeAttempt(attempt + 1).toMillis())
            .retryOnException(retryable::test)
            .build();
    this.retry = Retry.of(name, config);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "[{}] attempt {}/{} failed: {}; waiting {}ms",
                    name,
                    event.getNumberOfRetryAttempts(),
                    maxAttempts,
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown",
                    event.getWaitInterval().toMillis()));
  }

  /**
   * Wait paid before the given attempt.
   *
   * @param attempt attempt number, starting at 1
   * @return the delay
   */
  public Duration delayBeforeAttempt(int attempt) {
    if (attempt <= 1) {
      return baseDelay;
    }
    long factor = 1L << (attempt - 1);
    return baseDelay.plus(backoffUnit.multipliedBy(factor));
  }

  /**
   * Runs the call under this policy.
   *
   * @param call the call to run
   * @param <T> result type
   * @return the first successful result
   * @throws RuntimeException the last failure once attempts are exhausted, or the first
   *     non-retryable failure
   */
  public <T> T execute(Supplier<T> call) {
    pause(baseDelay);
    return retry.executeSupplier(call);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public String getName() {
    return name;
  }

  /** Underlying Resilience4j retry, exposed for event subscriptions and metrics binding. */
  public Retry getRetry() {
    return retry;
  }

  private void pause(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    log.debug("[{}] waiting {}ms before attempt 1", name, duration.toMillis());
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting to call " + name, e);
    }
  }
}
