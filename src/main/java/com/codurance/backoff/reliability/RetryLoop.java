package com.codurance.backoff.reliability;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.backoff.errors.AwsErrorCodeExtractor;
import com.codurance.backoff.errors.ErrorCodeExtractor;

/**
 * Turns a single fallible call into a bounded sequence of attempts.
 *
 * Each failure is classified by its error code:
 * - IGNORE ends the call with a {@code null} result
 * - RETRY runs the call again while fewer than {@code maxRetries} retries were made,
 *   sleeping first once past {@code maxRetriesBeforeBackoff}
 * - anything else, or an exhausted retry budget, rethrows the failure as is
 *
 * At most {@code maxRetries + 1} calls are made. The attempt counter lives on
 * the stack of {@link #execute}, so one loop can serve concurrent callers.
 */
public class RetryLoop {
  private static final Logger logger = LoggerFactory.getLogger(RetryLoop.class);

  private final RetryPolicy policy;
  private final ErrorCodeExtractor errorCodeExtractor;
  private final Sleeper sleeper;

  public RetryLoop(RetryPolicy policy) {
    this(policy, new AwsErrorCodeExtractor(), Sleeper.THREAD);
  }

  public RetryLoop(RetryPolicy policy, ErrorCodeExtractor errorCodeExtractor, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.errorCodeExtractor = Objects.requireNonNull(errorCodeExtractor, "errorCodeExtractor");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public <T> T execute(Attempt<T> attempt) throws Exception {
    Objects.requireNonNull(attempt, "attempt");
    int attempts = 0;
    while (true) {
      try {
        return attempt.call();
      } catch (Exception failure) {
        Optional<String> errorCode = errorCodeExtractor.extract(failure);
        if (errorCode.isEmpty())
          throw failure;

        String code = errorCode.get();
        RetryDecision decision = policy.classify(code);
        if (decision == RetryDecision.IGNORE) {
          logger.debug("Ignoring error code {} after {} retries", code, attempts);
          return null;
        }
        if (decision == RetryDecision.RETRY && attempts < policy.getMaxRetries()) {
          if (attempts > policy.getMaxRetriesBeforeBackoff()) {
            Duration delay = policy.delayFor(attempts);
            logger.debug("Retrying error code {} in {} ms (retry {} of {})",
                code, delay.toMillis(), attempts + 1, policy.getMaxRetries());
            pause(delay, failure);
          } else {
            logger.debug("Retrying error code {} immediately (retry {} of {})",
                code, attempts + 1, policy.getMaxRetries());
          }
          attempts++;
          continue;
        }
        if (decision == RetryDecision.RETRY)
          logger.debug("Giving up on error code {} after {} retries", code, attempts);
        throw failure;
      }
    }
  }

  /**
   * Wrap a supplier so every {@code get()} goes through this loop. Only
   * unchecked failures can escape a supplier, and they are rethrown as is.
   */
  public <T> Supplier<T> decorate(Supplier<T> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return () -> {
      try {
        return execute(supplier::get);
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new IllegalStateException("Unexpected checked failure from supplier", e);
      }
    };
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  private void pause(Duration delay, Exception failure) throws Exception {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ie) {
      // stop retrying and hand back the failure that triggered the wait
      Thread.currentThread().interrupt();
      failure.addSuppressed(ie);
      throw failure;
    }
  }
}
