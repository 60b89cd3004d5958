package com.codurance.backoff.reliability;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Immutable retry configuration plus the classification and delay functions
 * derived from it.
 *
 * Defaults mirror the usual SDK wrapper settings:
 * - 0.2s base interval, doubled per attempt once backoff kicks in
 * - 3 retries after the first failed call
 * - +/- 50% jitter on every computed delay
 * - backoff applies from the first retry onwards
 *
 * Jitter is drawn from a {@link Random} owned by the policy, so tests can pass
 * a seeded or stubbed source. Derived policies share their parent's source.
 */
public final class RetryPolicy {
  public static final double DEFAULT_INTERVAL_SECONDS = 0.2;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final double DEFAULT_BACKOFF_RATE = 2.0;
  public static final double DEFAULT_JITTER = 0.5;
  public static final int DEFAULT_MAX_RETRIES_BEFORE_BACKOFF = 0;

  private static final RetryPolicy DEFAULTS = newBuilder().build();

  private final double intervalSeconds;
  private final int maxRetries;
  private final double backoffRate;
  private final double jitter;
  private final int maxRetriesBeforeBackoff;
  private final Set<String> addedErrorCodes;
  private final Set<String> ignoredErrorCodes;
  private final Random random;

  private RetryPolicy(Builder builder) {
    this.intervalSeconds = builder.intervalSeconds;
    this.maxRetries = builder.maxRetries;
    this.backoffRate = builder.backoffRate;
    this.jitter = builder.jitter;
    this.maxRetriesBeforeBackoff = builder.maxRetriesBeforeBackoff;
    this.addedErrorCodes = Set.copyOf(builder.addedErrorCodes);
    this.ignoredErrorCodes = Set.copyOf(builder.ignoredErrorCodes);
    this.random = builder.random == null ? new Random() : builder.random;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static RetryPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * Classify an error code. Ignored codes win over retryable ones, so a code
   * present in both sets is ignored.
   */
  public RetryDecision classify(String errorCode) {
    if (errorCode == null)
      return RetryDecision.PROPAGATE;
    if (ignoredErrorCodes.contains(errorCode))
      return RetryDecision.IGNORE;
    if (addedErrorCodes.contains(errorCode) || DefaultErrorCodes.isRetryable(errorCode))
      return RetryDecision.RETRY;
    return RetryDecision.PROPAGATE;
  }

  /**
   * Delay to wait before the retry that follows the given 0-based attempt.
   * Up to {@code maxRetriesBeforeBackoff} the base interval is used as is;
   * past it the interval grows by {@code backoffRate} per attempt. Each call
   * draws a fresh jitter factor in {@code [1 - jitter, 1 + jitter)}.
   */
  public Duration delayFor(int attemptIndex) {
    if (attemptIndex < 0)
      throw new IllegalArgumentException("attemptIndex must be non-negative, got: " + attemptIndex);

    double seconds = intervalSeconds;
    if (attemptIndex > maxRetriesBeforeBackoff) {
      seconds *= Math.pow(backoffRate, attemptIndex - maxRetriesBeforeBackoff);
    }
    double factor = 1 + (random.nextDouble() * 2 - 1) * jitter;
    return Duration.ofNanos(Math.round(seconds * factor * 1_000_000_000d));
  }

  /**
   * Build a new policy overlaying only the options that were explicitly set.
   * This policy is left untouched.
   */
  public RetryPolicy deriveWith(RetryOptions options) {
    Objects.requireNonNull(options, "options");
    Builder builder = toBuilder();
    options.getIntervalSeconds().ifPresent(builder::intervalSeconds);
    options.getMaxRetries().ifPresent(builder::maxRetries);
    options.getBackoffRate().ifPresent(builder::backoffRate);
    options.getJitter().ifPresent(builder::jitter);
    options.getMaxRetriesBeforeBackoff().ifPresent(builder::maxRetriesBeforeBackoff);
    options.getAddedErrorCodes().ifPresent(builder::addedErrorCodes);
    options.getIgnoredErrorCodes().ifPresent(builder::ignoredErrorCodes);
    return builder.build();
  }

  public Builder toBuilder() {
    return new Builder()
        .intervalSeconds(intervalSeconds)
        .maxRetries(maxRetries)
        .backoffRate(backoffRate)
        .jitter(jitter)
        .maxRetriesBeforeBackoff(maxRetriesBeforeBackoff)
        .addedErrorCodes(addedErrorCodes)
        .ignoredErrorCodes(ignoredErrorCodes)
        .random(random);
  }

  /** Built-in codes together with the caller-added ones. */
  public Set<String> getRetryableErrorCodes() {
    Set<String> codes = new HashSet<>(DefaultErrorCodes.RETRYABLE);
    codes.addAll(addedErrorCodes);
    return Set.copyOf(codes);
  }

  public double getIntervalSeconds() { return intervalSeconds; }
  public int getMaxRetries() { return maxRetries; }
  public double getBackoffRate() { return backoffRate; }
  public double getJitter() { return jitter; }
  public int getMaxRetriesBeforeBackoff() { return maxRetriesBeforeBackoff; }
  public Set<String> getAddedErrorCodes() { return addedErrorCodes; }
  public Set<String> getIgnoredErrorCodes() { return ignoredErrorCodes; }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof RetryPolicy))
      return false;
    RetryPolicy other = (RetryPolicy) o;
    return Double.compare(intervalSeconds, other.intervalSeconds) == 0
        && maxRetries == other.maxRetries
        && Double.compare(backoffRate, other.backoffRate) == 0
        && Double.compare(jitter, other.jitter) == 0
        && maxRetriesBeforeBackoff == other.maxRetriesBeforeBackoff
        && addedErrorCodes.equals(other.addedErrorCodes)
        && ignoredErrorCodes.equals(other.ignoredErrorCodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(intervalSeconds, maxRetries, backoffRate, jitter, maxRetriesBeforeBackoff,
        addedErrorCodes, ignoredErrorCodes);
  }

  @Override
  public String toString() {
    return "RetryPolicy{intervalSeconds=" + intervalSeconds
        + ", maxRetries=" + maxRetries
        + ", backoffRate=" + backoffRate
        + ", jitter=" + jitter
        + ", maxRetriesBeforeBackoff=" + maxRetriesBeforeBackoff
        + ", addedErrorCodes=" + addedErrorCodes
        + ", ignoredErrorCodes=" + ignoredErrorCodes + "}";
  }

  public static class Builder {
    private double intervalSeconds = DEFAULT_INTERVAL_SECONDS;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private double backoffRate = DEFAULT_BACKOFF_RATE;
    private double jitter = DEFAULT_JITTER;
    private int maxRetriesBeforeBackoff = DEFAULT_MAX_RETRIES_BEFORE_BACKOFF;
    private Set<String> addedErrorCodes = Set.of();
    private Set<String> ignoredErrorCodes = Set.of();
    private Random random;

    private Builder() {
    }

    public Builder intervalSeconds(double seconds) {
      this.intervalSeconds = seconds;
      return this;
    }

    public Builder maxRetries(int retries) {
      this.maxRetries = retries;
      return this;
    }

    public Builder backoffRate(double rate) {
      this.backoffRate = rate;
      return this;
    }

    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder maxRetriesBeforeBackoff(int retries) {
      this.maxRetriesBeforeBackoff = retries;
      return this;
    }

    public Builder addedErrorCodes(Collection<String> codes) {
      this.addedErrorCodes = Set.copyOf(Objects.requireNonNull(codes, "addedErrorCodes"));
      return this;
    }

    public Builder addedErrorCodes(String... codes) {
      return addedErrorCodes(List.of(codes));
    }

    public Builder ignoredErrorCodes(Collection<String> codes) {
      this.ignoredErrorCodes = Set.copyOf(Objects.requireNonNull(codes, "ignoredErrorCodes"));
      return this;
    }

    public Builder ignoredErrorCodes(String... codes) {
      return ignoredErrorCodes(List.of(codes));
    }

    public Builder random(Random random) {
      this.random = Objects.requireNonNull(random, "random");
      return this;
    }

    public RetryPolicy build() {
      if (!(intervalSeconds >= 0) || Double.isInfinite(intervalSeconds))
        throw new IllegalArgumentException("intervalSeconds must be a finite non-negative number, got: " + intervalSeconds);
      if (maxRetries < 0)
        throw new IllegalArgumentException("maxRetries must be non-negative, got: " + maxRetries);
      if (!(backoffRate > 0) || Double.isInfinite(backoffRate))
        throw new IllegalArgumentException("backoffRate must be a finite positive number, got: " + backoffRate);
      if (!(jitter >= 0 && jitter < 1))
        throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
      if (maxRetriesBeforeBackoff < 0)
        throw new IllegalArgumentException(
            "maxRetriesBeforeBackoff must be non-negative, got: " + maxRetriesBeforeBackoff);
      return new RetryPolicy(this);
    }
  }
}
