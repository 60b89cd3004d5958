package com.codurance.backoff.reliability;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Overrides applied on top of an existing {@link RetryPolicy}. Anything not
 * set here is inherited from the parent policy; an explicit zero or an empty
 * code set counts as set. Code sets replace the parent's, they do not merge.
 */
public final class RetryOptions {
  private static final RetryOptions NONE = newBuilder().build();

  private final Double intervalSeconds;
  private final Integer maxRetries;
  private final Double backoffRate;
  private final Double jitter;
  private final Integer maxRetriesBeforeBackoff;
  private final Set<String> addedErrorCodes;
  private final Set<String> ignoredErrorCodes;

  private RetryOptions(Builder builder) {
    this.intervalSeconds = builder.intervalSeconds;
    this.maxRetries = builder.maxRetries;
    this.backoffRate = builder.backoffRate;
    this.jitter = builder.jitter;
    this.maxRetriesBeforeBackoff = builder.maxRetriesBeforeBackoff;
    this.addedErrorCodes = builder.addedErrorCodes;
    this.ignoredErrorCodes = builder.ignoredErrorCodes;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Options that override nothing. */
  public static RetryOptions none() {
    return NONE;
  }

  public OptionalDouble getIntervalSeconds() {
    return intervalSeconds == null ? OptionalDouble.empty() : OptionalDouble.of(intervalSeconds);
  }

  public OptionalInt getMaxRetries() {
    return maxRetries == null ? OptionalInt.empty() : OptionalInt.of(maxRetries);
  }

  public OptionalDouble getBackoffRate() {
    return backoffRate == null ? OptionalDouble.empty() : OptionalDouble.of(backoffRate);
  }

  public OptionalDouble getJitter() {
    return jitter == null ? OptionalDouble.empty() : OptionalDouble.of(jitter);
  }

  public OptionalInt getMaxRetriesBeforeBackoff() {
    return maxRetriesBeforeBackoff == null ? OptionalInt.empty() : OptionalInt.of(maxRetriesBeforeBackoff);
  }

  public Optional<Set<String>> getAddedErrorCodes() {
    return Optional.ofNullable(addedErrorCodes);
  }

  public Optional<Set<String>> getIgnoredErrorCodes() {
    return Optional.ofNullable(ignoredErrorCodes);
  }

  public static class Builder {
    private Double intervalSeconds;
    private Integer maxRetries;
    private Double backoffRate;
    private Double jitter;
    private Integer maxRetriesBeforeBackoff;
    private Set<String> addedErrorCodes;
    private Set<String> ignoredErrorCodes;

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

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
