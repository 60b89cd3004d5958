package com.codurance.backoff.reliability;

/**
 * A single fallible call driven by {@link RetryLoop}.
 */
@FunctionalInterface
public interface Attempt<T> {

  T call() throws Exception;
}
