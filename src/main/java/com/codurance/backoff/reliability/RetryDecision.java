package com.codurance.backoff.reliability;

/**
 * Outcome of classifying a failed call by its error code.
 */
public enum RetryDecision {
  /** Transient failure; the call is attempted again. */
  RETRY,
  /** Failure is swallowed and the call yields an empty result. */
  IGNORE,
  /** Failure is handed back to the caller unchanged. */
  PROPAGATE
}
