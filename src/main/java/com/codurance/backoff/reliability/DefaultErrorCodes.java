package com.codurance.backoff.reliability;

import java.util.Set;

/**
 * Built-in error codes that are always retried unless a policy ignores them.
 * Covers throttling, limit and transient infrastructure failures.
 */
public final class DefaultErrorCodes {

  public static final Set<String> RETRYABLE = Set.of(
      "ThrottlingException",
      "TooManyRequestsException",
      "ServiceUnavailableException",
      "RequestLimitExceeded",
      "RequestThrottled",
      "RequestThrottledException",
      "ProvisionedThroughputExceededException",
      "LimitExceededException",
      "EndpointConnectionError",
      "ConnectTimeoutError",
      "Unavailable",
      "InternalFailure",
      "InternalError");

  private DefaultErrorCodes() {
  }

  public static boolean isRetryable(String code) {
    return code != null && RETRYABLE.contains(code);
  }
}
