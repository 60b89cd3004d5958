package com.codurance.backoff.errors;

import java.util.Objects;
import java.util.Optional;

/**
 * Pulls the machine-readable error code out of a failed client call.
 * An empty result means the failure carries no code and is never retried.
 */
@FunctionalInterface
public interface ErrorCodeExtractor {

  Optional<String> extract(Throwable failure);

  default ErrorCodeExtractor orElse(ErrorCodeExtractor fallback) {
    Objects.requireNonNull(fallback, "fallback");
    return failure -> {
      Optional<String> code = extract(failure);
      return code.isPresent() ? code : fallback.extract(failure);
    };
  }
}
