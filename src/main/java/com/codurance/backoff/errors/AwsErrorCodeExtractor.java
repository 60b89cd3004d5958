package com.codurance.backoff.errors;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Optional;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Error codes for AWS SDK v2 failures.
 *
 * Service errors report the code sent back by AWS. Client-side failures have
 * no such code, so connectivity problems found in the cause chain are mapped
 * onto the connection codes of {@code DefaultErrorCodes}.
 */
public class AwsErrorCodeExtractor implements ErrorCodeExtractor {
  public static final String ENDPOINT_CONNECTION_ERROR = "EndpointConnectionError";
  public static final String CONNECT_TIMEOUT_ERROR = "ConnectTimeoutError";
  public static final String READ_TIMEOUT_ERROR = "ReadTimeoutError";

  private static final int MAX_CAUSE_DEPTH = 16;

  @Override
  public Optional<String> extract(Throwable failure) {
    if (failure instanceof AwsServiceException) {
      AwsErrorDetails details = ((AwsServiceException) failure).awsErrorDetails();
      if (details == null || details.errorCode() == null || details.errorCode().isEmpty())
        return Optional.empty();
      return Optional.of(details.errorCode());
    }
    if (failure instanceof SdkClientException)
      return fromCause(failure.getCause());
    return Optional.empty();
  }

  private Optional<String> fromCause(Throwable cause) {
    int depth = 0;
    while (cause != null && depth++ < MAX_CAUSE_DEPTH) {
      if (cause instanceof ConnectException
          || cause instanceof UnknownHostException
          || cause instanceof NoRouteToHostException)
        return Optional.of(ENDPOINT_CONNECTION_ERROR);
      if (cause instanceof SocketTimeoutException) {
        String message = cause.getMessage() == null ? "" : cause.getMessage().toLowerCase(Locale.ROOT);
        return Optional.of(message.contains("connect") ? CONNECT_TIMEOUT_ERROR : READ_TIMEOUT_ERROR);
      }
      cause = cause.getCause();
    }
    return Optional.empty();
  }
}
