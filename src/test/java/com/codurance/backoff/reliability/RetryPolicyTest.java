package com.codurance.backoff.reliability;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

  private static Random fixedRandom(double value) {
    return new Random() {
      @Override
      public double nextDouble() {
        return value;
      }
    };
  }

  @Test
  public void defaultsMatchDocumentedValues() {
    RetryPolicy p = RetryPolicy.defaults();

    assertEquals(0.2, p.getIntervalSeconds(), 0.0);
    assertEquals(3, p.getMaxRetries());
    assertEquals(2.0, p.getBackoffRate(), 0.0);
    assertEquals(0.5, p.getJitter(), 0.0);
    assertEquals(0, p.getMaxRetriesBeforeBackoff());
    assertTrue(p.getAddedErrorCodes().isEmpty());
    assertTrue(p.getIgnoredErrorCodes().isEmpty());
  }

  @Test
  public void builtInTableContainsThrottlingAndConnectivityCodes() {
    assertEquals(Set.of(
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
        "InternalError"), DefaultErrorCodes.RETRYABLE);
  }

  @Test
  public void everyBuiltInCodeIsRetried() {
    RetryPolicy p = RetryPolicy.defaults();
    for (String code : DefaultErrorCodes.RETRYABLE) {
      assertEquals(RetryDecision.RETRY, p.classify(code), "built-in code " + code);
    }
  }

  @Test
  public void ignoredCodesWinOverRetryableOnes() {
    RetryPolicy p = RetryPolicy.newBuilder()
        .addedErrorCodes("Throttling")
        .ignoredErrorCodes("Throttling", "ThrottlingException", "ResourceNotFound")
        .build();

    assertEquals(RetryDecision.IGNORE, p.classify("Throttling"));
    assertEquals(RetryDecision.IGNORE, p.classify("ThrottlingException"));
    assertEquals(RetryDecision.IGNORE, p.classify("ResourceNotFound"));
    assertEquals(RetryDecision.RETRY, p.classify("RequestLimitExceeded"));
  }

  @Test
  public void addedCodesAreRetriedAlongsideBuiltIns() {
    RetryPolicy p = RetryPolicy.newBuilder().addedErrorCodes(List.of("Throttling")).build();

    assertEquals(RetryDecision.RETRY, p.classify("Throttling"));
    assertEquals(RetryDecision.RETRY, p.classify("InternalError"));
    assertTrue(p.getRetryableErrorCodes().containsAll(DefaultErrorCodes.RETRYABLE));
    assertTrue(p.getRetryableErrorCodes().contains("Throttling"));
    // built-in table is left alone
    assertFalse(DefaultErrorCodes.RETRYABLE.contains("Throttling"));
  }

  @Test
  public void unknownAndMissingCodesPropagate() {
    RetryPolicy p = RetryPolicy.defaults();

    assertEquals(RetryDecision.PROPAGATE, p.classify("AccessDenied"));
    assertEquals(RetryDecision.PROPAGATE, p.classify("throttlingexception"));
    assertEquals(RetryDecision.PROPAGATE, p.classify(""));
    assertEquals(RetryDecision.PROPAGATE, p.classify(null));
  }

  @Test
  public void deriveWithNoOptionsKeepsEveryField() {
    RetryPolicy parent = RetryPolicy.newBuilder()
        .intervalSeconds(1.5)
        .maxRetries(7)
        .backoffRate(3)
        .jitter(0.1)
        .maxRetriesBeforeBackoff(2)
        .addedErrorCodes("Throttling")
        .ignoredErrorCodes("NotFound")
        .build();

    RetryPolicy derived = parent.deriveWith(RetryOptions.none());

    assertEquals(parent, derived);
    assertEquals(parent.hashCode(), derived.hashCode());
    assertNotSame(parent, derived);
  }

  @Test
  public void deriveWithHonoursExplicitZeroes() {
    RetryPolicy parent = RetryPolicy.defaults();

    RetryPolicy derived = parent.deriveWith(RetryOptions.newBuilder()
        .maxRetries(0)
        .intervalSeconds(0)
        .jitter(0)
        .build());

    assertEquals(0, derived.getMaxRetries());
    assertEquals(0.0, derived.getIntervalSeconds(), 0.0);
    assertEquals(0.0, derived.getJitter(), 0.0);
    assertEquals(parent.getBackoffRate(), derived.getBackoffRate(), 0.0);
    // parent untouched
    assertEquals(RetryPolicy.DEFAULT_MAX_RETRIES, parent.getMaxRetries());
  }

  @Test
  public void deriveWithReplacesCodeSets() {
    RetryPolicy parent = RetryPolicy.newBuilder()
        .addedErrorCodes("Throttling")
        .ignoredErrorCodes("NotFound")
        .build();

    RetryPolicy derived = parent.deriveWith(RetryOptions.newBuilder()
        .ignoredErrorCodes("Conflict")
        .addedErrorCodes(List.of())
        .build());

    assertEquals(Set.of("Conflict"), derived.getIgnoredErrorCodes());
    assertEquals(Set.of(), derived.getAddedErrorCodes());
    assertEquals(RetryDecision.PROPAGATE, derived.classify("NotFound"));
    assertEquals(RetryDecision.PROPAGATE, derived.classify("Throttling"));
    assertEquals(Set.of("NotFound"), parent.getIgnoredErrorCodes());
  }

  @Test
  public void delayStaysWithinJitterBoundsBeforeAndAfterBackoff() {
    RetryPolicy p = RetryPolicy.newBuilder()
        .intervalSeconds(0.2)
        .backoffRate(2)
        .jitter(0.5)
        .maxRetriesBeforeBackoff(1)
        .build();

    for (int attempt = 0; attempt <= 5; attempt++) {
      double base = attempt <= 1 ? 0.2 : 0.2 * Math.pow(2, attempt - 1);
      for (int i = 0; i < 200; i++) {
        double seconds = p.delayFor(attempt).toNanos() / 1e9;
        assertTrue(seconds >= base * 0.5 - 1e-9 && seconds <= base * 1.5 + 1e-9,
            "attempt " + attempt + " delay " + seconds + "s outside " + base * 0.5 + ".." + base * 1.5);
      }
    }
  }

  @Test
  public void delayUsesOwnedRandomSource() {
    RetryPolicy low = RetryPolicy.newBuilder().random(fixedRandom(0.0)).build();
    RetryPolicy mid = RetryPolicy.newBuilder().random(fixedRandom(0.5)).build();

    // 0.2s * 2^3 = 1.6s, scaled by 0.5 (lowest jitter) or 1.0 (midpoint)
    assertEquals(Duration.ofMillis(800), low.delayFor(3));
    assertEquals(Duration.ofMillis(1600), mid.delayFor(3));
    assertEquals(Duration.ofMillis(200), mid.delayFor(0));
  }

  @Test
  public void derivedPolicySharesRandomSource() {
    RetryPolicy parent = RetryPolicy.newBuilder().random(fixedRandom(0.0)).build();
    RetryPolicy derived = parent.deriveWith(RetryOptions.newBuilder().maxRetries(9).build());

    assertEquals(Duration.ofMillis(100), derived.delayFor(0));
  }

  @Test
  public void withoutJitterEachCallDrawsTheSameDelay() {
    RetryPolicy p = RetryPolicy.newBuilder().jitter(0).intervalSeconds(1).backoffRate(3).build();

    assertEquals(Duration.ofSeconds(1), p.delayFor(0));
    assertEquals(Duration.ofSeconds(3), p.delayFor(1));
    assertEquals(Duration.ofSeconds(9), p.delayFor(2));
  }

  @Test
  public void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().jitter(1).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().jitter(-0.1).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().maxRetries(-1).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().intervalSeconds(-1).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().backoffRate(0).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.newBuilder().maxRetriesBeforeBackoff(-1).build());
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().delayFor(-1));
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.defaults().deriveWith(RetryOptions.newBuilder().jitter(2).build()));
  }
}
