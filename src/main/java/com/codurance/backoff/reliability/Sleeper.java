package com.codurance.backoff.reliability;

import java.time.Duration;

/**
 * Blocks the calling thread between retries. Replaced in tests to record waits.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);

  void sleep(Duration delay) throws InterruptedException;
}
