package com.codurance.backoff.reliability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested delays instead of blocking.
 */
public class RecordingSleeper implements Sleeper {
  private final List<Duration> delays = new ArrayList<>();

  @Override
  public synchronized void sleep(Duration delay) {
    delays.add(delay);
  }

  public synchronized List<Duration> getDelays() {
    return List.copyOf(delays);
  }
}
