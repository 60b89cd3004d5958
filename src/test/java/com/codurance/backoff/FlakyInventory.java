package com.codurance.backoff;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inventory client whose every operation fails a configurable number of times first.
 */
public class FlakyInventory implements InventoryService {
  public final String region = "eu-west-1";

  private final AtomicInteger calls = new AtomicInteger(0);
  private final List<String> restocked = new ArrayList<>();
  private volatile int failNextN = 0;
  private volatile RuntimeException failure;

  public void setFailNextN(int n, RuntimeException failure) {
    this.failNextN = n;
    this.failure = failure;
  }

  private void maybeFail() {
    calls.incrementAndGet();
    if (failNextN > 0) {
      failNextN--;
      throw failure;
    }
  }

  @Override
  public int countItems(String warehouse) {
    maybeFail();
    return warehouse.length();
  }

  @Override
  public String describe(String item) {
    maybeFail();
    return "item:" + item;
  }

  @Override
  public String describe(String item, int depth) {
    maybeFail();
    return "item:" + item + "@" + depth;
  }

  @Override
  public String describe(CharSequence item) {
    maybeFail();
    return "chars:" + item;
  }

  @Override
  public void restock(String item) {
    maybeFail();
    restocked.add(item);
  }

  public int getCalls() {
    return calls.get();
  }

  public List<String> getRestocked() {
    return restocked;
  }
}
