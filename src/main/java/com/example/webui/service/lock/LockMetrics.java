package com.example.webui.service.lock;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for lock activity, tagged by lock name.
 * <p>
 * Lock names are a small fixed set (one per maintenance job), so the tag stays low-cardinality.
 */
public final class LockMetrics {

  public static final String ACQUIRE_ATTEMPTS = "webui.lock.acquire.attempts";
  public static final String RENEWALS = "webui.lock.renewals";

  private final MeterRegistry registry;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();

  public LockMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  void acquireAttempted(String lockName, boolean acquired) {
    counter(ACQUIRE_ATTEMPTS, lockName, acquired ? "acquired" : "busy").increment();
  }

  void acquireFailed(String lockName) {
    counter(ACQUIRE_ATTEMPTS, lockName, "error").increment();
  }

  void renewed(String lockName, boolean extended) {
    counter(RENEWALS, lockName, extended ? "success" : "failure").increment();
  }

  /**
   * Per-lock totals, as exposed through the meter registry.
   */
  public Snapshot snapshot(String lockName) {
    return new Snapshot(
        count(ACQUIRE_ATTEMPTS, lockName, "acquired")
            + count(ACQUIRE_ATTEMPTS, lockName, "busy")
            + count(ACQUIRE_ATTEMPTS, lockName, "error"),
        count(RENEWALS, lockName, "success"),
        count(RENEWALS, lockName, "failure"));
  }

  private Counter counter(String name, String lockName, String result) {
    return counters.computeIfAbsent(name + "|" + lockName + "|" + result,
                                    k -> Counter.builder(name)
                                        .tag("lock", lockName)
                                        .tag("result", result)
                                        .register(registry));
  }

  private long count(String name, String lockName, String result) {
    Counter counter = counters.get(name + "|" + lockName + "|" + result);
    return counter == null ? 0 : (long) counter.count();
  }

  public record Snapshot(long acquireAttempts, long renewalSuccesses, long renewalFailures) {
  }
}
