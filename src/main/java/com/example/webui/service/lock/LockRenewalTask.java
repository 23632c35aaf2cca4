package com.example.webui.service.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background loop that keeps a held {@link DistributedLock} alive.
 * <p>
 * Every renewal interval the lock is renewed. After {@code maxConsecutiveFailures} failed
 * attempts in a row (an exception counts as a failure) the lock is considered lost: the
 * loop stops, clears the lock's local ownership flag and runs the lost-callback once.
 * {@link #cancel()} wakes the loop from its sleep and stops it without running the callback.
 */
@Slf4j
public final class LockRenewalTask implements Runnable {

  public enum State { RUNNING, LOST, CANCELLED }

  private final DistributedLock lock;
  private final Duration renewalInterval;
  private final int maxConsecutiveFailures;
  private final Runnable onLost;

  private final CountDownLatch cancelSignal = new CountDownLatch(1);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
  private final AtomicBoolean lostNotified = new AtomicBoolean();

  public LockRenewalTask(DistributedLock lock, Duration renewalInterval, int maxConsecutiveFailures,
                         Runnable onLost) {
    if (renewalInterval.isZero() || renewalInterval.isNegative()) {
      throw new IllegalArgumentException("Renewal interval must be positive");
    }
    if (renewalInterval.compareTo(lock.ttl()) >= 0) {
      throw new IllegalArgumentException("Renewal interval " + renewalInterval
                                             + " must be shorter than lock TTL " + lock.ttl());
    }
    if (maxConsecutiveFailures < 1) {
      throw new IllegalArgumentException("At least one renewal failure must be tolerated");
    }
    this.lock = lock;
    this.renewalInterval = renewalInterval;
    this.maxConsecutiveFailures = maxConsecutiveFailures;
    this.onLost = onLost;
  }

  /**
   * Creates a task and submits it to the executor.
   */
  public static LockRenewalTask start(DistributedLock lock, Duration renewalInterval, int maxConsecutiveFailures,
                                      Runnable onLost, Executor executor) {
    LockRenewalTask task = new LockRenewalTask(lock, renewalInterval, maxConsecutiveFailures, onLost);
    executor.execute(task);
    return task;
  }

  @Override
  public void run() {
    int failures = 0;
    try {
      while (true) {
        if (cancelSignal.await(renewalInterval.toMillis(), TimeUnit.MILLISECONDS)) {
          finishCancelled();
          return;
        }

        if (renewOnce()) {
          failures = 0;
          log.debug("Renewed lock {}", lock.lockName());
          continue;
        }

        failures++;
        log.warn("Failed to renew lock {} ({} of {} allowed failures)",
                 lock.lockName(), failures, maxConsecutiveFailures);
        if (failures >= maxConsecutiveFailures) {
          finishLost();
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      finishCancelled();
    } finally {
      terminated.countDown();
    }
  }

  public void cancel() {
    cancelSignal.countDown();
  }

  public State state() {
    return state.get();
  }

  /**
   * Waits for the loop to exit.
   *
   * @return {@code true} if the loop exited within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private boolean renewOnce() {
    try {
      return lock.renew();
    } catch (RuntimeException e) {
      log.error("Error in renewal task for lock {}", lock.lockName(), e);
      return false;
    }
  }

  private void finishCancelled() {
    if (state.compareAndSet(State.RUNNING, State.CANCELLED)) {
      log.debug("Renewal task for lock {} cancelled", lock.lockName());
    }
  }

  private void finishLost() {
    if (!state.compareAndSet(State.RUNNING, State.LOST)) {
      return;
    }
    lock.markLost();
    log.warn("Lock {} lost, notifying holder", lock.lockName());
    if (lostNotified.compareAndSet(false, true)) {
      try {
        onLost.run();
      } catch (RuntimeException e) {
        log.error("Lost-lock callback for {} failed", lock.lockName(), e);
      }
    }
  }
}
