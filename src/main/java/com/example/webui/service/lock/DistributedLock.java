package com.example.webui.service.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * An advisory mutual-exclusion lease shared between application instances.
 * <p>
 * None of the operations throw: transport failures are reported as {@code false} and kept
 * in {@link #lastError()}. {@link #isHeld()} is a local belief that is corrected whenever
 * renew or release find that ownership has been lost.
 */
public interface DistributedLock {

  String lockName();

  /**
   * Random ownership token of this lock instance.
   */
  String lockId();

  Duration ttl();

  /**
   * @return {@code true} iff this instance now owns the lock
   */
  boolean acquire();

  /**
   * Extends the lease, only if this instance is still the owner.
   *
   * @return {@code true} iff the lease was extended
   */
  boolean renew();

  /**
   * Deletes the lock, only if this instance is still the owner.
   *
   * @return {@code true} iff this call deleted the lock
   */
  boolean release();

  boolean isHeld();

  /**
   * Clears the local ownership flag without touching the backing store.
   */
  void markLost();

  Optional<RuntimeException> lastError();
}
