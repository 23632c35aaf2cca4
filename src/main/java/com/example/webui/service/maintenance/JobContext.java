package com.example.webui.service.maintenance;

import com.example.webui.service.lock.DistributedLock;

/**
 * Handed to maintenance work so long-running jobs can stop between units of work once the
 * guarding lock is gone.
 */
public class JobContext {

  private final String jobName;
  private final DistributedLock lock;
  private volatile boolean aborted;

  JobContext(String jobName, DistributedLock lock) {
    this.jobName = jobName;
    this.lock = lock;
  }

  public String jobName() {
    return jobName;
  }

  /**
   * @return {@code false} once the lock was lost or its local ownership flag was cleared
   */
  public boolean shouldContinue() {
    return !isAborted();
  }

  public boolean isAborted() {
    return aborted || (lock != null && !lock.isHeld());
  }

  void abort() {
    aborted = true;
  }
}
