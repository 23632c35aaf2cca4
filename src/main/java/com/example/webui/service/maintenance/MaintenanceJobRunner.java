package com.example.webui.service.maintenance;

import com.example.webui.properties.ApplicationProperties;
import com.example.webui.service.lock.DistributedLock;
import com.example.webui.service.lock.DistributedLockService;
import com.example.webui.service.lock.LockRenewalTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs maintenance work on at most one instance at a time.
 * <p>
 * The work only starts once the job's distributed lock is acquired, and the lease is kept
 * alive by a {@link LockRenewalTask} until the work returns. A run whose lock cannot be
 * acquired is skipped rather than queued. Without Redis there is no lock, and work runs
 * only when local execution has been explicitly allowed.
 */
@Slf4j
@Service
public class MaintenanceJobRunner {

  private final ObjectProvider<DistributedLockService> lockServiceProvider;
  private final ApplicationProperties.LockProperties lockProperties;
  private final boolean allowLocalWithoutRedis;
  private final Executor renewalExecutor;

  public MaintenanceJobRunner(
      ObjectProvider<DistributedLockService> lockServiceProvider,
      ApplicationProperties properties,
      @Qualifier("lockRenewalExecutor") Executor renewalExecutor) {
    this.lockServiceProvider = lockServiceProvider;
    this.lockProperties = properties.lock();
    this.allowLocalWithoutRedis = properties.maintenance().allowLocalWithoutRedis();
    this.renewalExecutor = renewalExecutor;
  }

  public JobOutcome run(String jobName, String lockName, MaintenanceWork work) {
    DistributedLockService lockService = lockServiceProvider.getIfAvailable();

    if (lockService == null) {
      if (!allowLocalWithoutRedis) {
        log.warn("Skipping {}: distributed locking is unavailable without Redis", jobName);
        return JobOutcome.SKIPPED_LOCK_UNAVAILABLE;
      }
      log.info("Running {} without a distributed lock (local execution allowed)", jobName);
      return execute(new JobContext(jobName, null), work);
    }

    DistributedLock lock = lockService.newLock(lockName, lockProperties.ttl());
    if (!lock.acquire()) {
      if (lock.lastError().isPresent()) {
        log.warn("Skipping {}: could not reach lock store for {}: {}",
                 jobName, lockName, lock.lastError().get().getMessage());
      } else {
        log.info("Skipping {}: lock {} is held by another instance", jobName, lockName);
      }
      return JobOutcome.SKIPPED_LOCK_UNAVAILABLE;
    }

    JobContext context = new JobContext(jobName, lock);
    LockRenewalTask renewal = null;
    try {
      renewal = LockRenewalTask.start(
          lock,
          lockProperties.renewalInterval(),
          lockProperties.maxConsecutiveRenewalFailures(),
          context::abort,
          renewalExecutor);
      return execute(context, work);
    } catch (RuntimeException e) {
      log.error("Could not start lock renewal for {}; job not run", jobName, e);
      return JobOutcome.FAILED;
    } finally {
      if (renewal != null) {
        renewal.cancel();
      }
      if (!lock.release()) {
        log.warn("Lock {} was not released by {}; it will expire on its own", lockName, jobName);
      }
    }
  }

  private JobOutcome execute(JobContext context, MaintenanceWork work) {
    long started = System.nanoTime();
    try {
      work.execute(context);
    } catch (Exception e) {
      log.error("Maintenance job {} failed", context.jobName(), e);
      return JobOutcome.FAILED;
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    if (context.isAborted()) {
      log.warn("Maintenance job {} stopped after {} ms because its lock was lost", context.jobName(), elapsedMs);
      return JobOutcome.ABORTED_LOCK_LOST;
    }
    log.info("Maintenance job {} completed in {} ms", context.jobName(), elapsedMs);
    return JobOutcome.COMPLETED;
  }
}
