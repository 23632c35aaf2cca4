package com.example.webui.service.maintenance;

import com.example.webui.service.lock.DistributedLockService;
import com.example.webui.service.lock.FakeDistributedLock;
import com.example.webui.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MaintenanceJobRunnerTest {

  private static final Duration TTL = Duration.ofSeconds(1800);

  // Renewal loops are not exercised here
  private final Executor noopExecutor = task -> {};

  private ObjectProvider<DistributedLockService> lockServiceProvider;
  private DistributedLockService lockService;
  private FakeDistributedLock lock;
  private AtomicBoolean workRan;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    lockServiceProvider = mock(ObjectProvider.class);
    lockService = mock(DistributedLockService.class);
    lock = new FakeDistributedLock("chat_cleanup_job", TTL);
    when(lockService.newLock(eq("chat_cleanup_job"), any(Duration.class))).thenReturn(lock);
    workRan = new AtomicBoolean();
  }

  @Test
  void runsWorkUnderLockAndReleasesIt() {
    MaintenanceJobRunner runner = runnerWithRedis();

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> {
      assertThat(context.shouldContinue()).isTrue();
      workRan.set(true);
    });

    assertThat(outcome).isEqualTo(JobOutcome.COMPLETED);
    assertThat(workRan).isTrue();
    assertThat(lock.releaseCalls()).isEqualTo(1);
    assertThat(lock.isHeld()).isFalse();
  }

  @Test
  void skipsWhenLockIsHeldElsewhere() {
    lock.acquirable(false);
    MaintenanceJobRunner runner = runnerWithRedis();

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> workRan.set(true));

    assertThat(outcome).isEqualTo(JobOutcome.SKIPPED_LOCK_UNAVAILABLE);
    assertThat(workRan).isFalse();
    assertThat(lock.releaseCalls()).isZero();
  }

  @Test
  void failingWorkStillReleasesLock() {
    MaintenanceJobRunner runner = runnerWithRedis();

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> {
      throw new IllegalStateException("database unavailable");
    });

    assertThat(outcome).isEqualTo(JobOutcome.FAILED);
    assertThat(lock.releaseCalls()).isEqualTo(1);
  }

  @Test
  void reportsAbortWhenLockIsLostDuringWork() {
    MaintenanceJobRunner runner = runnerWithRedis();

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> {
      lock.markLost();
      assertThat(context.shouldContinue()).isFalse();
    });

    assertThat(outcome).isEqualTo(JobOutcome.ABORTED_LOCK_LOST);
  }

  @Test
  void skipsWithoutRedisByDefault() {
    when(lockServiceProvider.getIfAvailable()).thenReturn(null);
    MaintenanceJobRunner runner = new MaintenanceJobRunner(lockServiceProvider, TestProperties.defaults(), noopExecutor);

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> workRan.set(true));

    assertThat(outcome).isEqualTo(JobOutcome.SKIPPED_LOCK_UNAVAILABLE);
    assertThat(workRan).isFalse();
  }

  @Test
  void runsLocallyWithoutRedisWhenAllowed() {
    when(lockServiceProvider.getIfAvailable()).thenReturn(null);
    MaintenanceJobRunner runner = new MaintenanceJobRunner(
        lockServiceProvider, TestProperties.builder().allowLocalWithoutRedis(true).build(), noopExecutor);

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> workRan.set(true));

    assertThat(outcome).isEqualTo(JobOutcome.COMPLETED);
    assertThat(workRan).isTrue();
  }

  @Test
  void submitsRenewalLoopForLockedRuns() {
    Executor executor = mock(Executor.class);
    when(lockServiceProvider.getIfAvailable()).thenReturn(lockService);
    MaintenanceJobRunner runner = new MaintenanceJobRunner(lockServiceProvider, TestProperties.defaults(), executor);

    runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> {});

    verify(executor).execute(any(Runnable.class));
  }

  @Test
  void rejectedRenewalLoopReleasesLockWithoutRunningWork() {
    Executor rejecting = task -> {
      throw new TaskRejectedException("renewal pool exhausted");
    };
    when(lockServiceProvider.getIfAvailable()).thenReturn(lockService);
    MaintenanceJobRunner runner = new MaintenanceJobRunner(lockServiceProvider, TestProperties.defaults(), rejecting);

    JobOutcome outcome = runner.run("chat_lifetime_cleanup", "chat_cleanup_job", context -> workRan.set(true));

    assertThat(outcome).isEqualTo(JobOutcome.FAILED);
    assertThat(workRan).isFalse();
    assertThat(lock.releaseCalls()).isEqualTo(1);
    assertThat(lock.isHeld()).isFalse();
  }

  private MaintenanceJobRunner runnerWithRedis() {
    when(lockServiceProvider.getIfAvailable()).thenReturn(lockService);
    return new MaintenanceJobRunner(lockServiceProvider, TestProperties.defaults(), noopExecutor);
  }
}
