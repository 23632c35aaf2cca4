package com.example.webui.config;

import com.example.webui.properties.ApplicationProperties;
import com.example.webui.service.maintenance.ChatLifetimeCleanupJob;
import com.example.webui.service.maintenance.UserPoolCleanupJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;

/**
 * Registers the maintenance jobs on a single-threaded scheduler, so a job never overlaps
 * itself on one instance, and provides the executor for lock renewal loops.
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class SchedulerConfig implements SchedulingConfigurer {

  private final ApplicationProperties properties;
  private final ChatLifetimeCleanupJob chatLifetimeCleanupJob;
  private final UserPoolCleanupJob userPoolCleanupJob;

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setScheduler(maintenanceTaskScheduler());

    ApplicationProperties.MaintenanceProperties maintenance = properties.maintenance();

    if (maintenance.chatCleanup().enabled()) {
      taskRegistrar.addTriggerTask(chatLifetimeCleanupJob::run,
                                   cronTrigger(maintenance.chatCleanup().cron(), maintenance.chatCleanup().timezone()));
      log.info("Scheduled chat cleanup '{}' ({}), lifetime {} days",
               maintenance.chatCleanup().cron(), maintenance.chatCleanup().timezone(),
               maintenance.chatCleanup().lifetimeDays());
    } else {
      log.info("Chat lifetime disabled - no automated cleanup scheduled");
    }

    if (maintenance.userPoolCleanup().enabled() && properties.redis().isConfigured()) {
      taskRegistrar.addTriggerTask(userPoolCleanupJob::run,
                                   cronTrigger(maintenance.userPoolCleanup().cron(), maintenance.userPoolCleanup().timezone()));
      log.info("Scheduled user pool cleanup '{}' ({})",
               maintenance.userPoolCleanup().cron(), maintenance.userPoolCleanup().timezone());
    } else {
      log.info("Not using Redis - skipping user pool cleanup schedule");
    }
  }

  @Bean
  public ThreadPoolTaskScheduler maintenanceTaskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("maintenance-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  /**
   * One thread per running renewal loop; at most one loop per maintenance job.
   */
  @Bean
  public static ThreadPoolTaskExecutor lockRenewalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("lock-renewal-");
    executor.setDaemon(true);
    return executor;
  }

  private static CronTrigger cronTrigger(String cron, String timezone) {
    return new CronTrigger(cron, ZoneId.of(timezone));
  }
}
