package com.example.webui.service.maintenance;

import com.example.webui.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Describes when the chat cleanup will run next, or why it will not.
 */
@Service
@RequiredArgsConstructor
public class MaintenanceScheduleService {

  public static final String STATUS_DISABLED = "Disabled";
  public static final String STATUS_BLOCKED = "Blocked";
  public static final String STATUS_SCHEDULED = "Scheduled";

  static final String BLOCKED_REASON =
      "Automated cleanup needs a distributed lock: configure app.redis.url, "
          + "or set app.maintenance.allow-local-without-redis=true for single-instance deployments";

  private final ApplicationProperties properties;
  private final Clock clock;

  public ScheduleInfo chatCleanupSchedule() {
    ApplicationProperties.MaintenanceProperties maintenance = properties.maintenance();
    ApplicationProperties.MaintenanceProperties.ChatCleanupProperties chatCleanup = maintenance.chatCleanup();

    if (!chatCleanup.enabled()) {
      return new ScheduleInfo(false, STATUS_DISABLED, null, chatCleanup.lifetimeDays(),
                              chatCleanup.cron(), chatCleanup.timezone(), null);
    }

    if (!properties.redis().isConfigured() && !maintenance.allowLocalWithoutRedis()) {
      return new ScheduleInfo(true, STATUS_BLOCKED, null, chatCleanup.lifetimeDays(),
                              chatCleanup.cron(), chatCleanup.timezone(), BLOCKED_REASON);
    }

    ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneId.of(chatCleanup.timezone())));
    ZonedDateTime next = CronExpression.parse(chatCleanup.cron()).next(now);
    return new ScheduleInfo(true, STATUS_SCHEDULED,
                            next != null ? next.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : null,
                            chatCleanup.lifetimeDays(), chatCleanup.cron(), chatCleanup.timezone(), null);
  }
}
