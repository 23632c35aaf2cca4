package com.example.webui.config;

import com.example.webui.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces rules spanning several properties, beyond
 * basic JSR-303 validation. Fails fast on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final int MIN_HS256_SECRET_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate(properties);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  static List<String> validate(ApplicationProperties properties) {
    List<String> errors = new ArrayList<>();
    validateAuthConfig(properties.auth(), errors);
    validateSessionConfig(properties.session(), errors);
    validateLockConfig(properties.lock(), errors);
    validateMaintenanceConfig(properties.maintenance(), errors);
    return errors;
  }

  private static void validateAuthConfig(ApplicationProperties.AuthProperties auth, List<String> errors) {
    if (auth.jwtSecret().getBytes(StandardCharsets.UTF_8).length < MIN_HS256_SECRET_BYTES) {
      errors.add("JWT secret must be at least %d bytes for HS256.".formatted(MIN_HS256_SECRET_BYTES));
    }
  }

  private static void validateSessionConfig(ApplicationProperties.SessionProperties session, List<String> errors) {
    if (session.lifetime().compareTo(Duration.ofMinutes(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session lifetime", "1 minute"));
    }
    if (session.cleanInterval().compareTo(Duration.ofSeconds(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session clean interval", "1 second"));
    }
    if (session.cleanInterval().compareTo(session.lifetime()) > 0) {
      errors.add("Session clean interval (%s) must not exceed the session lifetime (%s)."
                     .formatted(session.cleanInterval(), session.lifetime()));
    }
  }

  private static void validateLockConfig(ApplicationProperties.LockProperties lock, List<String> errors) {
    if (lock.ttl().compareTo(Duration.ofSeconds(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Lock TTL", "1 second"));
    }
    if (lock.renewalInterval().compareTo(lock.ttl()) >= 0) {
      errors.add("Lock renewal interval (%s) must be shorter than the lock TTL (%s)."
                     .formatted(lock.renewalInterval(), lock.ttl()));
    }
  }

  private static void validateMaintenanceConfig(ApplicationProperties.MaintenanceProperties maintenance,
                                                List<String> errors) {
    validateSchedule("Chat cleanup", maintenance.chatCleanup().cron(), maintenance.chatCleanup().timezone(), errors);
    validateSchedule("User pool cleanup", maintenance.userPoolCleanup().cron(),
                     maintenance.userPoolCleanup().timezone(), errors);
  }

  private static void validateSchedule(String job, String cron, String timezone, List<String> errors) {
    if (!CronExpression.isValidExpression(cron)) {
      errors.add("%s cron expression is invalid: %s".formatted(job, cron));
    }
    try {
      ZoneId.of(timezone);
    } catch (DateTimeException e) {
      errors.add("%s timezone is invalid: %s".formatted(job, timezone));
    }
  }
}
