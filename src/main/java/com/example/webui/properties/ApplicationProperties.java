package com.example.webui.properties;

import com.example.webui.service.session.TokenReplacementPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration properties for the session backend.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @DefaultValue @NotNull @Valid RedisProperties redis,
    @DefaultValue @NotNull @Valid SessionProperties session,
    @DefaultValue @NotNull @Valid LockProperties lock,
    @DefaultValue @NotNull @Valid MaintenanceProperties maintenance
) {

  /**
   * Application credential verification
   */
  public record AuthProperties(@NotBlank String jwtSecret) {}

  /**
   * Redis connection. An empty url selects the in-process session store.
   */
  public record RedisProperties(
      @DefaultValue("") String url,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue @NotNull @Valid PoolProperties pool
  ) {
    public boolean isConfigured() {
      return url != null && !url.isBlank();
    }

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * User session storage and request handling
   */
  public record SessionProperties(
      @DefaultValue("30m") @DurationUnit(ChronoUnit.SECONDS) Duration lifetime,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration cleanInterval,
      @DefaultValue("token") @NotBlank String cookieName,
      @DefaultValue("X-Forwarded-Access-Token") @NotBlank String thirdPartyTokenHeader,
      @DefaultValue("LATEST_EXPIRY") @NotNull TokenReplacementPolicy tokenReplacementPolicy
  ) {}

  /**
   * Distributed lock lease settings for maintenance jobs
   */
  public record LockProperties(
      @DefaultValue("1800s") @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
      @DefaultValue("300s") @DurationUnit(ChronoUnit.SECONDS) Duration renewalInterval,
      @DefaultValue("2") @Positive int maxConsecutiveRenewalFailures
  ) {}

  /**
   * Scheduled maintenance jobs
   */
  public record MaintenanceProperties(
      @DefaultValue("false") boolean allowLocalWithoutRedis,
      @DefaultValue @NotNull @Valid ChatCleanupProperties chatCleanup,
      @DefaultValue @NotNull @Valid UserPoolCleanupProperties userPoolCleanup
  ) {
    public record ChatCleanupProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("90") @Positive int lifetimeDays,
        @DefaultValue("true") boolean preservePinned,
        @DefaultValue("false") boolean preserveArchived,
        @DefaultValue("0 0 2 * * *") @NotBlank String cron,
        @DefaultValue("Etc/UTC") @NotBlank String timezone,
        @DefaultValue("chat_cleanup_job") @NotBlank String lockName
    ) {}

    public record UserPoolCleanupProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("0 0 0 * * *") @NotBlank String cron,
        @DefaultValue("Etc/UTC") @NotBlank String timezone,
        @DefaultValue("user_pool_cleanup_job") @NotBlank String lockName,
        @DefaultValue("open-webui:user_pool") @NotBlank String userPoolKey,
        @DefaultValue("open-webui:session_pool") @NotBlank String sessionPoolKey
    ) {}
  }
}
