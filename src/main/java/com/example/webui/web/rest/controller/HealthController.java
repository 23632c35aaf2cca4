package com.example.webui.web.rest.controller;

import com.example.webui.adapter.redis.client.RedisHealthClient;
import com.example.webui.adapter.redis.dto.RedisHealthResponse;
import com.example.webui.properties.ApplicationProperties;
import com.example.webui.service.lock.LockMetrics;
import com.example.webui.service.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health endpoints. They never go through GlobalErrorHandler: monitoring tools rely on the
 * status codes returned here.
 */
@Slf4j
@RestController
public class HealthController implements HealthAPI {

  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";

  private final SessionStore sessionStore;
  private final ObjectProvider<RedisHealthClient> redisHealthClientProvider;
  private final ObjectProvider<LockMetrics> lockMetricsProvider;
  private final List<String> maintenanceLockNames;

  public HealthController(SessionStore sessionStore,
                          ObjectProvider<RedisHealthClient> redisHealthClientProvider,
                          ObjectProvider<LockMetrics> lockMetricsProvider,
                          ApplicationProperties properties) {
    this.sessionStore = sessionStore;
    this.redisHealthClientProvider = redisHealthClientProvider;
    this.lockMetricsProvider = lockMetricsProvider;
    this.maintenanceLockNames = List.of(
        properties.maintenance().chatCleanup().lockName(),
        properties.maintenance().userPoolCleanup().lockName());
  }

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "sessionStore", sessionStore.kind(),
        "timestamp", System.currentTimeMillis()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> locks() {
    LockMetrics lockMetrics = lockMetricsProvider.getIfAvailable();
    Map<String, Object> locks = new LinkedHashMap<>();
    if (lockMetrics != null) {
      maintenanceLockNames.forEach(name -> locks.put(name, lockMetrics.snapshot(name)));
    }
    return ResponseEntity.ok(locks);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> status = new HashMap<>();
    status.put("sessionStore", sessionStore.kind());
    boolean isReady = true;

    RedisHealthClient redisHealthClient = redisHealthClientProvider.getIfAvailable();
    if (redisHealthClient != null) {
      RedisHealthResponse redisHealth;
      try {
        redisHealth = redisHealthClient.checkHealth();
      } catch (RuntimeException e) {
        log.error("Redis health check failed", e);
        redisHealth = RedisHealthResponse.unhealthy(e.getMessage());
      }

      Map<String, Object> redisStatus = new HashMap<>();
      redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
      redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
      if (redisHealth.version() != null) {
        redisStatus.put("version", redisHealth.version());
      }
      if (redisHealth.error() != null) {
        redisStatus.put("error", redisHealth.error());
      }
      status.put("redis", redisStatus);

      if (!redisHealth.healthy()) {
        isReady = false;
        log.warn("Readiness check failed: Redis unreachable ({})", redisHealth.error());
      }
    }

    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());
    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
