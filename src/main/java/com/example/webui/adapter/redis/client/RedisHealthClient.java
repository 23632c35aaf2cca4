package com.example.webui.adapter.redis.client;

import com.example.webui.adapter.redis.dto.RedisHealthResponse;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Probes the Redis server backing sessions and job locks.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisHealthClient {

  private final RedisTemplate<String, String> redisTemplate;

  public RedisHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());

      if (!"PONG".equals(pingResponse)) {
        return RedisHealthResponse.unhealthy("Invalid PING response: " + pingResponse);
      }

      Properties info = getRedisInfo();
      long responseTime = System.currentTimeMillis() - startTime;

      return RedisHealthResponse.healthy(
          responseTime,
          info.getProperty("redis_version", "unknown"),
          parseInteger(info.getProperty("connected_clients", "0")));

    } catch (DataAccessException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(e.getMessage());
    }
  }

  private Properties getRedisInfo() {
    try {
      Properties props = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());
      return props != null ? props : new Properties();
    } catch (DataAccessException e) {
      log.warn("Failed to get Redis INFO: {}", e.getMessage());
      return new Properties();
    }
  }

  private int parseInteger(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
