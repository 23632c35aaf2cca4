package com.example.webui.service.lock;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Creates Redis-backed locks. Each lock gets a fresh ownership id.
 */
@RequiredArgsConstructor
public class DistributedLockService {

  private final RedisTemplate<String, String> redisTemplate;
  private final LockMetrics metrics;

  public DistributedLock newLock(String lockName, Duration ttl) {
    return new RedisDistributedLock(redisTemplate, lockName, ttl, metrics);
  }
}
