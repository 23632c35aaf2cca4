package com.example.webui.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis lease lock: {@code SET key id NX EX ttl} to acquire, Lua compare-and-act scripts
 * to renew and release so another instance's lock is never extended or deleted.
 */
@Slf4j
public class RedisDistributedLock implements DistributedLock {

  static final String LOCK_PREFIX = "lock:";

  static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
      "if redis.call('get', KEYS[1]) == ARGV[1] then "
          + "return redis.call('expire', KEYS[1], ARGV[2]) "
          + "else return 0 end",
      Long.class);

  static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
      "if redis.call('get', KEYS[1]) == ARGV[1] then "
          + "return redis.call('del', KEYS[1]) "
          + "else return 0 end",
      Long.class);

  private final RedisTemplate<String, String> redisTemplate;
  private final String lockName;
  private final String lockKey;
  private final String lockId;
  private final Duration ttl;
  private final LockMetrics metrics;

  private volatile boolean held;
  private volatile RuntimeException lastError;

  public RedisDistributedLock(RedisTemplate<String, String> redisTemplate, String lockName, Duration ttl,
                              LockMetrics metrics) {
    if (lockName == null || lockName.isBlank()) {
      throw new IllegalArgumentException("Lock name cannot be null or empty");
    }
    if (ttl.toSeconds() < 1) {
      throw new IllegalArgumentException("Lock TTL must be at least one second");
    }
    this.redisTemplate = redisTemplate;
    this.lockName = lockName;
    this.lockKey = LOCK_PREFIX + lockName;
    this.lockId = UUID.randomUUID().toString();
    this.ttl = ttl;
    this.metrics = metrics;
  }

  @Override
  public boolean acquire() {
    lastError = null;
    try {
      held = Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(lockKey, lockId, ttl));
      log.debug("Acquire {}: {}", lockName, held);
      metrics.acquireAttempted(lockName, held);
    } catch (RuntimeException e) {
      metrics.acquireFailed(lockName);
      recordError("acquiring", e);
      held = false;
    }
    return held;
  }

  @Override
  public boolean renew() {
    lastError = null;
    try {
      Long result = redisTemplate.execute(RENEW_SCRIPT, List.of(lockKey), lockId, String.valueOf(ttl.toSeconds()));
      held = result != null && result == 1L;
      if (!held) {
        log.warn("Lock {} is no longer owned by {}", lockName, lockId);
      }
    } catch (RuntimeException e) {
      recordError("renewing", e);
      held = false;
    }
    metrics.renewed(lockName, held);
    return held;
  }

  @Override
  public boolean release() {
    lastError = null;
    boolean released = false;
    try {
      Long result = redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey), lockId);
      released = result != null && result == 1L;
      if (!released) {
        log.debug("Lock {} was not owned by {} at release", lockName, lockId);
      }
    } catch (RuntimeException e) {
      recordError("releasing", e);
    } finally {
      held = false;
    }
    return released;
  }

  @Override
  public boolean isHeld() {
    return held;
  }

  @Override
  public void markLost() {
    held = false;
  }

  @Override
  public Optional<RuntimeException> lastError() {
    return Optional.ofNullable(lastError);
  }

  @Override
  public String lockName() {
    return lockName;
  }

  @Override
  public String lockId() {
    return lockId;
  }

  @Override
  public Duration ttl() {
    return ttl;
  }

  private void recordError(String operation, RuntimeException e) {
    lastError = e;
    log.error("Error {} Redis lock {}: {}", operation, lockName, e.getMessage());
  }
}
