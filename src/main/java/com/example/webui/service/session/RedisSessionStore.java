package com.example.webui.service.session;

import com.example.webui.domain.entity.UserSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Session store shared by all instances through Redis.
 * Each session is a JSON document under {@code user_session:{userId}} whose lifetime is
 * enforced by the Redis key TTL.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

  public static final String SESSION_KEY_PREFIX = "user_session:";

  private final RedisTemplate<String, String> redisTemplate;
  private final ObjectMapper objectMapper;
  private final Duration sessionLifetime;

  public RedisSessionStore(RedisTemplate<String, String> redisTemplate,
                           ObjectMapper objectMapper,
                           Duration sessionLifetime) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.sessionLifetime = sessionLifetime;
  }

  @Override
  public Optional<UserSession> get(String userId) {
    String sessionKey = sessionKey(userId);
    try {
      if (!Boolean.TRUE.equals(redisTemplate.hasKey(sessionKey))) {
        return Optional.empty();
      }
      // The key may expire between the two calls
      String json = redisTemplate.opsForValue().get(sessionKey);
      if (json == null) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(json, UserSession.class));
    } catch (DataAccessException e) {
      log.error("Error reading session for user {} from Redis", userId, e);
      return Optional.empty();
    } catch (JsonProcessingException e) {
      log.error("Stored session for user {} is not readable", userId, e);
      return Optional.empty();
    }
  }

  /**
   * Writes the session document and its expiry in one MULTI/EXEC transaction, so a
   * document is never left in Redis without a TTL.
   */
  @Override
  public boolean update(UserSession session) {
    String sessionKey = sessionKey(session.userId());
    try {
      String json = objectMapper.writeValueAsString(session);

      List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
        @Override
        public <K, V> List<Object> execute(@NonNull RedisOperations<K, V> operations) {
          @SuppressWarnings("unchecked")
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          redisOps.multi();
          try {
            redisOps.opsForValue().set(sessionKey, json);
            redisOps.expire(sessionKey, sessionLifetime);
            return redisOps.exec();
          } catch (RuntimeException e) {
            discardQuietly(redisOps, e);
            throw e;
          }
        }
      });

      if (results == null || results.isEmpty() || Boolean.FALSE.equals(results.get(results.size() - 1))) {
        log.error("Session update transaction for user {} was not applied", session.userId());
        return false;
      }
      return true;
    } catch (DataAccessException e) {
      log.error("Error updating session for user {} in Redis", session.userId(), e);
      return false;
    } catch (JsonProcessingException e) {
      log.error("Session for user {} could not be serialized", session.userId(), e);
      return false;
    }
  }

  @Override
  public void remove(String userId) {
    try {
      redisTemplate.delete(sessionKey(userId));
    } catch (DataAccessException e) {
      log.error("Error removing session for user {} from Redis", userId, e);
    }
  }

  @Override
  public String kind() {
    return "redis";
  }

  static String sessionKey(String userId) {
    return SESSION_KEY_PREFIX + userId;
  }

  private static void discardQuietly(RedisOperations<String, String> redisOps, RuntimeException cause) {
    try {
      redisOps.discard();
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
    }
  }
}
