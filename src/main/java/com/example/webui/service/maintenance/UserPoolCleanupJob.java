package com.example.webui.service.maintenance;

import com.example.webui.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prunes the websocket user pool: socket session ids that no longer appear in the session
 * pool are dropped, and users left without any are removed. Both pools are Redis hashes;
 * user pool values are JSON arrays of session ids.
 */
@Slf4j
@Component
public class UserPoolCleanupJob {

  public static final String JOB_ID = "user_pool_cleanup";

  private static final TypeReference<List<String>> SESSION_ID_LIST = new TypeReference<>() {};

  private final MaintenanceJobRunner jobRunner;
  private final ObjectProvider<RedisTemplate<String, String>> redisTemplateProvider;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties.MaintenanceProperties.UserPoolCleanupProperties settings;

  public UserPoolCleanupJob(MaintenanceJobRunner jobRunner,
                            ObjectProvider<RedisTemplate<String, String>> redisTemplateProvider,
                            ObjectMapper objectMapper,
                            ApplicationProperties properties) {
    this.jobRunner = jobRunner;
    this.redisTemplateProvider = redisTemplateProvider;
    this.objectMapper = objectMapper;
    this.settings = properties.maintenance().userPoolCleanup();
  }

  public JobOutcome run() {
    if (!settings.enabled()) {
      log.info("User pool cleanup is disabled - skipping");
      return JobOutcome.SKIPPED_DISABLED;
    }

    RedisTemplate<String, String> redisTemplate = redisTemplateProvider.getIfAvailable();
    if (redisTemplate == null) {
      log.debug("Not using Redis - skipping user pool cleanup");
      return JobOutcome.SKIPPED_DISABLED;
    }

    log.info("Starting automated user pool cleanup");
    return jobRunner.run(JOB_ID, settings.lockName(), context -> {
      Result result = prune(redisTemplate, context);
      log.info("Automated user pool cleanup completed: removed {} users, trimmed {} users",
               result.usersRemoved(), result.usersTrimmed());
    });
  }

  Result prune(RedisTemplate<String, String> redisTemplate, JobContext context) {
    HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();

    Set<String> activeSessionIds = hashOps.keys(settings.sessionPoolKey());
    Map<String, String> userPool = hashOps.entries(settings.userPoolKey());

    int removed = 0;
    int trimmed = 0;
    for (Map.Entry<String, String> entry : userPool.entrySet()) {
      if (!context.shouldContinue()) {
        log.warn("User pool cleanup interrupted after {} removals", removed);
        break;
      }

      String userId = entry.getKey();
      List<String> sessionIds;
      try {
        sessionIds = objectMapper.readValue(entry.getValue(), SESSION_ID_LIST);
      } catch (JsonProcessingException e) {
        log.error("Unreadable user pool entry for user {}, leaving it in place", userId, e);
        continue;
      }

      List<String> validSessionIds = sessionIds.stream()
          .filter(activeSessionIds::contains)
          .toList();

      if (validSessionIds.isEmpty()) {
        hashOps.delete(settings.userPoolKey(), userId);
        removed++;
      } else if (validSessionIds.size() < sessionIds.size()) {
        try {
          hashOps.put(settings.userPoolKey(), userId, objectMapper.writeValueAsString(validSessionIds));
          trimmed++;
        } catch (JsonProcessingException e) {
          log.error("Could not serialize session ids for user {}", userId, e);
        }
      }
    }
    return new Result(removed, trimmed);
  }

  record Result(int usersRemoved, int usersTrimmed) {}
}
