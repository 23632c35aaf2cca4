package com.example.webui.service.maintenance;

import com.example.webui.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class UserPoolCleanupJobTest {

  private static final String USER_POOL = "open-webui:user_pool";
  private static final String SESSION_POOL = "open-webui:session_pool";

  private MaintenanceJobRunner jobRunner;
  private ObjectProvider<RedisTemplate<String, String>> redisTemplateProvider;
  private RedisTemplate<String, String> redisTemplate;
  private HashOperations<String, Object, Object> hashOps;
  private UserPoolCleanupJob job;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    jobRunner = mock(MaintenanceJobRunner.class);
    redisTemplateProvider = mock(ObjectProvider.class);
    redisTemplate = mock(RedisTemplate.class);
    hashOps = mock(HashOperations.class);
    when(redisTemplate.opsForHash()).thenReturn(hashOps);

    job = new UserPoolCleanupJob(jobRunner, redisTemplateProvider, new ObjectMapper(), TestProperties.defaults());
  }

  @Test
  void removesUsersWithoutLiveSocketsAndTrimsStaleIds() {
    when(hashOps.keys(SESSION_POOL)).thenReturn(Set.of("s1", "s2"));
    Map<Object, Object> userPool = new LinkedHashMap<>();
    userPool.put("u1", "[\"s1\",\"s3\"]");
    userPool.put("u2", "[\"s9\"]");
    userPool.put("u3", "[\"s2\"]");
    when(hashOps.entries(USER_POOL)).thenReturn(userPool);

    UserPoolCleanupJob.Result result = job.prune(redisTemplate, new JobContext(UserPoolCleanupJob.JOB_ID, null));

    assertThat(result).isEqualTo(new UserPoolCleanupJob.Result(1, 1));
    verify(hashOps).delete(USER_POOL, "u2");
    verify(hashOps).put(USER_POOL, "u1", "[\"s1\"]");
    verify(hashOps, never()).put(eq(USER_POOL), eq("u3"), any());
  }

  @Test
  void leavesUnreadableEntriesInPlace() {
    when(hashOps.keys(SESSION_POOL)).thenReturn(Set.of());
    Map<Object, Object> userPool = new LinkedHashMap<>();
    userPool.put("u1", "not json");
    when(hashOps.entries(USER_POOL)).thenReturn(userPool);

    UserPoolCleanupJob.Result result = job.prune(redisTemplate, new JobContext(UserPoolCleanupJob.JOB_ID, null));

    assertThat(result).isEqualTo(new UserPoolCleanupJob.Result(0, 0));
    verify(hashOps, never()).delete(anyString(), any());
  }

  @Test
  void stopsWhenContextIsAborted() {
    when(hashOps.keys(SESSION_POOL)).thenReturn(Set.of());
    Map<Object, Object> userPool = new LinkedHashMap<>();
    userPool.put("u1", "[\"s1\"]");
    when(hashOps.entries(USER_POOL)).thenReturn(userPool);
    JobContext context = new JobContext(UserPoolCleanupJob.JOB_ID, null);
    context.abort();

    UserPoolCleanupJob.Result result = job.prune(redisTemplate, context);

    assertThat(result.usersRemoved()).isZero();
    verify(hashOps, never()).delete(anyString(), any());
  }

  @Test
  void skipsWithoutRedis() {
    when(redisTemplateProvider.getIfAvailable()).thenReturn(null);

    assertThat(job.run()).isEqualTo(JobOutcome.SKIPPED_DISABLED);
    verifyNoInteractions(jobRunner);
  }

  @Test
  void skipsWhenDisabled() {
    UserPoolCleanupJob disabled = new UserPoolCleanupJob(
        jobRunner, redisTemplateProvider, new ObjectMapper(),
        TestProperties.builder().userPoolCleanupEnabled(false).build());

    assertThat(disabled.run()).isEqualTo(JobOutcome.SKIPPED_DISABLED);
    verifyNoInteractions(jobRunner, redisTemplateProvider);
  }

  @Test
  void runsThroughRunnerWhenRedisIsAvailable() {
    when(redisTemplateProvider.getIfAvailable()).thenReturn(redisTemplate);
    when(jobRunner.run(eq(UserPoolCleanupJob.JOB_ID), eq("user_pool_cleanup_job"), any()))
        .thenReturn(JobOutcome.COMPLETED);

    assertThat(job.run()).isEqualTo(JobOutcome.COMPLETED);
  }
}
