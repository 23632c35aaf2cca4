package com.example.webui.config;

import com.example.webui.adapter.redis.client.RedisHealthClient;
import com.example.webui.properties.ApplicationProperties;
import com.example.webui.service.lock.DistributedLockService;
import com.example.webui.service.lock.LockMetrics;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.actuate.data.redis.RedisHealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis connection set up from {@code app.redis.url}.
 * Only active when the url is set; without it sessions stay in process and no
 * distributed lock is available.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnExpression("!'${app.redis.url:}'.trim().isEmpty()")
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  /**
   * Shared client resources for all Redis connections
   */
  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    RedisURI uri = RedisURI.create(redisProps.url());

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
    redisConfig.setDatabase(uri.getDatabase());
    if (uri.getUsername() != null) {
      redisConfig.setUsername(uri.getUsername());
    }
    if (uri.getPassword() != null) {
      redisConfig.setPassword(RedisPassword.of(uri.getPassword()));
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(redisProps.timeout()));

    if (uri.isSsl()) {
      builder.useSsl();
    }

    log.info("Using Redis at {}:{} (db {}, ssl={})", uri.getHost(), uri.getPort(), uri.getDatabase(), uri.isSsl());

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);
    return factory;
  }

  /**
   * Primary Redis template for string operations
   */
  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setHashKeySerializer(stringSerializer);
    template.setHashValueSerializer(stringSerializer);

    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public LockMetrics lockMetrics(MeterRegistry meterRegistry) {
    return new LockMetrics(meterRegistry);
  }

  @Bean
  public DistributedLockService distributedLockService(RedisTemplate<String, String> redisTemplate,
                                                       LockMetrics lockMetrics) {
    return new DistributedLockService(redisTemplate, lockMetrics);
  }

  @Bean
  public RedisHealthClient redisHealthClient(RedisTemplate<String, String> redisTemplate) {
    return new RedisHealthClient(redisTemplate);
  }

  @Bean
  public RedisHealthIndicator redisHealthIndicator(RedisConnectionFactory connectionFactory) {
    return new RedisHealthIndicator(connectionFactory);
  }

  private ClientOptions createClientOptions(Duration timeout) {
    return ClientOptions.builder()
        .socketOptions(SocketOptions.builder()
                           .connectTimeout(timeout)
                           .keepAlive(true)
                           .tcpNoDelay(true)
                           .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .publishOnScheduler(true)
        .pingBeforeActivateConnection(true)
        .timeoutOptions(TimeoutOptions.enabled(timeout))
        .build();
  }
}
