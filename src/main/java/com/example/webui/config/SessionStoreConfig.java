package com.example.webui.config;

import com.example.webui.properties.ApplicationProperties;
import com.example.webui.service.session.InMemorySessionStore;
import com.example.webui.service.session.RedisSessionStore;
import com.example.webui.service.session.SessionStore;
import com.example.webui.service.session.ThirdPartyTokenMerger;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Picks the session store once at startup: Redis when a connection is configured,
 * otherwise the in-process store.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SessionStoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SessionStore sessionStore(ApplicationProperties properties,
                                   ObjectProvider<RedisTemplate<String, String>> redisTemplateProvider,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
    return createSessionStore(properties.session(), redisTemplateProvider.getIfAvailable(), objectMapper, clock);
  }

  @Bean
  public ThirdPartyTokenMerger thirdPartyTokenMerger(ApplicationProperties properties) {
    log.info("Third-party token replacement policy: {}", properties.session().tokenReplacementPolicy());
    return new ThirdPartyTokenMerger(properties.session().tokenReplacementPolicy());
  }

  static SessionStore createSessionStore(ApplicationProperties.SessionProperties session,
                                         RedisTemplate<String, String> redisTemplate,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
    if (redisTemplate != null) {
      log.info("Using Redis session store (lifetime={})", session.lifetime());
      return new RedisSessionStore(redisTemplate, objectMapper, session.lifetime());
    }
    return new InMemorySessionStore(session.lifetime(), session.cleanInterval(), clock);
  }
}
