package com.example.webui;

import com.example.webui.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Chat Web UI Session Backend
 *
 * User session storage and maintenance scheduling for horizontal scaling with:
 * - Redis for shared sessions and distributed job locks
 * - In-process sessions for single-instance deployments
 * - Per-request session resolution from the application credential
 */
@SpringBootApplication(exclude = {
    RedisAutoConfiguration.class,
    RedisRepositoriesAutoConfiguration.class,
    UserDetailsServiceAutoConfiguration.class
})
@EnableConfigurationProperties(ApplicationProperties.class)
public class WebUiSessionApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(WebUiSessionApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
