package com.example.webui.config;

import com.example.webui.security.filter.UserSessionFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Stateless security configuration for multi-instance deployment.
 * <p>
 * This layer only attaches the user session to each request; it does not reject anyone.
 * Authorization of individual routes is enforced by the route handlers.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final UserSessionFilter userSessionFilter;

  @Bean
  public SecurityFilterChain sessionFilterChain(HttpSecurity http) throws Exception {
    http
        .addFilterBefore(userSessionFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
        // Credentials are bearer tokens or cookies verified per request
        .csrf(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        // Don't create server sessions - user sessions live in the session store
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)));
    return http.build();
  }

  /**
   * The filter runs inside the security chain only; keep Boot from registering it a second time.
   */
  @Bean
  public FilterRegistrationBean<UserSessionFilter> userSessionFilterRegistration() {
    FilterRegistrationBean<UserSessionFilter> registration = new FilterRegistrationBean<>(userSessionFilter);
    registration.setEnabled(false);
    return registration;
  }
}
