package com.example.webui.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.util.WebUtils;

import java.util.Optional;

/**
 * Locates the application credential on an incoming request
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CredentialUtil {

  private static final String BEARER_PREFIX = "Bearer ";

  /**
   * Returns the credential from the named cookie, falling back to a bearer Authorization header.
   *
   * @param request    HTTP request
   * @param cookieName name of the credential cookie
   * @return the raw token, or empty if the request is anonymous
   */
  public static Optional<String> extractCredential(HttpServletRequest request, String cookieName) {
    return getCookieValue(request, cookieName)
        .or(() -> extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION)));
  }

  /**
   * Extract a non-empty cookie value by name using Spring's WebUtils
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }

    try {
      return Optional.ofNullable(WebUtils.getCookie(request, name))
          .map(Cookie::getValue)
          .filter(value -> !value.isBlank());
    } catch (Exception e) {
      log.debug("Error retrieving cookie '{}': {}", name, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Parses {@code Bearer <token>}; the scheme is matched case-insensitively.
   */
  public static Optional<String> extractBearerToken(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()) {
      return Optional.empty();
    }
    if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
