package com.example.webui.security.filter;

import com.example.webui.domain.entity.CredentialClaims;
import com.example.webui.domain.entity.UserSession;
import com.example.webui.exception.TokenValidationException;
import com.example.webui.properties.ApplicationProperties;
import com.example.webui.security.AuthTokenDecoder;
import com.example.webui.service.session.SessionStore;
import com.example.webui.service.session.ThirdPartyTokenMerger;
import com.example.webui.util.CredentialUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Loads the caller's {@link UserSession} and folds in the third-party access token
 * forwarded by the identity proxy.
 * <p>
 * The filter never rejects a request: missing or unverifiable credentials and store
 * failures are logged and the request continues anonymously. The session is only written
 * back when the forwarded token changed it. The read-then-write is not atomic, so two
 * concurrent requests of the same user may overwrite each other's token update.
 */
@Slf4j
@Component
public class UserSessionFilter extends OncePerRequestFilter {

  /**
   * Request attribute holding the resolved {@link UserSession} for downstream handlers.
   */
  public static final String SESSION_ATTRIBUTE = UserSessionFilter.class.getName() + ".SESSION";

  private final SessionStore sessionStore;
  private final AuthTokenDecoder tokenDecoder;
  private final ThirdPartyTokenMerger tokenMerger;
  private final String cookieName;
  private final String thirdPartyTokenHeader;

  public UserSessionFilter(SessionStore sessionStore,
                           AuthTokenDecoder tokenDecoder,
                           ThirdPartyTokenMerger tokenMerger,
                           ApplicationProperties properties) {
    this.sessionStore = sessionStore;
    this.tokenDecoder = tokenDecoder;
    this.tokenMerger = tokenMerger;
    this.cookieName = properties.session().cookieName();
    this.thirdPartyTokenHeader = properties.session().thirdPartyTokenHeader();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    try {
      resolveSession(request).ifPresent(session -> request.setAttribute(SESSION_ATTRIBUTE, session));
    } catch (RuntimeException e) {
      // Session handling must never fail the request pipeline
      log.error("An unexpected error occurred while resolving the user session.", e);
    }

    filterChain.doFilter(request, response);
  }

  private Optional<UserSession> resolveSession(HttpServletRequest request) {
    Optional<String> credential = CredentialUtil.extractCredential(request, cookieName);
    if (credential.isEmpty()) {
      return Optional.empty();
    }

    CredentialClaims claims;
    try {
      claims = tokenDecoder.decode(credential.get());
    } catch (TokenValidationException e) {
      logRejectedCredential(e);
      return Optional.empty();
    }

    UserSession session = sessionStore.get(claims.userId())
        .orElseGet(() -> UserSession.empty(claims.userId()));

    ThirdPartyTokenMerger.MergeResult merged =
        tokenMerger.merge(session, request.getHeader(thirdPartyTokenHeader));

    if (merged.updated()) {
      if (sessionStore.update(merged.session())) {
        log.debug("Stored new third-party token for user {}", claims.userId());
      } else {
        log.warn("Session for user {} could not be saved; continuing without persisting", claims.userId());
      }
    }
    return Optional.of(merged.session());
  }

  private void logRejectedCredential(TokenValidationException e) {
    switch (e.getReason()) {
      case EXPIRED -> log.warn("Token has expired! Please acquire a new token.");
      case INVALID_SIGNATURE -> log.warn(
          "Token signature is invalid! This token might be tampered with or from an unknown source.");
      default -> log.warn("Token could not be verified ({}): {}", e.getReason(), e.getMessage());
    }
  }
}
