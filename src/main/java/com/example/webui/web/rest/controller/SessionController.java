package com.example.webui.web.rest.controller;

import com.example.webui.domain.entity.UserSession;
import com.example.webui.exception.SessionException;
import com.example.webui.security.filter.UserSessionFilter;
import com.example.webui.service.session.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Exposes the session resolved by {@link UserSessionFilter}.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionStore sessionStore;
  private final HttpServletRequest request;

  @Override
  public ResponseEntity<Map<String, Object>> getSession() {
    UserSession session = currentSession();

    Map<String, Object> body = new HashMap<>();
    body.put("userId", session.userId());
    body.put("hasThirdPartyToken", session.hasThirdPartyToken());
    if (session.hasThirdPartyToken()) {
      body.put("thirdPartyTokenExpiry", session.thirdPartyToken().expiry());
    }
    body.put("sessionStore", sessionStore.kind());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Void> removeSession() {
    UserSession session = currentSession();
    sessionStore.remove(session.userId());
    log.info("Removed session for user {}", session.userId());
    return ResponseEntity.noContent().build();
  }

  private UserSession currentSession() {
    Object attribute = request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE);
    if (attribute instanceof UserSession session) {
      return session;
    }
    throw new SessionException("No session found");
  }
}
