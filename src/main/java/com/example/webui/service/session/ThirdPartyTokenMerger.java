package com.example.webui.service.session;

import com.example.webui.domain.entity.ThirdPartyToken;
import com.example.webui.domain.entity.UserSession;
import com.example.webui.util.JwtClaimsUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalLong;

/**
 * Folds a freshly observed third-party access token into a user session according to a
 * {@link TokenReplacementPolicy}.
 */
@Slf4j
public class ThirdPartyTokenMerger {

  private final TokenReplacementPolicy policy;

  public ThirdPartyTokenMerger(TokenReplacementPolicy policy) {
    this.policy = policy;
  }

  /**
   * @param session  the current session
   * @param rawToken the token from the request, may be {@code null} or empty
   * @return the resulting session and whether it differs from the input
   */
  public MergeResult merge(UserSession session, String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      return MergeResult.unchanged(session);
    }

    OptionalLong expiry = JwtClaimsUtils.extractExpiry(rawToken);
    if (expiry.isEmpty()) {
      log.debug("Ignoring third-party token without a readable expiry for user {}", session.userId());
      return MergeResult.unchanged(session);
    }

    ThirdPartyToken stored = session.thirdPartyToken();
    if (stored == null || policy.shouldReplace(stored.expiry(), expiry.getAsLong())) {
      return new MergeResult(true, session.withThirdPartyToken(new ThirdPartyToken(rawToken, expiry.getAsLong())));
    }
    return MergeResult.unchanged(session);
  }

  public record MergeResult(boolean updated, UserSession session) {
    static MergeResult unchanged(UserSession session) {
      return new MergeResult(false, session);
    }
  }
}
