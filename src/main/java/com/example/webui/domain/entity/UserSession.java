package com.example.webui.domain.entity;

/**
 * A server-side user session used to coordinate user state across requests and replicas.
 * Serialized as a JSON document when stored in Redis.
 */
public record UserSession(
    /**
     * The id of the user owning the session. Never changes for the life of the session.
     */
    String userId,

    /**
     * The latest third-party access token seen for the user, or {@code null} if none.
     */
    ThirdPartyToken thirdPartyToken
) {

  public UserSession {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("User id cannot be null or empty");
    }
  }

  public static UserSession empty(String userId) {
    return new UserSession(userId, null);
  }

  public boolean hasThirdPartyToken() {
    return thirdPartyToken != null;
  }

  public UserSession withThirdPartyToken(ThirdPartyToken token) {
    return new UserSession(userId, token);
  }
}
