package com.example.webui.domain.entity;

/**
 * A federated-identity access token forwarded by the identity proxy, together with the
 * expiry extracted from its claims.
 */
public record ThirdPartyToken(
    /**
     * The raw access token as received on the request.
     */
    String token,

    /**
     * The token's expiry in epoch seconds.
     */
    long expiry
) {

  public ThirdPartyToken {
    if (token == null || token.isEmpty()) {
      throw new IllegalArgumentException("Third-party token cannot be null or empty");
    }
  }

  @Override
  public String toString() {
    return "ThirdPartyToken[expiry=" + expiry + "]";
  }
}
