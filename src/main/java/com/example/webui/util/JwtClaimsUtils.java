package com.example.webui.util;

import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTParser;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.text.ParseException;
import java.util.Date;
import java.util.OptionalLong;

/**
 * Reads claims from JWTs without verifying them.
 * Only for informational claims; never use the result to authenticate anything.
 */
@Slf4j
@UtilityClass
public class JwtClaimsUtils {

  /**
   * Extracts the {@code exp} claim of a token without checking its signature.
   *
   * @param token a serialized JWT
   * @return the expiry in epoch seconds, or empty if the token is blank, malformed or has no expiry
   */
  public static OptionalLong extractExpiry(String token) {
    if (token == null || token.isBlank()) {
      return OptionalLong.empty();
    }
    try {
      JWT jwt = JWTParser.parse(token);
      Date expiration = jwt.getJWTClaimsSet().getExpirationTime();
      if (expiration == null) {
        log.debug("Token carries no exp claim");
        return OptionalLong.empty();
      }
      return OptionalLong.of(expiration.toInstant().getEpochSecond());
    } catch (ParseException | RuntimeException e) {
      // JWTParser throws unchecked exceptions for some structurally broken inputs
      log.debug("Token could not be parsed: {}", e.getMessage());
      return OptionalLong.empty();
    }
  }
}
