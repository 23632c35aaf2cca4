package com.example.webui.security;

import com.example.webui.domain.entity.CredentialClaims;
import com.example.webui.exception.TokenValidationException;
import com.example.webui.exception.TokenValidationException.Reason;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.proc.BadJOSEException;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.stereotype.Component;

import java.text.ParseException;

/**
 * Verifies the application's own credential (cookie or bearer token) and extracts the
 * user id. Failures are reported as {@link TokenValidationException} with a reason that
 * separates expired, tampered and unreadable tokens.
 */
@Component
@RequiredArgsConstructor
public class AuthTokenDecoder {

  public static final String USER_ID_CLAIM = "id";

  private final JwtDecoder jwtDecoder;

  public CredentialClaims decode(String token) {
    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtValidationException e) {
      boolean expired = e.getErrors().stream()
          .anyMatch(error -> error.getDescription() != null && error.getDescription().contains("expired"));
      throw new TokenValidationException(expired ? Reason.EXPIRED : Reason.INVALID_CLAIMS, e.getMessage(), e);
    } catch (BadJwtException e) {
      throw new TokenValidationException(classify(e), e.getMessage(), e);
    } catch (JwtException e) {
      throw new TokenValidationException(Reason.MALFORMED, e.getMessage(), e);
    }

    String userId = jwt.getClaimAsString(USER_ID_CLAIM);
    if (userId == null || userId.isBlank()) {
      throw new TokenValidationException(Reason.MALFORMED, "Token has no user id claim");
    }
    return new CredentialClaims(userId, jwt.getExpiresAt());
  }

  private static Reason classify(BadJwtException e) {
    if (e.getCause() == null) {
      // Unsigned tokens
      return Reason.INVALID_SIGNATURE;
    }
    for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof ParseException) {
        return Reason.MALFORMED;
      }
      if (cause instanceof BadJOSEException || cause instanceof JOSEException) {
        return Reason.INVALID_SIGNATURE;
      }
    }
    // The parser failed on something that is not a JOSE structure at all
    return Reason.MALFORMED;
  }
}
