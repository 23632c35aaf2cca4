package com.example.webui.security;

import com.example.webui.config.JwtDecoderConfig;
import com.example.webui.domain.entity.CredentialClaims;
import com.example.webui.exception.TokenValidationException;
import com.example.webui.exception.TokenValidationException.Reason;
import com.example.webui.support.TestProperties;
import com.example.webui.support.Tokens;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthTokenDecoderTest {

  private static final String SECRET = TestProperties.JWT_SECRET;

  private final AuthTokenDecoder decoder = new AuthTokenDecoder(JwtDecoderConfig.createDecoder(SECRET));

  @Test
  void decodesValidCredential() throws Exception {
    Instant expiresAt = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);

    CredentialClaims claims = decoder.decode(Tokens.credential(SECRET, "user-42", expiresAt));

    assertThat(claims.userId()).isEqualTo("user-42");
    assertThat(claims.expiresAt()).isEqualTo(expiresAt);
  }

  @Test
  void acceptsCredentialWithoutExpiry() throws Exception {
    assertThat(decoder.decode(Tokens.credential(SECRET, "user-42", null)).expiresAt()).isNull();
  }

  @Test
  void rejectsExpiredCredential() throws Exception {
    String token = Tokens.credential(SECRET, "user-42", Instant.now().minus(1, ChronoUnit.HOURS));

    assertThatThrownBy(() -> decoder.decode(token))
        .isInstanceOfSatisfying(TokenValidationException.class,
                                e -> assertThat(e.getReason()).isEqualTo(Reason.EXPIRED));
  }

  @Test
  void rejectsCredentialSignedWithAnotherSecret() throws Exception {
    String token = Tokens.credential("fedcba9876543210fedcba9876543210", "user-42",
                                     Instant.now().plus(1, ChronoUnit.HOURS));

    assertThatThrownBy(() -> decoder.decode(token))
        .isInstanceOfSatisfying(TokenValidationException.class,
                                e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_SIGNATURE));
  }

  @Test
  void rejectsMalformedCredential() {
    assertThatThrownBy(() -> decoder.decode("definitely-not-a-jwt"))
        .isInstanceOfSatisfying(TokenValidationException.class,
                                e -> assertThat(e.getReason()).isEqualTo(Reason.MALFORMED));
  }

  @Test
  void rejectsStructurallyBrokenCredentialAsMalformed() {
    assertThatThrownBy(() -> decoder.decode("a.b.c"))
        .isInstanceOfSatisfying(TokenValidationException.class,
                                e -> assertThat(e.getReason()).isEqualTo(Reason.MALFORMED));
  }

  @Test
  void rejectsCredentialWithoutUserId() throws Exception {
    String token = Tokens.credential(SECRET, null, Instant.now().plus(1, ChronoUnit.HOURS));

    assertThatThrownBy(() -> decoder.decode(token))
        .isInstanceOfSatisfying(TokenValidationException.class,
                                e -> assertThat(e.getReason()).isEqualTo(Reason.MALFORMED));
  }
}
