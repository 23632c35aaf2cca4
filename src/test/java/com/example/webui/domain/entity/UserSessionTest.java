package com.example.webui.domain.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserSessionTest {

  @Test
  void emptySessionHasNoThirdPartyToken() {
    UserSession session = UserSession.empty("u1");

    assertThat(session.userId()).isEqualTo("u1");
    assertThat(session.hasThirdPartyToken()).isFalse();
  }

  @Test
  void withThirdPartyTokenKeepsUserId() {
    UserSession session = UserSession.empty("u1").withThirdPartyToken(new ThirdPartyToken("abc", 100L));

    assertThat(session.userId()).isEqualTo("u1");
    assertThat(session.thirdPartyToken().expiry()).isEqualTo(100L);
  }

  @Test
  void rejectsBlankUserId() {
    assertThatThrownBy(() -> UserSession.empty(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsEmptyThirdPartyToken() {
    assertThatThrownBy(() -> new ThirdPartyToken("", 100L))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void thirdPartyTokenToStringHidesTheToken() {
    assertThat(new ThirdPartyToken("secret-token-value", 100L).toString())
        .doesNotContain("secret-token-value")
        .contains("100");
  }
}
