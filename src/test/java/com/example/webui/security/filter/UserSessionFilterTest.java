package com.example.webui.security.filter;

import com.example.webui.domain.entity.CredentialClaims;
import com.example.webui.domain.entity.ThirdPartyToken;
import com.example.webui.domain.entity.UserSession;
import com.example.webui.exception.TokenValidationException;
import com.example.webui.security.AuthTokenDecoder;
import com.example.webui.service.session.SessionStore;
import com.example.webui.service.session.ThirdPartyTokenMerger;
import com.example.webui.service.session.TokenReplacementPolicy;
import com.example.webui.support.TestProperties;
import com.example.webui.support.Tokens;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class UserSessionFilterTest {

  private static final String CREDENTIAL = "app-credential";
  private static final String HEADER = "X-Forwarded-Access-Token";

  private SessionStore sessionStore;
  private AuthTokenDecoder tokenDecoder;
  private UserSessionFilter filter;

  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private MockFilterChain chain;

  @BeforeEach
  void setUp() {
    sessionStore = mock(SessionStore.class);
    tokenDecoder = mock(AuthTokenDecoder.class);
    filter = new UserSessionFilter(sessionStore, tokenDecoder,
                                   new ThirdPartyTokenMerger(TokenReplacementPolicy.LATEST_EXPIRY),
                                   TestProperties.defaults());

    request = new MockHttpServletRequest("GET", "/api/chats");
    response = new MockHttpServletResponse();
    chain = new MockFilterChain();
  }

  @Test
  void anonymousRequestPassesThroughUntouched() throws Exception {
    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isNull();
    verifyNoInteractions(tokenDecoder, sessionStore);
  }

  @Test
  void unverifiableCredentialPassesThroughWithoutSession() throws Exception {
    request.setCookies(new Cookie("token", CREDENTIAL));
    when(tokenDecoder.decode(CREDENTIAL))
        .thenThrow(new TokenValidationException(TokenValidationException.Reason.EXPIRED, "expired"));

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isNull();
    verifyNoInteractions(sessionStore);
  }

  @Test
  void bearerCredentialResolvesStoredSession() throws Exception {
    UserSession stored = UserSession.empty("u1").withThirdPartyToken(new ThirdPartyToken("t", 2_000_000_000L));
    request.addHeader("Authorization", "Bearer " + CREDENTIAL);
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.of(stored));

    filter.doFilter(request, response, chain);

    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isEqualTo(stored);
    verify(sessionStore, never()).update(any());
  }

  @Test
  void newUserWithoutThirdPartyTokenIsNotPersisted() throws Exception {
    request.setCookies(new Cookie("token", CREDENTIAL));
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.empty());

    filter.doFilter(request, response, chain);

    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isEqualTo(UserSession.empty("u1"));
    verify(sessionStore, never()).update(any());
  }

  @Test
  void fresherThirdPartyTokenIsPersisted() throws Exception {
    String fresher = Tokens.thirdPartyToken(2_100_000_000L);
    request.setCookies(new Cookie("token", CREDENTIAL));
    request.addHeader(HEADER, fresher);
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.of(
        UserSession.empty("u1").withThirdPartyToken(new ThirdPartyToken("old", 2_000_000_000L))));
    when(sessionStore.update(any())).thenReturn(true);

    filter.doFilter(request, response, chain);

    ArgumentCaptor<UserSession> saved = ArgumentCaptor.forClass(UserSession.class);
    verify(sessionStore).update(saved.capture());
    assertThat(saved.getValue().thirdPartyToken()).isEqualTo(new ThirdPartyToken(fresher, 2_100_000_000L));
    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isEqualTo(saved.getValue());
  }

  @Test
  void staleThirdPartyTokenIsIgnored() throws Exception {
    request.setCookies(new Cookie("token", CREDENTIAL));
    request.addHeader(HEADER, Tokens.thirdPartyToken(1_900_000_000L));
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.of(
        UserSession.empty("u1").withThirdPartyToken(new ThirdPartyToken("old", 2_000_000_000L))));

    filter.doFilter(request, response, chain);

    verify(sessionStore, never()).update(any());
  }

  @Test
  void unparseableThirdPartyTokenKeepsStoredSession() throws Exception {
    UserSession stored = UserSession.empty("u1").withThirdPartyToken(new ThirdPartyToken("t", 2_000_000_000L));
    request.addHeader("Authorization", "Bearer " + CREDENTIAL);
    request.addHeader(HEADER, "a.b");
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.of(stored));

    filter.doFilter(request, response, chain);

    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isEqualTo(stored);
    verify(sessionStore, never()).update(any());
  }

  @Test
  void failedSaveDoesNotFailRequest() throws Exception {
    request.setCookies(new Cookie("token", CREDENTIAL));
    request.addHeader(HEADER, Tokens.thirdPartyToken(2_100_000_000L));
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get("u1")).thenReturn(Optional.empty());
    when(sessionStore.update(any())).thenReturn(false);

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isNotNull();
  }

  @Test
  void unexpectedStoreErrorDoesNotFailRequest() throws Exception {
    request.setCookies(new Cookie("token", CREDENTIAL));
    when(tokenDecoder.decode(CREDENTIAL)).thenReturn(new CredentialClaims("u1", null));
    when(sessionStore.get(anyString())).thenThrow(new IllegalStateException("boom"));

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(request.getAttribute(UserSessionFilter.SESSION_ATTRIBUTE)).isNull();
  }
}
