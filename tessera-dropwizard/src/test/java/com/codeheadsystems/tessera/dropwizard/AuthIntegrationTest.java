package com.codeheadsystems.tessera.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.server.auth.TokenPair;
import com.codeheadsystems.tessera.server.auth.TokenService;
import com.codeheadsystems.tessera.server.claims.Role;
import com.codeheadsystems.tessera.server.manager.DeviceMetadata;
import com.codeheadsystems.tessera.server.store.UserRecord;
import com.codeheadsystems.tessera.server.store.UserStatus;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for bearer-token authentication through the bundle.
 * Tests the full flow: create session → issue tokens → call protected endpoint → rotate/revoke.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthIntegrationTest {

  static final DropwizardAppExtension<TesseraConfiguration> APP =
      new DropwizardAppExtension<>(
          TesseraTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final UserRecord USER =
      new UserRecord("user-42", "integration@example.com", UserStatus.ACTIVE);

  private HttpClient httpClient;
  private TesseraBundle<TesseraConfiguration> bundle;
  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    TesseraTestApplication application = APP.getApplication();
    application.userStore().put(USER);
    application.claimsProvider().assign(USER.id(),
        List.of(new Role("role-reader", "Reader")), List.of("documents:read"));
    bundle = application.bundle();
    tokenService = bundle.getTokenService();
  }

  private TokenPair login() {
    return tokenService.issueTokens(USER,
        bundle.getSessionService().createSession(USER.id(), new DeviceMetadata("127.0.0.1", "it")));
  }

  @Test
  void issuedAccessToken_callProtectedEndpoint_returns200() throws Exception {
    TokenPair pair = login();

    HttpResponse<String> response = whoAmI("Bearer " + pair.accessToken().token());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body())
        .contains("user-42")
        .contains(pair.accessToken().payload().sessionId())
        .contains("documents:read");
  }

  @Test
  void rotatedPair_newAccessTokenAccepted() throws Exception {
    TokenPair rotated = tokenService.rotateRefreshToken(login().refreshToken().token());

    assertThat(whoAmI("Bearer " + rotated.accessToken().token()).statusCode()).isEqualTo(200);
  }

  @Test
  void revokedSession_returns401() throws Exception {
    TokenPair pair = login();
    tokenService.revokeToken(pair.accessToken().payload().sessionId(), "logout");

    assertThat(whoAmI("Bearer " + pair.accessToken().token()).statusCode()).isEqualTo(401);
  }

  @Test
  void refreshTokenAsBearer_returns401() throws Exception {
    TokenPair pair = login();

    assertThat(whoAmI("Bearer " + pair.refreshToken().token()).statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_noToken_returns401() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_bogusToken_returns401() throws Exception {
    assertThat(whoAmI("Bearer not-a-real-token").statusCode()).isEqualTo(401);
  }

  @Test
  void healthCheck_reportsBlacklist() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/healthcheck", APP.getAdminPort())))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("token-blacklist");
  }

  private HttpResponse<String> whoAmI(String authorization) throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .header("Authorization", authorization)
        .GET()
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
