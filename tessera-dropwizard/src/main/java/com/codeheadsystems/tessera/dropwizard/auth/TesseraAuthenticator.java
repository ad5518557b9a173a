package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.auth.AccessTokenClaims;
import com.codeheadsystems.tessera.server.auth.TokenService;
import com.codeheadsystems.tessera.server.exception.TransientStoreException;
import com.codeheadsystems.tessera.server.exception.UnauthorizedException;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates bearer access tokens using {@link TokenService}.
 * <p>
 * A rejected token yields an empty result (401). A backing-store failure is raised as
 * {@link AuthenticationException}, which Dropwizard turns into a server error rather than a 401.
 */
public class TesseraAuthenticator implements Authenticator<String, TesseraPrincipal> {

  private final TokenService tokenService;

  /**
   * Instantiates a new Tessera authenticator.
   *
   * @param tokenService the token service
   */
  public TesseraAuthenticator(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @Override
  public Optional<TesseraPrincipal> authenticate(String token) throws AuthenticationException {
    AccessTokenClaims claims;
    try {
      claims = tokenService.verifyAccessToken(token);
    } catch (UnauthorizedException e) {
      return Optional.empty();
    } catch (TransientStoreException e) {
      throw new AuthenticationException("Token verification unavailable", e);
    }
    return Optional.of(new TesseraPrincipal(claims.subject(), claims.email(), claims.sessionId(),
        claims.roleIds(), claims.permissions()));
  }
}
