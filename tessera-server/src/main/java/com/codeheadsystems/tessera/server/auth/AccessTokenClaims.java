package com.codeheadsystems.tessera.server.auth;

import java.time.Instant;
import java.util.List;

/**
 * Decoded payload of an access token.
 *
 * @param subject     user id ({@code sub})
 * @param email       user email
 * @param sessionId   owning session
 * @param roleIds     role identifiers at mint time
 * @param permissions permission strings at mint time
 * @param jti         unique token id
 * @param issuedAt    {@code iat}
 * @param expiresAt   {@code exp}
 */
public record AccessTokenClaims(
    String subject,
    String email,
    String sessionId,
    List<String> roleIds,
    List<String> permissions,
    String jti,
    Instant issuedAt,
    Instant expiresAt) {

  public AccessTokenClaims {
    roleIds = List.copyOf(roleIds);
    permissions = List.copyOf(permissions);
  }
}
