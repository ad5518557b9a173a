package com.codeheadsystems.tessera.server.auth;

import java.time.Instant;
import java.util.List;

/**
 * Decoded payload of a refresh token.
 *
 * @param subject       user id ({@code sub})
 * @param sessionId     owning session
 * @param roleIds       role identifiers at mint time
 * @param permissions   permission strings at mint time
 * @param jti           unique token id
 * @param issuedAt      {@code iat}
 * @param expiresAt     {@code exp}
 * @param refreshSecret secret whose hash must equal the session's stored hash
 */
public record RefreshTokenClaims(
    String subject,
    String sessionId,
    List<String> roleIds,
    List<String> permissions,
    String jti,
    Instant issuedAt,
    Instant expiresAt,
    String refreshSecret) {

  public RefreshTokenClaims {
    roleIds = List.copyOf(roleIds);
    permissions = List.copyOf(permissions);
  }

  @Override
  public String toString() {
    return "RefreshTokenClaims[subject=" + subject
        + ", sessionId=" + sessionId
        + ", roleIds=" + roleIds
        + ", permissions=" + permissions
        + ", jti=" + jti
        + ", issuedAt=" + issuedAt
        + ", expiresAt=" + expiresAt + "]";
  }
}
