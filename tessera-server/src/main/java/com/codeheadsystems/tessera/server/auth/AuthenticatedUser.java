package com.codeheadsystems.tessera.server.auth;

import com.codeheadsystems.tessera.server.claims.Role;
import java.util.List;

/**
 * Request-scoped identity resolved from a verified access token.
 *
 * @param id          user id
 * @param email       user email
 * @param roles       current roles
 * @param permissions current permissions
 * @param sessionId   session the token belongs to
 * @param token       the verified access token payload
 */
public record AuthenticatedUser(
    String id,
    String email,
    List<Role> roles,
    List<String> permissions,
    String sessionId,
    AccessTokenClaims token) {

  public boolean hasPermission(String permission) {
    return permissions.contains(permission);
  }
}
