package com.codeheadsystems.tessera.dropwizard.auth;

import java.security.Principal;
import java.util.List;

/**
 * Principal representing a caller authenticated by a tessera access token.
 *
 * @param userId      user id from the token subject
 * @param email       user email
 * @param sessionId   session the token belongs to, for session-scoped checks
 * @param roleIds     role identifiers embedded at mint time
 * @param permissions permissions embedded at mint time
 */
public record TesseraPrincipal(String userId,
                               String email,
                               String sessionId,
                               List<String> roleIds,
                               List<String> permissions) implements Principal {

  @Override
  public String getName() {
    return userId;
  }

  public boolean hasPermission(String permission) {
    return permissions.contains(permission);
  }
}
