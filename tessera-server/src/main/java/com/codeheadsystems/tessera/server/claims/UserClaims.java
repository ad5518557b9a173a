package com.codeheadsystems.tessera.server.claims;

import java.util.List;

/**
 * Roles and permissions fetched together from a {@link ClaimsProvider}, validated at the boundary.
 *
 * @param roles       roles
 * @param permissions permission strings
 */
public record UserClaims(List<Role> roles, List<String> permissions) {

  public UserClaims {
    if (roles == null || permissions == null) {
      throw new IllegalStateException("Claims provider returned null claims");
    }
    for (Role role : roles) {
      if (role == null) {
        throw new IllegalStateException("Claims provider returned a null role");
      }
    }
    for (String permission : permissions) {
      if (permission == null || permission.isBlank()) {
        throw new IllegalStateException("Claims provider returned a blank permission");
      }
    }
    roles = List.copyOf(roles);
    permissions = List.copyOf(permissions);
  }

  /**
   * Loads both claim lists for a user.
   *
   * @param provider the provider
   * @param userId   user id
   * @return validated claims
   */
  public static UserClaims load(ClaimsProvider provider, String userId) {
    return new UserClaims(provider.getUserRoles(userId), provider.getUserPermissions(userId));
  }

  public List<String> roleIds() {
    return roles.stream().map(Role::id).toList();
  }
}
