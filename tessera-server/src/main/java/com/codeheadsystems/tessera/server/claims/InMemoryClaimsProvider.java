package com.codeheadsystems.tessera.server.claims;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link ClaimsProvider} holding role and permission assignments in memory.
 * Development and testing only. Unknown users have no roles and no permissions.
 */
public class InMemoryClaimsProvider implements ClaimsProvider {

  private final ConcurrentHashMap<String, List<Role>> roles = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, List<String>> permissions = new ConcurrentHashMap<>();

  /**
   * Replaces the user's assignments.
   *
   * @param userId          user id
   * @param userRoles       roles
   * @param userPermissions permission strings
   */
  public void assign(String userId, List<Role> userRoles, List<String> userPermissions) {
    roles.put(userId, List.copyOf(userRoles));
    permissions.put(userId, List.copyOf(userPermissions));
  }

  @Override
  public List<Role> getUserRoles(String userId) {
    return roles.getOrDefault(userId, List.of());
  }

  @Override
  public List<String> getUserPermissions(String userId) {
    return permissions.getOrDefault(userId, List.of());
  }
}
