package com.codeheadsystems.tessera.server.claims;

import java.util.List;

/**
 * Supplies the authorization claims embedded in a token at mint time.
 * <p>
 * Called synchronously on every mint. Implementations may cache internally; the token service
 * does not. A failure should be raised as
 * {@link com.codeheadsystems.tessera.server.exception.TransientStoreException}; minting then
 * fails closed.
 */
public interface ClaimsProvider {

  /**
   * Current roles of the user.
   *
   * @param userId user id
   * @return roles, possibly empty, never null
   */
  List<Role> getUserRoles(String userId);

  /**
   * Current permission strings of the user.
   *
   * @param userId user id
   * @return permissions, possibly empty, never null
   */
  List<String> getUserPermissions(String userId);
}
