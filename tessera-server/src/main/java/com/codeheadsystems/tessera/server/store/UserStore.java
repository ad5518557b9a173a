package com.codeheadsystems.tessera.server.store;

import java.util.Optional;

/**
 * Read-only lookup of user rows. User management itself lives elsewhere.
 * <p>
 * Implementations must be thread-safe.
 */
public interface UserStore {

  /**
   * Loads a user by id.
   *
   * @param userId user id
   * @return the user, or empty if absent
   */
  Optional<UserRecord> findUserById(String userId);
}
