package com.codeheadsystems.tessera.server.store;

import java.util.Objects;

/**
 * The slice of a user row the token lifecycle needs.
 *
 * @param id     user identifier, the token subject
 * @param email  email, embedded in access tokens
 * @param status account status
 */
public record UserRecord(String id, String email, UserStatus status) {

  public UserRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(status, "status");
  }

  public boolean isActive() {
    return status == UserStatus.ACTIVE;
  }
}
