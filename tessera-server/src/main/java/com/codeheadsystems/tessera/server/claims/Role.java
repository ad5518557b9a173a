package com.codeheadsystems.tessera.server.claims;

/**
 * A role assigned to a user. Only the id is embedded in tokens.
 *
 * @param id   role identifier
 * @param name human-readable role name
 */
public record Role(String id, String name) {

  public Role {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Role id must not be blank");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Role name must not be blank");
    }
  }
}
