package com.codeheadsystems.tessera.server.store;

/**
 * Account status. Only {@code ACTIVE} users may receive tokens.
 */
public enum UserStatus {
  ACTIVE,
  PENDING,
  SUSPENDED,
  INACTIVE
}
