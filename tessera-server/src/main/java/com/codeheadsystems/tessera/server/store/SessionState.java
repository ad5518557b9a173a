package com.codeheadsystems.tessera.server.store;

/**
 * Lifecycle state of a session at a point in time. {@code REVOKED} and {@code EXPIRED} are terminal.
 */
public enum SessionState {
  ACTIVE,
  REVOKED,
  EXPIRED
}
