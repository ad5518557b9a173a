package com.codeheadsystems.tessera.server.exception;

/**
 * Internal cause of an {@link UnauthorizedException}.
 * <p>
 * Recorded in logs and metrics only. Never included in the exception message, so callers
 * cannot tell an unknown token from a wrong secret.
 */
public enum RejectionReason {
  INVALID_SIGNATURE,
  EXPIRED,
  MALFORMED,
  BLACKLISTED,
  SECRET_MISMATCH,
  SESSION_NOT_FOUND,
  SESSION_REVOKED,
  SESSION_EXPIRED,
  SESSION_USER_MISMATCH,
  USER_NOT_FOUND,
  USER_INACTIVE,
  ROTATION_CONFLICT
}
