package com.codeheadsystems.tessera.server.exception;

/**
 * A backing store (sessions, users, blacklist, claims) failed in a way that may succeed on retry.
 * <p>
 * Propagated to callers as-is; never folded into {@link UnauthorizedException}.
 */
public class TransientStoreException extends RuntimeException {

  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransientStoreException(String message) {
    super(message);
  }
}
