package com.codeheadsystems.tessera.server.exception;

/**
 * A session or user row was absent on a direct lookup.
 * <p>
 * Distinct from {@link UnauthorizedException}: this is not a token-trust decision.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
