package com.codeheadsystems.tessera.server.auth;

import java.time.Instant;

/**
 * A freshly minted token with its payload, so callers need no second verify.
 *
 * @param token     signed JWT string
 * @param payload   decoded payload
 * @param expiresAt token expiry
 * @param <T>       payload type
 */
public record GeneratedToken<T>(String token, T payload, Instant expiresAt) {

  @Override
  public String toString() {
    return "GeneratedToken[payload=" + payload + ", expiresAt=" + expiresAt + "]";
  }
}
