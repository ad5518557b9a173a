package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.store.SessionRecord;

/**
 * A newly created session and the plaintext refresh secret to embed in its first refresh token.
 * The secret is not stored anywhere; only its hash is on the session.
 *
 * @param session       the stored session
 * @param refreshSecret plaintext refresh secret
 */
public record CreatedSession(SessionRecord session, String refreshSecret) {

  @Override
  public String toString() {
    return "CreatedSession[session=" + session + "]";
  }
}
