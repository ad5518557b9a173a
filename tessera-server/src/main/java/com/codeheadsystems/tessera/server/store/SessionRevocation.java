package com.codeheadsystems.tessera.server.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Revocation marker of a session: either not revoked, or revoked at a given instant.
 * Once a session is {@link Revoked} it never returns to {@link NotRevoked}.
 */
public sealed interface SessionRevocation permits SessionRevocation.NotRevoked, SessionRevocation.Revoked {

  /**
   * The shared not-revoked marker.
   */
  NotRevoked NOT_REVOKED = new NotRevoked();

  /**
   * Revoked sessions are permanently dead.
   *
   * @return true if revoked
   */
  boolean isRevoked();

  /**
   * Session has not been revoked.
   */
  record NotRevoked() implements SessionRevocation {

    @Override
    public boolean isRevoked() {
      return false;
    }
  }

  /**
   * Session was revoked.
   *
   * @param revokedAt when
   * @param reason    why, for audit logs
   */
  record Revoked(Instant revokedAt, String reason) implements SessionRevocation {

    public Revoked {
      Objects.requireNonNull(revokedAt, "revokedAt");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean isRevoked() {
      return true;
    }
  }
}
