package com.codeheadsystems.tessera.server.store;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One authenticated device/browser context.
 *
 * @param id                opaque session id, stable for the session's lifetime
 * @param userId            owning user identifier
 * @param refreshSecretHash hex SHA-256 of the current refresh secret (never the raw secret)
 * @param createdAt         when the session was created
 * @param expiresAt         absolute expiry; the session is unusable past this point
 * @param revocation        revocation marker
 * @param fingerprint       device fingerprint, or null when no device metadata was supplied
 * @param ipAddress         client address at login, or null
 * @param userAgent         client user agent at login, or null
 */
public record SessionRecord(
    String id,
    String userId,
    String refreshSecretHash,
    Instant createdAt,
    Instant expiresAt,
    SessionRevocation revocation,
    String fingerprint,
    String ipAddress,
    String userAgent) {

  public SessionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(refreshSecretHash, "refreshSecretHash");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    Objects.requireNonNull(revocation, "revocation");
  }

  /**
   * State of this session at the given instant. Revocation wins over expiry.
   *
   * @param now the instant to evaluate against
   * @return the state
   */
  public SessionState state(Instant now) {
    if (revocation.isRevoked()) {
      return SessionState.REVOKED;
    }
    if (!expiresAt.isAfter(now)) {
      return SessionState.EXPIRED;
    }
    return SessionState.ACTIVE;
  }

  /**
   * Active iff not revoked and {@code expiresAt} is in the future.
   *
   * @param now the instant to evaluate against
   * @return true if active
   */
  public boolean isActive(Instant now) {
    return state(now) == SessionState.ACTIVE;
  }

  public Optional<String> fingerprintValue() {
    return Optional.ofNullable(fingerprint);
  }

  public SessionRecord withRefreshSecret(String newHash, Instant newExpiresAt) {
    return new SessionRecord(id, userId, newHash, createdAt, newExpiresAt, revocation,
        fingerprint, ipAddress, userAgent);
  }

  public SessionRecord withRevocation(SessionRevocation.Revoked newRevocation) {
    return new SessionRecord(id, userId, refreshSecretHash, createdAt, expiresAt, newRevocation,
        fingerprint, ipAddress, userAgent);
  }
}
