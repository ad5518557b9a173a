package com.codeheadsystems.tessera.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for authentication sessions.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back this with a
 * relational table holding one row per session. Every mutation touches a single row; the only
 * concurrency primitive required is the compare-and-swap in {@link #compareAndSetRefreshSecret}.
 * <p>
 * Implementations signal absent rows with empty results or {@code false}, never with a
 * store-specific exception. I/O failures should be raised as
 * {@link com.codeheadsystems.tessera.server.exception.TransientStoreException}.
 */
public interface SessionStore {

  /**
   * Inserts a new session row.
   *
   * @param session the session to insert
   * @throws IllegalArgumentException if a session with the same id already exists
   */
  void create(SessionRecord session);

  /**
   * Loads a session by id.
   *
   * @param sessionId session id
   * @return the session, or empty if absent
   */
  Optional<SessionRecord> findById(String sessionId);

  /**
   * Lists every session (any state) owned by the user.
   *
   * @param userId user id
   * @return the sessions, possibly empty
   */
  List<SessionRecord> findByUserId(String userId);

  /**
   * Atomically replaces the refresh secret hash and expiry, but only if the stored hash still
   * equals {@code expectedHash} and the session is not revoked.
   *
   * @param sessionId    session id
   * @param expectedHash hash the caller verified against
   * @param newHash      replacement hash
   * @param newExpiresAt replacement expiry
   * @return true if this call performed the swap; false if the row is absent, revoked, or the
   *     hash has already moved on
   */
  boolean compareAndSetRefreshSecret(String sessionId, String expectedHash, String newHash,
                                     Instant newExpiresAt);

  /**
   * Marks a session revoked if it is not already.
   *
   * @param sessionId  session id
   * @param revocation the revocation marker to set
   * @return true if this call revoked the session; false if absent or already revoked
   */
  boolean revoke(String sessionId, SessionRevocation.Revoked revocation);

  /**
   * Revokes every not-yet-revoked session of the user.
   *
   * @param userId     user id
   * @param revocation the revocation marker to set
   * @return number of sessions revoked by this call
   */
  int revokeAllForUser(String userId, SessionRevocation.Revoked revocation);

  /**
   * Revokes every not-yet-revoked session whose {@code expiresAt} is not after {@code now}.
   *
   * @param now        cutoff
   * @param revocation the revocation marker to set
   * @return number of sessions revoked by this call
   */
  int revokeExpired(Instant now, SessionRevocation.Revoked revocation);
}
