package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.auth.RefreshSecrets;
import com.codeheadsystems.tessera.server.auth.TokenConfig;
import com.codeheadsystems.tessera.server.exception.NotFoundException;
import com.codeheadsystems.tessera.server.exception.RejectionReason;
import com.codeheadsystems.tessera.server.exception.UnauthorizedException;
import com.codeheadsystems.tessera.server.store.SessionRecord;
import com.codeheadsystems.tessera.server.store.SessionRevocation;
import com.codeheadsystems.tessera.server.store.SessionState;
import com.codeheadsystems.tessera.server.store.SessionStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, validates and terminates session rows, and owns the clock every expiry decision uses.
 * <p>
 * The token service never touches the {@link SessionStore} directly; it goes through this class
 * so that all session mutations are logged and notified in one place.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link UnauthorizedException} for a session that cannot back a token (absent, revoked,
 *       expired, owned by another user)</li>
 *   <li>{@link NotFoundException} from {@link #getSession} when the row is absent</li>
 *   <li>{@link com.codeheadsystems.tessera.server.exception.TransientStoreException} from the
 *       store, propagated unchanged</li>
 * </ul>
 */
public class SessionService {

  private static final Logger log = LoggerFactory.getLogger(SessionService.class);

  public static final String REASON_MANUAL = "manual_revocation";
  public static final String REASON_EXPIRED = "session_expired";

  private final SessionStore sessionStore;
  private final Clock clock;
  private final Duration sessionTtl;
  private final RefreshSecrets refreshSecrets;
  private final DeviceFingerprinter fingerprinter;
  private final SessionSecurityNotifier notifier;

  /**
   * Creates a session service from the token configuration with no notifier.
   *
   * @param sessionStore backing store
   * @param config       token configuration (refresh TTL and fingerprint secret are used)
   * @param clock        time source
   */
  public SessionService(SessionStore sessionStore, TokenConfig config, Clock clock) {
    this(sessionStore, clock, config.refreshTtl(), new RefreshSecrets(new SecureRandom()),
        new DeviceFingerprinter(config.fingerprintSecret()), SessionSecurityNotifier.NO_OP);
  }

  /**
   * Instantiates a new Session service.
   *
   * @param sessionStore   backing store
   * @param clock          time source
   * @param sessionTtl     lifetime of a new session
   * @param refreshSecrets refresh secret generator and hasher
   * @param fingerprinter  device fingerprinter
   * @param notifier       security event hook
   */
  public SessionService(SessionStore sessionStore,
                        Clock clock,
                        Duration sessionTtl,
                        RefreshSecrets refreshSecrets,
                        DeviceFingerprinter fingerprinter,
                        SessionSecurityNotifier notifier) {
    this.sessionStore = sessionStore;
    this.clock = clock;
    this.sessionTtl = sessionTtl;
    this.refreshSecrets = refreshSecrets;
    this.fingerprinter = fingerprinter;
    this.notifier = notifier;
  }

  public Instant now() {
    return clock.instant();
  }

  public Clock clock() {
    return clock;
  }

  public RefreshSecrets refreshSecrets() {
    return refreshSecrets;
  }

  /**
   * Inserts a new session with a fresh refresh secret.
   *
   * @param userId owning user
   * @param device device metadata for the fingerprint, may be null
   * @return the session and the plaintext secret for the first refresh token
   */
  public CreatedSession createSession(String userId, DeviceMetadata device) {
    Instant now = now();
    String refreshSecret = refreshSecrets.generate();
    String fingerprint = fingerprinter.fingerprint(device);
    SessionRecord session = new SessionRecord(
        UUID.randomUUID().toString(),
        userId,
        refreshSecrets.hash(refreshSecret),
        now,
        now.plus(sessionTtl),
        SessionRevocation.NOT_REVOKED,
        fingerprint,
        device == null ? null : device.ipAddress(),
        device == null ? null : device.userAgent());
    sessionStore.create(session);
    log.info("Created authentication session id={} userId={} hasFingerprint={} expiresAt={}",
        session.id(), userId, fingerprint != null, session.expiresAt());
    return new CreatedSession(session, refreshSecret);
  }

  /**
   * Direct lookup.
   *
   * @param sessionId session id
   * @return the session in whatever state it is
   * @throws NotFoundException if absent
   */
  public SessionRecord getSession(String sessionId) {
    return sessionStore.findById(sessionId)
        .orElseThrow(() -> new NotFoundException("Session not found"));
  }

  /**
   * Loads a session that can back a token right now.
   *
   * @param sessionId      session id
   * @param expectedUserId the token subject, or null to skip the ownership check
   * @return the active session
   * @throws UnauthorizedException if absent, revoked, expired or owned by another user
   */
  public SessionRecord requireActiveSession(String sessionId, String expectedUserId) {
    Optional<SessionRecord> loaded = sessionStore.findById(sessionId);
    if (loaded.isEmpty()) {
      throw new UnauthorizedException(RejectionReason.SESSION_NOT_FOUND);
    }
    SessionRecord session = loaded.get();
    if (expectedUserId != null && !session.userId().equals(expectedUserId)) {
      throw new UnauthorizedException(RejectionReason.SESSION_USER_MISMATCH);
    }
    SessionState state = session.state(now());
    if (state == SessionState.REVOKED) {
      throw new UnauthorizedException(RejectionReason.SESSION_REVOKED);
    }
    if (state == SessionState.EXPIRED) {
      throw new UnauthorizedException(RejectionReason.SESSION_EXPIRED);
    }
    return session;
  }

  /**
   * Like {@link #requireActiveSession} and additionally compares the presenting device against
   * the fingerprint recorded at login. A mismatch is logged and reported to the notifier but does
   * not fail validation.
   *
   * @param sessionId      session id
   * @param expectedUserId the token subject, or null to skip the ownership check
   * @param device         presenting device, may be null
   * @return the active session
   */
  public SessionRecord validateSession(String sessionId, String expectedUserId,
                                       DeviceMetadata device) {
    SessionRecord session = requireActiveSession(sessionId, expectedUserId);
    String presented = fingerprinter.fingerprint(device);
    if (presented != null && session.fingerprint() != null
        && !MessageDigest.isEqual(presented.getBytes(StandardCharsets.US_ASCII),
        session.fingerprint().getBytes(StandardCharsets.US_ASCII))) {
      log.warn("Session fingerprint mismatch detected sessionId={} userId={} ipAddress={}",
          session.id(), session.userId(), device.ipAddress());
      notifier.fingerprintMismatch(session, presented, device);
    }
    return session;
  }

  /**
   * Atomically replaces the session's refresh secret hash if it still equals the expected one.
   * The session's expiry slides to {@code newExpiresAt}.
   *
   * @param sessionId    session id
   * @param expectedHash the hash the caller verified against
   * @param newHash      the replacement hash
   * @param newExpiresAt the replacement expiry
   * @return true if this call won the swap
   */
  public boolean rotateRefreshSecret(String sessionId, String expectedHash, String newHash,
                                     Instant newExpiresAt) {
    return sessionStore.compareAndSetRefreshSecret(sessionId, expectedHash, newHash, newExpiresAt);
  }

  /**
   * Revokes a session. Idempotent: revoking an absent or already revoked session is a no-op.
   *
   * @param sessionId session id
   * @param reason    revocation reason for the audit log
   * @return true if this call revoked the session
   */
  public boolean revokeSession(String sessionId, String reason) {
    Optional<SessionRecord> loaded = sessionStore.findById(sessionId);
    if (loaded.isEmpty()) {
      log.warn("Attempted to revoke session that does not exist id={} reason={}", sessionId, reason);
      return false;
    }
    SessionRecord session = loaded.get();
    if (session.revocation().isRevoked()) {
      log.debug("Authentication session already revoked id={} reason={}", sessionId, reason);
      return false;
    }
    SessionRevocation.Revoked revocation = new SessionRevocation.Revoked(now(), reason);
    if (!sessionStore.revoke(sessionId, revocation)) {
      log.debug("Authentication session revoked concurrently id={}", sessionId);
      return false;
    }
    log.info("Authentication session revoked id={} userId={} reason={}",
        sessionId, session.userId(), reason);
    notifier.sessionRevoked(new SessionRevokedEvent(sessionId, session.userId(), reason,
        revocation.revokedAt(), session.ipAddress(), session.userAgent()));
    return true;
  }

  /**
   * Revokes every live session of the user.
   *
   * @param userId user id
   * @param reason revocation reason
   * @return number of sessions revoked
   */
  public int revokeAllUserSessions(String userId, String reason) {
    int count = sessionStore.revokeAllForUser(userId,
        new SessionRevocation.Revoked(now(), reason));
    if (count > 0) {
      log.info("Revoked active sessions for user userId={} count={} reason={}", userId, count, reason);
    } else {
      log.debug("No active sessions found for user userId={} reason={}", userId, reason);
    }
    return count;
  }

  /**
   * Sessions of the user that are active now.
   *
   * @param userId user id
   * @return active sessions
   */
  public List<SessionRecord> listActiveSessions(String userId) {
    Instant now = now();
    return sessionStore.findByUserId(userId).stream()
        .filter(s -> s.isActive(now))
        .toList();
  }

  /**
   * Marks sessions past their expiry as revoked. Verification already treats them as dead; this
   * only keeps the store tidy.
   *
   * @return number of sessions marked
   */
  public int cleanupExpiredSessions() {
    Instant now = now();
    return sessionStore.revokeExpired(now, new SessionRevocation.Revoked(now, REASON_EXPIRED));
  }
}
