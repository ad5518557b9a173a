package com.codeheadsystems.tessera.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tessera.server.blacklist.TokenBlacklist;
import com.codeheadsystems.tessera.server.claims.ClaimsProvider;
import com.codeheadsystems.tessera.server.claims.UserClaims;
import com.codeheadsystems.tessera.server.exception.RejectionReason;
import com.codeheadsystems.tessera.server.exception.TransientStoreException;
import com.codeheadsystems.tessera.server.exception.UnauthorizedException;
import com.codeheadsystems.tessera.server.manager.CreatedSession;
import com.codeheadsystems.tessera.server.manager.SessionService;
import com.codeheadsystems.tessera.server.store.SessionRecord;
import com.codeheadsystems.tessera.server.store.UserRecord;
import com.codeheadsystems.tessera.server.store.UserStore;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints, verifies and rotates access/refresh JWT pairs.
 * <p>
 * Both token classes are signed with HMAC-SHA256 under their own secret and carry a {@code type}
 * claim, so neither can stand in for the other. The service holds no durable state: sessions live
 * behind the {@link SessionService}, revoked token ids in the {@link TokenBlacklist}.
 * <p>
 * A refresh token is single-use. Rotation swaps the session's refresh secret hash with a
 * compare-and-swap and then blacklists the old jti; a replayed token fails the blacklist check,
 * and if the blacklist write was lost it still fails the secret check. Of two concurrent rotations
 * of the same token exactly one wins the swap.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link UnauthorizedException}: any token-trust failure, one message for all causes (401)</li>
 *   <li>{@link TransientStoreException}: a store, blacklist or claims lookup failed (503)</li>
 * </ul>
 */
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  static final String CLAIM_TYPE = "type";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_SESSION_ID = "sessionId";
  static final String CLAIM_ROLE_IDS = "roleIds";
  static final String CLAIM_PERMISSIONS = "permissions";
  static final String CLAIM_REFRESH_SECRET = "secret";
  static final String TYPE_ACCESS = "access";
  static final String TYPE_REFRESH = "refresh";

  public static final String REASON_REUSE = "refresh_token_reuse_detected";

  private final TokenConfig config;
  private final SessionService sessionService;
  private final UserStore userStore;
  private final ClaimsProvider claimsProvider;
  private final TokenBlacklist blacklist;
  private final RefreshSecrets refreshSecrets;
  private final TokenMetrics metrics;
  private final Algorithm accessAlgorithm;
  private final Algorithm refreshAlgorithm;
  private final JWTVerifier accessVerifier;
  private final JWTVerifier refreshVerifier;
  private final ScheduledExecutorService cleanupJob;

  /**
   * Creates a new TokenService and, unless {@link TokenConfig#disableCleanupJob()} is set, starts
   * the background cleanup job. Call {@link #shutdown()} to stop it.
   *
   * @param config         validated configuration
   * @param sessionService session lifecycle and clock
   * @param userStore      user lookup
   * @param claimsProvider role/permission source, queried on every mint
   * @param blacklist      revoked token ids
   * @param metrics        lifecycle counters
   */
  public TokenService(TokenConfig config,
                      SessionService sessionService,
                      UserStore userStore,
                      ClaimsProvider claimsProvider,
                      TokenBlacklist blacklist,
                      TokenMetrics metrics) {
    this.config = config;
    this.sessionService = sessionService;
    this.userStore = userStore;
    this.claimsProvider = claimsProvider;
    this.blacklist = blacklist;
    this.refreshSecrets = sessionService.refreshSecrets();
    this.metrics = metrics;
    this.accessAlgorithm = Algorithm.HMAC256(config.accessSecret());
    this.refreshAlgorithm = Algorithm.HMAC256(config.refreshSecret());
    this.accessVerifier = buildVerifier(accessAlgorithm, TYPE_ACCESS);
    this.refreshVerifier = buildVerifier(refreshAlgorithm, TYPE_REFRESH);

    if (config.disableCleanupJob()) {
      this.cleanupJob = null;
    } else {
      this.cleanupJob = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "token-cleanup");
        t.setDaemon(true);
        return t;
      });
      long intervalMillis = config.cleanupInterval().toMillis();
      cleanupJob.scheduleAtFixedRate(this::runScheduledCleanup,
          intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
      log.debug("Token cleanup job scheduled every {}", config.cleanupInterval());
    }
  }

  private JWTVerifier buildVerifier(Algorithm algorithm, String type) {
    JWTVerifier.BaseVerification verification = (JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(config.issuer())
        .withClaim(CLAIM_TYPE, type)
        .acceptLeeway(config.clockSkewLeeway().toSeconds());
    return verification.build(sessionService.clock());
  }

  // ── Minting ───────────────────────────────────────────────────────────────

  /**
   * Mints an access token embedding the user's current roles and permissions.
   *
   * @param user    the user
   * @param session an active session of the user
   * @return the signed token and its payload
   * @throws TransientStoreException if the claims provider fails (minting fails closed)
   */
  public GeneratedToken<AccessTokenClaims> generateAccessToken(UserRecord user, SessionRecord session) {
    return mintAccess(user, session, loadClaims(user.id()));
  }

  /**
   * Mints a refresh token carrying a fresh secret. The caller must store the hash of
   * {@link RefreshTokenClaims#refreshSecret()} on the session for the token to verify.
   *
   * @param user    the user
   * @param session the session
   * @return the signed token and its payload
   */
  public GeneratedToken<RefreshTokenClaims> generateRefreshToken(UserRecord user, SessionRecord session) {
    return generateRefreshToken(user, session, refreshSecrets.generate());
  }

  /**
   * Mints a refresh token carrying the given secret.
   *
   * @param user          the user
   * @param session       the session
   * @param refreshSecret plaintext secret whose hash is (or will be) on the session
   * @return the signed token and its payload
   */
  public GeneratedToken<RefreshTokenClaims> generateRefreshToken(UserRecord user, SessionRecord session,
                                                                 String refreshSecret) {
    return mintRefresh(user, session, loadClaims(user.id()), refreshSecret);
  }

  /**
   * Login path: mints the first pair for a session just created by
   * {@link SessionService#createSession}.
   *
   * @param user    the authenticated user
   * @param created the new session and its plaintext refresh secret
   * @return the pair
   * @throws UnauthorizedException if the user is not active
   */
  public TokenPair issueTokens(UserRecord user, CreatedSession created) {
    if (!user.isActive()) {
      log.debug("Refusing to issue tokens for inactive user id={}", user.id());
      throw new UnauthorizedException(RejectionReason.USER_INACTIVE);
    }
    UserClaims claims = loadClaims(user.id());
    SessionRecord session = created.session();
    TokenPair pair = new TokenPair(
        mintAccess(user, session, claims),
        mintRefresh(user, session, claims, created.refreshSecret()));
    log.debug("Issued token pair for session id={} accessJti={} refreshJti={}",
        session.id(), pair.accessToken().payload().jti(), pair.refreshToken().payload().jti());
    return pair;
  }

  private GeneratedToken<AccessTokenClaims> mintAccess(UserRecord user, SessionRecord session,
                                                       UserClaims claims) {
    Instant now = sessionService.now().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(config.accessTtl());
    String jti = UUID.randomUUID().toString();
    List<String> roleIds = claims.roleIds();

    String token = JWT.create()
        .withIssuer(config.issuer())
        .withJWTId(jti)
        .withSubject(user.id())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .withClaim(CLAIM_TYPE, TYPE_ACCESS)
        .withClaim(CLAIM_EMAIL, user.email())
        .withClaim(CLAIM_SESSION_ID, session.id())
        .withClaim(CLAIM_ROLE_IDS, roleIds)
        .withClaim(CLAIM_PERMISSIONS, claims.permissions())
        .sign(accessAlgorithm);

    AccessTokenClaims payload = new AccessTokenClaims(user.id(), user.email(), session.id(),
        roleIds, claims.permissions(), jti, now, expiresAt);
    return new GeneratedToken<>(token, payload, expiresAt);
  }

  private GeneratedToken<RefreshTokenClaims> mintRefresh(UserRecord user, SessionRecord session,
                                                         UserClaims claims, String refreshSecret) {
    Instant now = sessionService.now().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(config.refreshTtl());
    String jti = UUID.randomUUID().toString();
    List<String> roleIds = claims.roleIds();

    String token = JWT.create()
        .withIssuer(config.issuer())
        .withJWTId(jti)
        .withSubject(user.id())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .withClaim(CLAIM_TYPE, TYPE_REFRESH)
        .withClaim(CLAIM_SESSION_ID, session.id())
        .withClaim(CLAIM_ROLE_IDS, roleIds)
        .withClaim(CLAIM_PERMISSIONS, claims.permissions())
        .withClaim(CLAIM_REFRESH_SECRET, refreshSecret)
        .sign(refreshAlgorithm);

    RefreshTokenClaims payload = new RefreshTokenClaims(user.id(), session.id(), roleIds,
        claims.permissions(), jti, now, expiresAt, refreshSecret);
    return new GeneratedToken<>(token, payload, expiresAt);
  }

  private UserClaims loadClaims(String userId) {
    try {
      return UserClaims.load(claimsProvider, userId);
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new TransientStoreException("Claims provider returned invalid claims", e);
    }
  }

  // ── Verification ──────────────────────────────────────────────────────────

  /**
   * Verifies signature, expiry, blacklist membership and session liveness.
   *
   * @param token the access token
   * @return the decoded payload
   * @throws UnauthorizedException on any failure
   */
  public AccessTokenClaims verifyAccessToken(String token) {
    try {
      AccessTokenClaims payload = decodeAccess(token);
      ensureNotBlacklisted(payload.jti());
      sessionService.requireActiveSession(payload.sessionId(), payload.subject());
      return payload;
    } catch (UnauthorizedException e) {
      metrics.verifyRejected(e.reason());
      log.debug("Access token rejected: {}", e.reason());
      throw e;
    }
  }

  /**
   * Verifies signature, expiry, blacklist membership, session liveness, and that the token's
   * secret hashes to the session's current refresh secret hash.
   *
   * @param token the refresh token
   * @return the payload and the session as loaded
   * @throws UnauthorizedException on any failure, with the same message for every cause
   */
  public VerifiedRefreshToken verifyRefreshToken(String token) {
    try {
      return doVerifyRefresh(token);
    } catch (UnauthorizedException e) {
      metrics.refreshRejected(e.reason());
      log.debug("Refresh token rejected: {}", e.reason());
      throw e;
    }
  }

  private VerifiedRefreshToken doVerifyRefresh(String token) {
    RefreshTokenClaims payload = decodeRefresh(token);
    ensureNotBlacklisted(payload.jti());
    SessionRecord session = sessionService.requireActiveSession(payload.sessionId(), payload.subject());
    if (!refreshSecrets.matches(payload.refreshSecret(), session.refreshSecretHash())) {
      handleReuse(payload, session);
      throw new UnauthorizedException(RejectionReason.SECRET_MISMATCH);
    }
    return new VerifiedRefreshToken(payload, session);
  }

  // A validly signed, unexpired, non-blacklisted token whose secret is stale: either it was
  // already rotated and the blacklist write was lost, or it lost a concurrent rotation.
  private void handleReuse(RefreshTokenClaims payload, SessionRecord session) {
    metrics.replayDetected();
    log.warn("Refresh token reuse detected sessionId={} userId={} jti={}",
        session.id(), session.userId(), payload.jti());
    if (!config.revokeSessionOnReuse()) {
      return;
    }
    try {
      sessionService.revokeSession(session.id(), REASON_REUSE);
      int revoked = sessionService.revokeAllUserSessions(session.userId(), REASON_REUSE);
      metrics.sessionsRevoked(revoked + 1L);
      blacklist.add(payload.jti(), payload.expiresAt());
    } catch (TransientStoreException e) {
      log.error("Failed to revoke sessions after refresh token reuse sessionId={}", session.id(), e);
      UnauthorizedException rejection = new UnauthorizedException(RejectionReason.SECRET_MISMATCH);
      rejection.addSuppressed(e);
      throw rejection;
    }
  }

  private void ensureNotBlacklisted(String jti) {
    if (blacklist.has(jti)) {
      throw new UnauthorizedException(RejectionReason.BLACKLISTED);
    }
  }

  private AccessTokenClaims decodeAccess(String token) {
    DecodedJWT decoded = verify(accessVerifier, token);
    String email = decoded.getClaim(CLAIM_EMAIL).asString();
    String sessionId = decoded.getClaim(CLAIM_SESSION_ID).asString();
    List<String> roleIds = stringList(decoded.getClaim(CLAIM_ROLE_IDS));
    List<String> permissions = stringList(decoded.getClaim(CLAIM_PERMISSIONS));
    if (decoded.getSubject() == null || decoded.getId() == null || email == null
        || sessionId == null || roleIds == null || permissions == null
        || decoded.getIssuedAtAsInstant() == null) {
      throw new UnauthorizedException(RejectionReason.MALFORMED);
    }
    return new AccessTokenClaims(decoded.getSubject(), email, sessionId, roleIds, permissions,
        decoded.getId(), decoded.getIssuedAtAsInstant(), decoded.getExpiresAtAsInstant());
  }

  private RefreshTokenClaims decodeRefresh(String token) {
    DecodedJWT decoded = verify(refreshVerifier, token);
    String sessionId = decoded.getClaim(CLAIM_SESSION_ID).asString();
    String secret = decoded.getClaim(CLAIM_REFRESH_SECRET).asString();
    List<String> roleIds = stringList(decoded.getClaim(CLAIM_ROLE_IDS));
    List<String> permissions = stringList(decoded.getClaim(CLAIM_PERMISSIONS));
    if (decoded.getSubject() == null || decoded.getId() == null || sessionId == null
        || secret == null || roleIds == null || permissions == null
        || decoded.getIssuedAtAsInstant() == null) {
      throw new UnauthorizedException(RejectionReason.MALFORMED);
    }
    return new RefreshTokenClaims(decoded.getSubject(), sessionId, roleIds, permissions,
        decoded.getId(), decoded.getIssuedAtAsInstant(), decoded.getExpiresAtAsInstant(), secret);
  }

  private static DecodedJWT verify(JWTVerifier verifier, String token) {
    if (token == null || token.isBlank()) {
      throw new UnauthorizedException(RejectionReason.MALFORMED);
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      if (decoded.getExpiresAtAsInstant() == null) {
        throw new UnauthorizedException(RejectionReason.MALFORMED);
      }
      return decoded;
    } catch (TokenExpiredException e) {
      throw new UnauthorizedException(RejectionReason.EXPIRED);
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      throw new UnauthorizedException(RejectionReason.INVALID_SIGNATURE);
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      throw new UnauthorizedException(RejectionReason.MALFORMED);
    }
  }

  private static List<String> stringList(Claim claim) {
    if (claim.isMissing() || claim.isNull()) {
      return null;
    }
    try {
      return claim.asList(String.class);
    } catch (JWTVerificationException e) {
      return null;
    }
  }

  // ── Rotation ──────────────────────────────────────────────────────────────

  /**
   * Exchanges a refresh token for a new access/refresh pair and invalidates the old one.
   * <ol>
   *   <li>verify the old token fully</li>
   *   <li>mint a new access token and a new refresh token with a new secret</li>
   *   <li>compare-and-swap the session's secret hash from the old value to the new one</li>
   *   <li>blacklist the old jti until its original expiry</li>
   * </ol>
   * Losing the swap in step 3 to a concurrent rotation fails with the same error as a replay. A
   * blacklist failure in step 4 is logged and does not fail the rotation, since the old token's
   * secret no longer matches.
   *
   * @param oldRefreshToken the presented refresh token
   * @return the new pair
   * @throws UnauthorizedException if the old token is not valid or lost a concurrent rotation
   */
  public TokenPair rotateRefreshToken(String oldRefreshToken) {
    VerifiedRefreshToken verified = verifyRefreshToken(oldRefreshToken);
    RefreshTokenClaims oldPayload = verified.payload();
    SessionRecord session = verified.session();

    UserRecord user;
    try {
      user = loadActiveUser(oldPayload.subject());
    } catch (UnauthorizedException e) {
      metrics.refreshRejected(e.reason());
      throw e;
    }
    UserClaims claims = loadClaims(user.id());
    String newSecret = refreshSecrets.generate();
    GeneratedToken<RefreshTokenClaims> newRefresh = mintRefresh(user, session, claims, newSecret);
    GeneratedToken<AccessTokenClaims> newAccess = mintAccess(user, session, claims);

    boolean swapped = sessionService.rotateRefreshSecret(session.id(), session.refreshSecretHash(),
        refreshSecrets.hash(newSecret), newRefresh.expiresAt());
    if (!swapped) {
      metrics.refreshRejected(RejectionReason.ROTATION_CONFLICT);
      log.warn("Refresh token rotation lost a concurrent update sessionId={} jti={}",
          session.id(), oldPayload.jti());
      throw new UnauthorizedException(RejectionReason.ROTATION_CONFLICT);
    }

    try {
      blacklist.add(oldPayload.jti(), oldPayload.expiresAt());
    } catch (RuntimeException e) {
      metrics.blacklistWriteFailed();
      log.error("Failed to blacklist rotated refresh token jti={} sessionId={}; "
          + "the secret-hash check still rejects it", oldPayload.jti(), session.id(), e);
    }

    metrics.refreshSucceeded();
    log.info("Refresh token rotated sessionId={} userId={} previousJti={} nextJti={}",
        session.id(), session.userId(), oldPayload.jti(), newRefresh.payload().jti());
    return new TokenPair(newAccess, newRefresh);
  }

  // ── Revocation ────────────────────────────────────────────────────────────

  /**
   * Revokes the session. Tokens already minted for it fail their next verification through the
   * session-liveness check. Idempotent.
   *
   * @param sessionId session id
   * @param reason    revocation reason
   * @throws TransientStoreException if the store failed; logged and rethrown
   */
  public void revokeToken(String sessionId, String reason) {
    try {
      if (sessionService.revokeSession(sessionId, reason)) {
        metrics.sessionsRevoked(1);
      }
    } catch (TransientStoreException e) {
      log.error("Failed to revoke session id={} reason={}", sessionId, reason, e);
      throw e;
    }
  }

  public void revokeToken(String sessionId) {
    revokeToken(sessionId, SessionService.REASON_MANUAL);
  }

  // ── Request context ───────────────────────────────────────────────────────

  /**
   * Resolves the user behind a verified access token with current roles and permissions.
   *
   * @param accessToken a payload returned by {@link #verifyAccessToken}
   * @return the authenticated user
   * @throws UnauthorizedException if the user is missing or not active
   */
  public AuthenticatedUser fetchAuthenticatedUser(AccessTokenClaims accessToken) {
    UserRecord user = loadActiveUser(accessToken.subject());
    UserClaims claims = loadClaims(user.id());
    return new AuthenticatedUser(user.id(), user.email(), claims.roles(), claims.permissions(),
        accessToken.sessionId(), accessToken);
  }

  private UserRecord loadActiveUser(String userId) {
    UserRecord user = userStore.findUserById(userId)
        .orElseThrow(() -> new UnauthorizedException(RejectionReason.USER_NOT_FOUND));
    if (!user.isActive()) {
      throw new UnauthorizedException(RejectionReason.USER_INACTIVE);
    }
    return user;
  }

  // ── Cleanup ───────────────────────────────────────────────────────────────

  /**
   * Marks expired sessions and prunes expired blacklist entries. Runs on the background job and
   * may be called directly.
   *
   * @return number of sessions marked expired
   */
  public int cleanupExpired() {
    int expired = sessionService.cleanupExpiredSessions();
    if (expired > 0) {
      log.info("Revoked expired authentication sessions count={}", expired);
    }
    blacklist.cleanup();
    return expired;
  }

  // Runs on the cleanup thread; an escaping exception would cancel the schedule.
  private void runScheduledCleanup() {
    try {
      cleanupExpired();
    } catch (RuntimeException e) {
      log.error("Token cleanup job failed", e);
    }
  }

  public boolean isCleanupJobRunning() {
    return cleanupJob != null && !cleanupJob.isShutdown();
  }

  /**
   * Stops the cleanup job and shuts the blacklist down.
   * <p>
   * In Dropwizard this is driven by a {@code Managed} component.
   */
  public void shutdown() {
    if (cleanupJob != null) {
      cleanupJob.shutdownNow();
    }
    blacklist.shutdown();
  }
}
