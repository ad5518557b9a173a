package com.codeheadsystems.tessera.server.manager;

import java.time.Instant;

/**
 * Emitted after a session transitions to revoked.
 *
 * @param sessionId session id
 * @param userId    owning user
 * @param reason    revocation reason
 * @param revokedAt revocation instant
 * @param ipAddress login address, may be null
 * @param userAgent login user agent, may be null
 */
public record SessionRevokedEvent(
    String sessionId,
    String userId,
    String reason,
    Instant revokedAt,
    String ipAddress,
    String userAgent) {
}
