package com.codeheadsystems.tessera.server.auth;

import com.codeheadsystems.tessera.server.store.SessionRecord;

/**
 * Result of a successful refresh-token verification.
 *
 * @param payload decoded refresh token
 * @param session the session as loaded during verification
 */
public record VerifiedRefreshToken(RefreshTokenClaims payload, SessionRecord session) {
}
