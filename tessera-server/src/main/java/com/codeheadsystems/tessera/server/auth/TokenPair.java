package com.codeheadsystems.tessera.server.auth;

/**
 * Access and refresh token issued together.
 *
 * @param accessToken  the access token
 * @param refreshToken the refresh token
 */
public record TokenPair(
    GeneratedToken<AccessTokenClaims> accessToken,
    GeneratedToken<RefreshTokenClaims> refreshToken) {
}
