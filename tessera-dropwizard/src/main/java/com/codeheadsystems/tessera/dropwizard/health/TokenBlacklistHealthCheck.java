package com.codeheadsystems.tessera.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.server.blacklist.TokenBlacklist;

/**
 * Health check that verifies the token blacklist answers a membership query.
 * Without it no refresh token can be verified.
 */
public class TokenBlacklistHealthCheck extends HealthCheck {

  static final String PROBE_JTI = "tessera-health-probe";

  private final TokenBlacklist blacklist;

  /**
   * Instantiates a new Token blacklist health check.
   *
   * @param blacklist the blacklist
   */
  public TokenBlacklistHealthCheck(TokenBlacklist blacklist) {
    this.blacklist = blacklist;
  }

  @Override
  protected Result check() {
    try {
      blacklist.has(PROBE_JTI);
    } catch (RuntimeException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("blacklist=%s", blacklist.getClass().getSimpleName());
  }
}
