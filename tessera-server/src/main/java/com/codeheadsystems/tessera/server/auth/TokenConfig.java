package com.codeheadsystems.tessera.server.auth;

import com.codeheadsystems.tessera.server.exception.TokenConfigurationException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable configuration of the token lifecycle, validated at construction.
 * <p>
 * Any invalid value raises {@link TokenConfigurationException}; there is no per-request
 * configuration failure. Build with {@link #builder()}.
 *
 * @param accessSecret         HMAC-SHA256 signing secret for access tokens (at least 32 bytes)
 * @param refreshSecret        HMAC-SHA256 signing secret for refresh tokens (at least 32 bytes)
 * @param accessTtl            access-token lifetime (at least 60 seconds)
 * @param refreshTtl           refresh-token and session lifetime (at least 60 seconds)
 * @param issuer               JWT issuer claim
 * @param clockSkewLeeway      tolerated clock skew between issuing and verifying nodes
 * @param cleanupInterval      interval of the background cleanup job
 * @param disableCleanupJob    when true no background cleanup runs
 * @param revokeSessionOnReuse when true a reused refresh token revokes all of the user's sessions
 * @param fingerprintSecret    HMAC key for device fingerprints, or null to disable fingerprinting
 */
public record TokenConfig(
    byte[] accessSecret,
    byte[] refreshSecret,
    Duration accessTtl,
    Duration refreshTtl,
    String issuer,
    Duration clockSkewLeeway,
    Duration cleanupInterval,
    boolean disableCleanupJob,
    boolean revokeSessionOnReuse,
    byte[] fingerprintSecret) {

  public static final int MIN_SECRET_BYTES = 32;
  public static final Duration MIN_TTL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);
  public static final String DEFAULT_ISSUER = "tessera";

  public TokenConfig {
    requireSecret(accessSecret, "access");
    requireSecret(refreshSecret, "refresh");
    if (Arrays.equals(accessSecret, refreshSecret)) {
      throw new TokenConfigurationException("Access and refresh signing secrets must differ");
    }
    requireTtl(accessTtl, "access");
    requireTtl(refreshTtl, "refresh");
    if (refreshTtl.compareTo(accessTtl) < 0) {
      throw new TokenConfigurationException("Refresh TTL must not be shorter than access TTL");
    }
    if (issuer == null || issuer.isBlank()) {
      throw new TokenConfigurationException("Issuer must not be blank");
    }
    if (clockSkewLeeway == null || clockSkewLeeway.isNegative()) {
      throw new TokenConfigurationException("Clock skew leeway must be zero or positive");
    }
    if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
      throw new TokenConfigurationException("Cleanup interval must be positive");
    }
    if (fingerprintSecret != null) {
      requireSecret(fingerprintSecret, "fingerprint");
    }
    accessSecret = accessSecret.clone();
    refreshSecret = refreshSecret.clone();
    fingerprintSecret = fingerprintSecret == null ? null : fingerprintSecret.clone();
  }

  @Override
  public byte[] accessSecret() {
    return accessSecret.clone();
  }

  @Override
  public byte[] refreshSecret() {
    return refreshSecret.clone();
  }

  @Override
  public byte[] fingerprintSecret() {
    return fingerprintSecret == null ? null : fingerprintSecret.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TokenConfig other)) {
      return false;
    }
    return Arrays.equals(accessSecret, other.accessSecret)
        && Arrays.equals(refreshSecret, other.refreshSecret)
        && accessTtl.equals(other.accessTtl)
        && refreshTtl.equals(other.refreshTtl)
        && issuer.equals(other.issuer)
        && clockSkewLeeway.equals(other.clockSkewLeeway)
        && cleanupInterval.equals(other.cleanupInterval)
        && disableCleanupJob == other.disableCleanupJob
        && revokeSessionOnReuse == other.revokeSessionOnReuse
        && Arrays.equals(fingerprintSecret, other.fingerprintSecret);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(accessTtl, refreshTtl, issuer, clockSkewLeeway, cleanupInterval,
        disableCleanupJob, revokeSessionOnReuse);
    result = 31 * result + Arrays.hashCode(accessSecret);
    result = 31 * result + Arrays.hashCode(refreshSecret);
    return 31 * result + Arrays.hashCode(fingerprintSecret);
  }

  private static void requireSecret(byte[] secret, String name) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new TokenConfigurationException(
          "The " + name + " secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
  }

  private static void requireTtl(Duration ttl, String name) {
    if (ttl == null || ttl.compareTo(MIN_TTL) < 0) {
      throw new TokenConfigurationException(
          "The " + name + " TTL must be at least " + MIN_TTL.toSeconds() + " seconds");
    }
  }

  // Secrets stay out of logs.
  @Override
  public String toString() {
    return "TokenConfig[accessTtl=" + accessTtl
        + ", refreshTtl=" + refreshTtl
        + ", issuer=" + issuer
        + ", clockSkewLeeway=" + clockSkewLeeway
        + ", cleanupInterval=" + cleanupInterval
        + ", disableCleanupJob=" + disableCleanupJob
        + ", revokeSessionOnReuse=" + revokeSessionOnReuse
        + ", fingerprinting=" + (fingerprintSecret != null) + "]";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder with the defaults: 900 s access TTL, 14 day refresh TTL, 5 minute cleanup interval,
   * no leeway, cleanup enabled, reuse revocation off, fingerprinting off.
   */
  public static class Builder {

    private byte[] accessSecret;
    private byte[] refreshSecret;
    private Duration accessTtl = Duration.ofSeconds(900);
    private Duration refreshTtl = Duration.ofDays(14);
    private String issuer = DEFAULT_ISSUER;
    private Duration clockSkewLeeway = Duration.ZERO;
    private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
    private boolean disableCleanupJob;
    private boolean revokeSessionOnReuse;
    private byte[] fingerprintSecret;

    public Builder accessSecret(byte[] accessSecret) {
      this.accessSecret = accessSecret;
      return this;
    }

    public Builder refreshSecret(byte[] refreshSecret) {
      this.refreshSecret = refreshSecret;
      return this;
    }

    public Builder accessTtl(Duration accessTtl) {
      this.accessTtl = accessTtl;
      return this;
    }

    public Builder refreshTtl(Duration refreshTtl) {
      this.refreshTtl = refreshTtl;
      return this;
    }

    public Builder issuer(String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder clockSkewLeeway(Duration clockSkewLeeway) {
      this.clockSkewLeeway = clockSkewLeeway;
      return this;
    }

    public Builder cleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
      return this;
    }

    public Builder disableCleanupJob(boolean disableCleanupJob) {
      this.disableCleanupJob = disableCleanupJob;
      return this;
    }

    public Builder revokeSessionOnReuse(boolean revokeSessionOnReuse) {
      this.revokeSessionOnReuse = revokeSessionOnReuse;
      return this;
    }

    public Builder fingerprintSecret(byte[] fingerprintSecret) {
      this.fingerprintSecret = fingerprintSecret;
      return this;
    }

    public TokenConfig build() {
      return new TokenConfig(accessSecret, refreshSecret, accessTtl, refreshTtl, issuer,
          clockSkewLeeway, cleanupInterval, disableCleanupJob, revokeSessionOnReuse,
          fingerprintSecret);
    }
  }
}
