package com.codeheadsystems.tessera.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the tessera token lifecycle.
 * <p>
 * For production, supply {@code accessSecretHex} and {@code refreshSecretHex} (two different
 * hex-encoded random values of at least 32 bytes) so tokens survive restarts, and a
 * {@code redisAddress} so the blacklist is shared across nodes.
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class TesseraConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for access tokens, at least 32 bytes.
   * Leave empty for random generation (dev only: tokens become invalid on restart).
   */
  private String accessSecretHex = "";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for refresh tokens, at least 32 bytes and different
   * from the access secret. Leave empty for random generation (dev only).
   */
  private String refreshSecretHex = "";

  /**
   * Access token time-to-live in seconds.
   */
  @Min(60)
  private long accessTtlSeconds = 900;

  /**
   * Refresh token and session time-to-live in seconds.
   */
  @Min(60)
  private long refreshTtlSeconds = 1_209_600;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String issuer = "tessera";

  /**
   * Tolerated clock skew between issuing and verifying nodes, in seconds.
   */
  @Min(0)
  private long clockSkewLeewaySeconds = 0;

  /**
   * Interval of the expired-session and blacklist cleanup job, in seconds.
   */
  @Min(1)
  private long cleanupIntervalSeconds = 300;

  /**
   * Disables the background cleanup job. Verification is unaffected.
   */
  private boolean disableCleanupJob = false;

  /**
   * When true, presenting a refresh token whose secret was already rotated revokes every
   * session of the user.
   */
  private boolean revokeSessionOnReuse = false;

  /**
   * Hex-encoded HMAC key for device fingerprints. Empty disables fingerprinting.
   */
  private String fingerprintSecretHex = "";

  /**
   * Redis address for the token blacklist, e.g. {@code redis://localhost:6379}.
   * Empty keeps the blacklist in memory (single node only).
   */
  private String redisAddress = "";

  /**
   * Redis command timeout in milliseconds.
   */
  @Min(1)
  private int redisTimeoutMillis = 3000;

  /**
   * Gets access secret hex.
   *
   * @return the access secret hex
   */
  @JsonProperty
  public String getAccessSecretHex() {
    return accessSecretHex;
  }

  /**
   * Sets access secret hex.
   *
   * @param accessSecretHex the access secret hex
   */
  @JsonProperty
  public void setAccessSecretHex(String accessSecretHex) {
    this.accessSecretHex = accessSecretHex;
  }

  /**
   * Gets refresh secret hex.
   *
   * @return the refresh secret hex
   */
  @JsonProperty
  public String getRefreshSecretHex() {
    return refreshSecretHex;
  }

  /**
   * Sets refresh secret hex.
   *
   * @param refreshSecretHex the refresh secret hex
   */
  @JsonProperty
  public void setRefreshSecretHex(String refreshSecretHex) {
    this.refreshSecretHex = refreshSecretHex;
  }

  /**
   * Gets access ttl seconds.
   *
   * @return the access ttl seconds
   */
  @JsonProperty
  public long getAccessTtlSeconds() {
    return accessTtlSeconds;
  }

  /**
   * Sets access ttl seconds.
   *
   * @param accessTtlSeconds the access ttl seconds
   */
  @JsonProperty
  public void setAccessTtlSeconds(long accessTtlSeconds) {
    this.accessTtlSeconds = accessTtlSeconds;
  }

  /**
   * Gets refresh ttl seconds.
   *
   * @return the refresh ttl seconds
   */
  @JsonProperty
  public long getRefreshTtlSeconds() {
    return refreshTtlSeconds;
  }

  /**
   * Sets refresh ttl seconds.
   *
   * @param refreshTtlSeconds the refresh ttl seconds
   */
  @JsonProperty
  public void setRefreshTtlSeconds(long refreshTtlSeconds) {
    this.refreshTtlSeconds = refreshTtlSeconds;
  }

  /**
   * Gets issuer.
   *
   * @return the issuer
   */
  @JsonProperty
  public String getIssuer() {
    return issuer;
  }

  /**
   * Sets issuer.
   *
   * @param issuer the issuer
   */
  @JsonProperty
  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  /**
   * Gets clock skew leeway seconds.
   *
   * @return the clock skew leeway seconds
   */
  @JsonProperty
  public long getClockSkewLeewaySeconds() {
    return clockSkewLeewaySeconds;
  }

  /**
   * Sets clock skew leeway seconds.
   *
   * @param clockSkewLeewaySeconds the clock skew leeway seconds
   */
  @JsonProperty
  public void setClockSkewLeewaySeconds(long clockSkewLeewaySeconds) {
    this.clockSkewLeewaySeconds = clockSkewLeewaySeconds;
  }

  /**
   * Gets cleanup interval seconds.
   *
   * @return the cleanup interval seconds
   */
  @JsonProperty
  public long getCleanupIntervalSeconds() {
    return cleanupIntervalSeconds;
  }

  /**
   * Sets cleanup interval seconds.
   *
   * @param cleanupIntervalSeconds the cleanup interval seconds
   */
  @JsonProperty
  public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) {
    this.cleanupIntervalSeconds = cleanupIntervalSeconds;
  }

  /**
   * Is disable cleanup job.
   *
   * @return the disable cleanup job
   */
  @JsonProperty
  public boolean isDisableCleanupJob() {
    return disableCleanupJob;
  }

  /**
   * Sets disable cleanup job.
   *
   * @param disableCleanupJob the disable cleanup job
   */
  @JsonProperty
  public void setDisableCleanupJob(boolean disableCleanupJob) {
    this.disableCleanupJob = disableCleanupJob;
  }

  /**
   * Is revoke session on reuse.
   *
   * @return the revoke session on reuse
   */
  @JsonProperty
  public boolean isRevokeSessionOnReuse() {
    return revokeSessionOnReuse;
  }

  /**
   * Sets revoke session on reuse.
   *
   * @param revokeSessionOnReuse the revoke session on reuse
   */
  @JsonProperty
  public void setRevokeSessionOnReuse(boolean revokeSessionOnReuse) {
    this.revokeSessionOnReuse = revokeSessionOnReuse;
  }

  /**
   * Gets fingerprint secret hex.
   *
   * @return the fingerprint secret hex
   */
  @JsonProperty
  public String getFingerprintSecretHex() {
    return fingerprintSecretHex;
  }

  /**
   * Sets fingerprint secret hex.
   *
   * @param fingerprintSecretHex the fingerprint secret hex
   */
  @JsonProperty
  public void setFingerprintSecretHex(String fingerprintSecretHex) {
    this.fingerprintSecretHex = fingerprintSecretHex;
  }

  /**
   * Gets redis address.
   *
   * @return the redis address
   */
  @JsonProperty
  public String getRedisAddress() {
    return redisAddress;
  }

  /**
   * Sets redis address.
   *
   * @param redisAddress the redis address
   */
  @JsonProperty
  public void setRedisAddress(String redisAddress) {
    this.redisAddress = redisAddress;
  }

  /**
   * Gets redis timeout millis.
   *
   * @return the redis timeout millis
   */
  @JsonProperty
  public int getRedisTimeoutMillis() {
    return redisTimeoutMillis;
  }

  /**
   * Sets redis timeout millis.
   *
   * @param redisTimeoutMillis the redis timeout millis
   */
  @JsonProperty
  public void setRedisTimeoutMillis(int redisTimeoutMillis) {
    this.redisTimeoutMillis = redisTimeoutMillis;
  }
}
