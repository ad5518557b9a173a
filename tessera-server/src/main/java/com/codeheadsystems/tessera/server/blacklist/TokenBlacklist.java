package com.codeheadsystems.tessera.server.blacklist;

import java.time.Instant;

/**
 * Revocation set of token identifiers ({@code jti}) with expiry-based eviction.
 * <p>
 * Records explicit single-use invalidation of a token before its natural expiry. Entries whose
 * {@code expiresAt} has passed are never reported by {@link #has}, whether or not physical cleanup
 * has run, so correctness never depends on the sweep cadence.
 * <p>
 * Implementations must be thread-safe. Backing-store failures are raised as
 * {@link com.codeheadsystems.tessera.server.exception.TransientStoreException}.
 */
public interface TokenBlacklist {

  /**
   * Records a revoked token id until the given instant.
   *
   * @param jti       token identifier
   * @param expiresAt when the entry may be forgotten (the token's own expiry)
   */
  void add(String jti, Instant expiresAt);

  /**
   * Membership check with lazy expiry.
   *
   * @param jti token identifier
   * @return true if the jti was added and its entry has not expired
   */
  boolean has(String jti);

  /**
   * Removes an entry. Takes effect immediately for subsequent {@link #has} calls.
   *
   * @param jti token identifier
   */
  void remove(String jti);

  /**
   * Physically prunes expired entries. A no-op for stores with native expiry.
   */
  void cleanup();

  /**
   * Stops background work and releases resources.
   */
  void shutdown();
}
