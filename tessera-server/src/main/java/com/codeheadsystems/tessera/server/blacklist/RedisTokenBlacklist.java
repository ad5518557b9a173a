package com.codeheadsystems.tessera.server.blacklist;

import com.codeheadsystems.tessera.server.exception.TransientStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenBlacklist} stored in Redis through Redisson, one key per revoked jti.
 * <p>
 * Keys carry a native millisecond TTL matching the token's expiry, so {@link #cleanup()} has
 * nothing to do. Already expired tokens are not written at all.
 * Redisson retries failed commands according to its own configuration; a command that still fails
 * is raised as {@link TransientStoreException}.
 */
public class RedisTokenBlacklist implements TokenBlacklist {

  private static final Logger log = LoggerFactory.getLogger(RedisTokenBlacklist.class);

  static final String KEY_PREFIX = "auth:token:blacklist:";
  private static final String MARKER = "1";

  private final RedissonClient redissonClient;
  private final Clock clock;
  private final boolean ownsClient;

  /**
   * Instantiates a new Redis token blacklist.
   *
   * @param redissonClient the client
   * @param clock          time source used to turn expiry instants into TTLs
   * @param ownsClient     whether {@link #shutdown()} should shut the client down
   */
  public RedisTokenBlacklist(RedissonClient redissonClient, Clock clock, boolean ownsClient) {
    this.redissonClient = redissonClient;
    this.clock = clock;
    this.ownsClient = ownsClient;
  }

  @Override
  public void add(String jti, Instant expiresAt) {
    Duration ttl = toTtl(expiresAt);
    if (ttl.isZero()) {
      log.debug("Skipping blacklist write for already expired jti={}", jti);
      return;
    }
    execute("add", () -> {
      bucket(jti).set(MARKER, ttl);
      return null;
    });
    log.debug("Blacklisted jti={} ttl={}ms", jti, ttl.toMillis());
  }

  @Override
  public boolean has(String jti) {
    return execute("has", () -> bucket(jti).isExists());
  }

  @Override
  public void remove(String jti) {
    execute("remove", () -> bucket(jti).delete());
  }

  @Override
  public void cleanup() {
    // Redis expires keys natively.
  }

  @Override
  public void shutdown() {
    if (!ownsClient || redissonClient.isShutdown()) {
      return;
    }
    try {
      redissonClient.shutdown();
    } catch (RedisException e) {
      log.warn("Redis token blacklist shutdown encountered an error", e);
    }
  }

  // Millisecond precision so the key never outlives expiresAt. Zero means already expired.
  Duration toTtl(Instant expiresAt) {
    long millis = Duration.between(clock.instant(), expiresAt).toMillis();
    return millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
  }

  private RBucket<String> bucket(String jti) {
    return redissonClient.getBucket(KEY_PREFIX + jti, StringCodec.INSTANCE);
  }

  private <T> T execute(String operation, Supplier<T> command) {
    try {
      return command.get();
    } catch (RedisException e) {
      throw new TransientStoreException("Token blacklist " + operation + " failed", e);
    }
  }
}
