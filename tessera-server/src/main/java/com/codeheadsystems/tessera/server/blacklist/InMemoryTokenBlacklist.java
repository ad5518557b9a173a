package com.codeheadsystems.tessera.server.blacklist;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link TokenBlacklist} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expiry is checked lazily on every {@link #has}; an optional sweep task prunes expired entries
 * so the map does not grow without bound. The sweep is owned by this instance and stopped by
 * {@link #shutdown()}. Entries are lost on restart, which is acceptable only where a restart also
 * rotates the refresh signing secret or where single-node development is the use case.
 */
public class InMemoryTokenBlacklist implements TokenBlacklist {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenBlacklist.class);

  private final ConcurrentHashMap<String, Instant> entries = new ConcurrentHashMap<>();
  private final Clock clock;
  private final ScheduledExecutorService sweeper;

  /**
   * Creates a blacklist with no background sweep. Call {@link #cleanup()} to prune.
   *
   * @param clock time source for expiry checks
   */
  public InMemoryTokenBlacklist(Clock clock) {
    this.clock = clock;
    this.sweeper = null;
  }

  /**
   * Creates a blacklist that prunes expired entries every {@code sweepInterval}.
   *
   * @param clock         time source for expiry checks
   * @param sweepInterval interval between sweeps
   */
  public InMemoryTokenBlacklist(Clock clock, Duration sweepInterval) {
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      throw new IllegalArgumentException("sweepInterval must be positive");
    }
    this.clock = clock;
    this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "token-blacklist-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = sweepInterval.toMillis();
    sweeper.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
  }

  public boolean isSweeping() {
    return sweeper != null && !sweeper.isShutdown();
  }

  @Override
  public void add(String jti, Instant expiresAt) {
    entries.put(jti, expiresAt);
    log.debug("Blacklisted jti={} until {}", jti, expiresAt);
  }

  @Override
  public boolean has(String jti) {
    Instant expiresAt = entries.get(jti);
    if (expiresAt == null) {
      return false;
    }
    if (!expiresAt.isAfter(clock.instant())) {
      entries.remove(jti, expiresAt);
      return false;
    }
    return true;
  }

  @Override
  public void remove(String jti) {
    entries.remove(jti);
  }

  @Override
  public void cleanup() {
    Instant now = clock.instant();
    entries.entrySet().removeIf(e -> !e.getValue().isAfter(now));
  }

  @Override
  public void shutdown() {
    if (sweeper != null) {
      sweeper.shutdownNow();
    }
    entries.clear();
  }

  /**
   * Number of entries physically held, expired or not.
   *
   * @return the entry count
   */
  public int size() {
    return entries.size();
  }

  // Runs on the sweeper thread; an escaping exception would cancel the schedule.
  private void sweep() {
    try {
      cleanup();
    } catch (RuntimeException e) {
      log.error("Token blacklist sweep failed", e);
    }
  }
}
