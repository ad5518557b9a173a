package com.codeheadsystems.tessera.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory session store test.
 */
class InMemorySessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final SessionRevocation.Revoked LOGOUT = new SessionRevocation.Revoked(NOW, "logout");

  private InMemorySessionStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore();
  }

  private static SessionRecord session(String id, String userId, String hash, Instant expiresAt) {
    return new SessionRecord(id, userId, hash, NOW, expiresAt, SessionRevocation.NOT_REVOKED,
        null, null, null);
  }

  /**
   * Create and find round trip.
   */
  @Test
  void createAndFind_roundTrip() {
    SessionRecord record = session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600));
    store.create(record);

    assertThat(store.findById("s-1")).contains(record);
    assertThat(store.findByUserId("u-1")).containsExactly(record);
  }

  /**
   * Find not found returns empty.
   */
  @Test
  void find_notFound_returnsEmpty() {
    assertThat(store.findById("nonexistent")).isEmpty();
    assertThat(store.findByUserId("nobody")).isEmpty();
  }

  /**
   * Create duplicate id throws.
   */
  @Test
  void create_duplicateId_throws() {
    store.create(session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600)));

    assertThatThrownBy(() -> store.create(session("s-1", "u-2", "hash-2", NOW.plusSeconds(3600))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /**
   * Compare and set with the expected hash swaps hash and expiry.
   */
  @Test
  void compareAndSet_expectedHash_swaps() {
    store.create(session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600)));

    boolean swapped = store.compareAndSetRefreshSecret("s-1", "hash-1", "hash-2", NOW.plusSeconds(7200));

    assertThat(swapped).isTrue();
    SessionRecord loaded = store.findById("s-1").orElseThrow();
    assertThat(loaded.refreshSecretHash()).isEqualTo("hash-2");
    assertThat(loaded.expiresAt()).isEqualTo(NOW.plusSeconds(7200));
  }

  /**
   * Compare and set with a stale hash leaves the row untouched.
   */
  @Test
  void compareAndSet_staleHash_fails() {
    store.create(session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600)));
    store.compareAndSetRefreshSecret("s-1", "hash-1", "hash-2", NOW.plusSeconds(7200));

    assertThat(store.compareAndSetRefreshSecret("s-1", "hash-1", "hash-3", NOW.plusSeconds(9000)))
        .isFalse();
    assertThat(store.findById("s-1").orElseThrow().refreshSecretHash()).isEqualTo("hash-2");
  }

  /**
   * Compare and set on a revoked or missing session fails.
   */
  @Test
  void compareAndSet_revokedOrMissing_fails() {
    store.create(session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600)));
    store.revoke("s-1", LOGOUT);

    assertThat(store.compareAndSetRefreshSecret("s-1", "hash-1", "hash-2", NOW.plusSeconds(7200)))
        .isFalse();
    assertThat(store.compareAndSetRefreshSecret("missing", "hash-1", "hash-2", NOW)).isFalse();
  }

  /**
   * Concurrent compare and set has exactly one winner.
   */
  @Test
  void compareAndSet_concurrent_exactlyOneWinner() throws Exception {
    store.create(session("s-1", "u-1", "hash-0", NOW.plusSeconds(3600)));
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        String candidate = "hash-" + (i + 1);
        results.add(executor.submit(() -> {
          start.await();
          return store.compareAndSetRefreshSecret("s-1", "hash-0", candidate, NOW.plusSeconds(7200));
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Revoke is one-shot.
   */
  @Test
  void revoke_secondCall_returnsFalse() {
    store.create(session("s-1", "u-1", "hash-1", NOW.plusSeconds(3600)));

    assertThat(store.revoke("s-1", LOGOUT)).isTrue();
    assertThat(store.revoke("s-1", new SessionRevocation.Revoked(NOW.plusSeconds(5), "again")))
        .isFalse();
    assertThat(store.findById("s-1").orElseThrow().revocation()).isEqualTo(LOGOUT);
  }

  /**
   * Revoke all for user only touches that user's live sessions.
   */
  @Test
  void revokeAllForUser_countsOnlyNewlyRevoked() {
    store.create(session("s-1", "u-1", "h", NOW.plusSeconds(3600)));
    store.create(session("s-2", "u-1", "h", NOW.plusSeconds(3600)));
    store.create(session("s-3", "u-1", "h", NOW.plusSeconds(3600)));
    store.create(session("s-4", "u-2", "h", NOW.plusSeconds(3600)));
    store.revoke("s-3", LOGOUT);

    assertThat(store.revokeAllForUser("u-1", LOGOUT)).isEqualTo(2);
    assertThat(store.findById("s-4").orElseThrow().revocation().isRevoked()).isFalse();
    assertThat(store.revokeAllForUser("nobody", LOGOUT)).isZero();
  }

  /**
   * Revoke expired marks only sessions at or past their expiry.
   */
  @Test
  void revokeExpired_marksOnlyExpired() {
    store.create(session("past", "u-1", "h", NOW.minusSeconds(1)));
    store.create(session("boundary", "u-1", "h", NOW));
    store.create(session("future", "u-1", "h", NOW.plusSeconds(1)));

    int count = store.revokeExpired(NOW, new SessionRevocation.Revoked(NOW, "session_expired"));

    assertThat(count).isEqualTo(2);
    assertThat(store.findById("future").orElseThrow().revocation().isRevoked()).isFalse();
    assertThat(store.findById("boundary").orElseThrow().state(NOW)).isEqualTo(SessionState.REVOKED);
  }
}
