package com.codeheadsystems.tessera.server.blacklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.server.MutableClock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryTokenBlacklistTest {

  private MutableClock clock;
  private InMemoryTokenBlacklist blacklist;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    blacklist = new InMemoryTokenBlacklist(clock);
  }

  @AfterEach
  void tearDown() {
    blacklist.shutdown();
  }

  @Test
  void add_thenHas() {
    blacklist.add("jti-1", clock.instant().plusSeconds(60));

    assertThat(blacklist.has("jti-1")).isTrue();
    assertThat(blacklist.has("jti-2")).isFalse();
  }

  @Test
  void has_pastExpiry_falseWithoutCleanup() {
    blacklist.add("jti-1", clock.instant().plusSeconds(60));
    clock.advance(Duration.ofSeconds(60));

    assertThat(blacklist.has("jti-1")).isFalse();
    assertThat(blacklist.size()).isZero();
  }

  @Test
  void remove_takesEffectImmediately() {
    blacklist.add("jti-1", clock.instant().plusSeconds(60));
    blacklist.remove("jti-1");

    assertThat(blacklist.has("jti-1")).isFalse();
  }

  @Test
  void cleanup_prunesOnlyExpired() {
    blacklist.add("short", clock.instant().plusSeconds(10));
    blacklist.add("long", clock.instant().plusSeconds(600));
    clock.advance(Duration.ofSeconds(30));

    blacklist.cleanup();

    assertThat(blacklist.size()).isEqualTo(1);
    assertThat(blacklist.has("long")).isTrue();
  }

  @Test
  void sweeper_prunesInBackground() throws Exception {
    InMemoryTokenBlacklist swept = new InMemoryTokenBlacklist(Clock.systemUTC(), Duration.ofMillis(20));
    try {
      swept.add("gone", Instant.now().minusSeconds(1));
      swept.add("kept", Instant.now().plusSeconds(600));

      long deadline = System.currentTimeMillis() + 5_000;
      while (swept.size() > 1 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }

      assertThat(swept.size()).isEqualTo(1);
      assertThat(swept.has("kept")).isTrue();
      assertThat(swept.isSweeping()).isTrue();
    } finally {
      swept.shutdown();
    }
    assertThat(swept.isSweeping()).isFalse();
    assertThat(blacklist.isSweeping()).isFalse();
  }

  @Test
  void shutdown_clearsEntries() {
    blacklist.add("jti-1", clock.instant().plusSeconds(60));
    blacklist.shutdown();

    assertThat(blacklist.has("jti-1")).isFalse();
  }

  @Test
  void constructor_nonPositiveSweepInterval_throws() {
    assertThatThrownBy(() -> new InMemoryTokenBlacklist(clock, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
