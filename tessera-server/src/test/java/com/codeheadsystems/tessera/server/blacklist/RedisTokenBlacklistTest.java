package com.codeheadsystems.tessera.server.blacklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.server.MutableClock;
import com.codeheadsystems.tessera.server.exception.TransientStoreException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

@ExtendWith(MockitoExtension.class)
class RedisTokenBlacklistTest {

  @Mock private RedissonClient redissonClient;

  @Mock private RBucket<String> bucket;

  private MutableClock clock;
  private RedisTokenBlacklist blacklist;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    lenient().when(redissonClient.<String>getBucket(anyString(), eq(StringCodec.INSTANCE)))
        .thenReturn(bucket);
    blacklist = new RedisTokenBlacklist(redissonClient, clock, true);
  }

  @Test
  void add_setsPrefixedKeyWithRemainingTtl() {
    blacklist.add("jti-1", clock.instant().plusSeconds(300));

    verify(redissonClient).getBucket("auth:token:blacklist:jti-1", StringCodec.INSTANCE);
    verify(bucket).set("1", Duration.ofSeconds(300));
  }

  @Test
  void has_delegatesToKeyExistence() {
    when(bucket.isExists()).thenReturn(true);

    assertThat(blacklist.has("jti-1")).isTrue();
  }

  @Test
  void remove_deletesKey() {
    blacklist.remove("jti-1");

    verify(bucket).delete();
  }

  @Test
  void redisFailure_surfacesAsTransient() {
    when(bucket.isExists()).thenThrow(new RedisException("connection refused"));

    assertThatThrownBy(() -> blacklist.has("jti-1"))
        .isInstanceOf(TransientStoreException.class)
        .hasCauseInstanceOf(RedisException.class);
  }

  @Test
  void add_subSecondRemainder_keepsMillisecondTtl() {
    blacklist.add("jti-1", clock.instant().plusMillis(1500));

    verify(bucket).set("1", Duration.ofMillis(1500));
  }

  @Test
  void add_alreadyExpired_writesNothing() {
    blacklist.add("jti-1", clock.instant());
    blacklist.add("jti-2", clock.instant().minusSeconds(30));

    verify(bucket, never()).set(anyString(), any(Duration.class));
  }

  @Test
  void toTtl_zeroOncePastExpiry() {
    assertThat(blacklist.toTtl(clock.instant().plusMillis(1))).isEqualTo(Duration.ofMillis(1));
    assertThat(blacklist.toTtl(clock.instant())).isEqualTo(Duration.ZERO);
    assertThat(blacklist.toTtl(clock.instant().minusSeconds(30))).isEqualTo(Duration.ZERO);
  }

  @Test
  void shutdown_ownedClient_shutsDown() {
    when(redissonClient.isShutdown()).thenReturn(false);

    blacklist.shutdown();

    verify(redissonClient).shutdown();
  }

  @Test
  void shutdown_sharedClient_leftRunning() {
    new RedisTokenBlacklist(redissonClient, clock, false).shutdown();

    verify(redissonClient, never()).shutdown();
  }
}
