package com.codeheadsystems.tessera.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.server.blacklist.InMemoryTokenBlacklist;
import com.codeheadsystems.tessera.server.blacklist.TokenBlacklist;
import com.codeheadsystems.tessera.server.exception.TransientStoreException;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class TokenBlacklistHealthCheckTest {

  @Test
  void check_reachableBlacklist_healthy() {
    HealthCheck.Result result = new TokenBlacklistHealthCheck(
        new InMemoryTokenBlacklist(Clock.systemUTC())).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("InMemoryTokenBlacklist");
  }

  @Test
  void check_failingBlacklist_unhealthy() {
    TokenBlacklist blacklist = mock(TokenBlacklist.class);
    when(blacklist.has(TokenBlacklistHealthCheck.PROBE_JTI))
        .thenThrow(new TransientStoreException("redis down"));

    HealthCheck.Result result = new TokenBlacklistHealthCheck(blacklist).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getError()).isInstanceOf(TransientStoreException.class);
  }
}
