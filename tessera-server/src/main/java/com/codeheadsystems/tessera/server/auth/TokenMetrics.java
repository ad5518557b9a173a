package com.codeheadsystems.tessera.server.auth;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.tessera.server.exception.RejectionReason;
import java.util.Locale;

/**
 * Counters for the token lifecycle, registered on a Dropwizard {@link MetricRegistry}.
 */
public class TokenMetrics {

  public static final String REFRESH_SUCCESS = "tessera.tokens.refresh.success";
  public static final String REFRESH_REJECTED = "tessera.tokens.refresh.rejected";
  public static final String REFRESH_REPLAY = "tessera.tokens.refresh.replay";
  public static final String VERIFY_REJECTED = "tessera.tokens.verify.rejected";
  public static final String SESSIONS_REVOKED = "tessera.sessions.revoked";
  public static final String BLACKLIST_WRITE_FAILED = "tessera.tokens.blacklist.write.failed";

  private final MetricRegistry registry;

  public TokenMetrics(MetricRegistry registry) {
    this.registry = registry;
  }

  void refreshSucceeded() {
    registry.counter(REFRESH_SUCCESS).inc();
  }

  void refreshRejected(RejectionReason reason) {
    registry.counter(REFRESH_REJECTED).inc();
    registry.counter(name(REFRESH_REJECTED, label(reason))).inc();
  }

  void replayDetected() {
    registry.counter(REFRESH_REPLAY).inc();
  }

  void verifyRejected(RejectionReason reason) {
    registry.counter(VERIFY_REJECTED).inc();
    registry.counter(name(VERIFY_REJECTED, label(reason))).inc();
  }

  void sessionsRevoked(long count) {
    registry.counter(SESSIONS_REVOKED).inc(count);
  }

  void blacklistWriteFailed() {
    registry.counter(BLACKLIST_WRITE_FAILED).inc();
  }

  public MetricRegistry registry() {
    return registry;
  }

  private static String label(RejectionReason reason) {
    return reason.name().toLowerCase(Locale.ROOT);
  }
}
