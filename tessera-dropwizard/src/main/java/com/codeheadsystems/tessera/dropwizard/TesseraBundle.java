package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.dropwizard.auth.TesseraAuthenticator;
import com.codeheadsystems.tessera.dropwizard.auth.TesseraPrincipal;
import com.codeheadsystems.tessera.dropwizard.health.TokenBlacklistHealthCheck;
import com.codeheadsystems.tessera.dropwizard.managed.TokenServiceManaged;
import com.codeheadsystems.tessera.server.auth.RefreshSecrets;
import com.codeheadsystems.tessera.server.auth.TokenConfig;
import com.codeheadsystems.tessera.server.auth.TokenMetrics;
import com.codeheadsystems.tessera.server.auth.TokenService;
import com.codeheadsystems.tessera.server.blacklist.InMemoryTokenBlacklist;
import com.codeheadsystems.tessera.server.blacklist.RedisTokenBlacklist;
import com.codeheadsystems.tessera.server.blacklist.TokenBlacklist;
import com.codeheadsystems.tessera.server.claims.ClaimsProvider;
import com.codeheadsystems.tessera.server.claims.InMemoryClaimsProvider;
import com.codeheadsystems.tessera.server.exception.TokenConfigurationException;
import com.codeheadsystems.tessera.server.manager.DeviceFingerprinter;
import com.codeheadsystems.tessera.server.manager.SessionSecurityNotifier;
import com.codeheadsystems.tessera.server.manager.SessionService;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.InMemoryUserStore;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.store.UserStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the tessera token lifecycle into an existing Dropwizard application.
 * <p>
 * Registers the bearer-token authentication filter, the blacklist health check and a managed
 * component that stops the cleanup job on shutdown. Requires a {@link TesseraConfiguration}
 * block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and your role source:
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(mySessionStore, myUserStore, myClaimsProvider,
 *       mySecurityNotifier));
 * }</pre>
 * Protected resources then take an {@code @Auth TesseraPrincipal} parameter. Login and refresh
 * endpoints call {@link #getSessionService()} and {@link #getTokenService()}.
 */
@Singleton
public class TesseraBundle<C extends TesseraConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TesseraBundle.class);
  private static final int GENERATED_SECRET_BYTES = 32;

  private final SessionStore sessionStore;
  private final UserStore userStore;
  private final ClaimsProvider claimsProvider;
  private final SessionSecurityNotifier notifier;
  private final Clock clock;

  private SessionService sessionService;
  private TokenService tokenService;
  private TokenBlacklist blacklist;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only: all sessions and users are lost on restart.
   */
  public TesseraBundle() {
    this(new InMemorySessionStore(), new InMemoryUserStore(), new InMemoryClaimsProvider(),
        SessionSecurityNotifier.NO_OP);
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory session, user and claims  #
        # stores. All sessions will be lost on restart.                 #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param sessionStore   session rows
   * @param userStore      user lookup
   * @param claimsProvider role and permission source, queried on every mint
   * @param notifier       security event hook
   */
  @Inject
  public TesseraBundle(SessionStore sessionStore,
                       UserStore userStore,
                       ClaimsProvider claimsProvider,
                       SessionSecurityNotifier notifier) {
    this(sessionStore, userStore, claimsProvider, notifier, Clock.systemUTC());
  }

  TesseraBundle(SessionStore sessionStore,
                UserStore userStore,
                ClaimsProvider claimsProvider,
                SessionSecurityNotifier notifier,
                Clock clock) {
    this.sessionStore = sessionStore;
    this.userStore = userStore;
    this.claimsProvider = claimsProvider;
    this.notifier = notifier;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    TokenConfig tokenConfig = buildTokenConfig(configuration);
    log.info("Configuring token service: {}", tokenConfig);

    sessionService = new SessionService(sessionStore, clock, tokenConfig.refreshTtl(),
        new RefreshSecrets(new SecureRandom()),
        new DeviceFingerprinter(tokenConfig.fingerprintSecret()), notifier);
    blacklist = buildBlacklist(configuration);
    tokenService = new TokenService(tokenConfig, sessionService, userStore, claimsProvider,
        blacklist, new TokenMetrics(environment.metrics()));

    environment.lifecycle().manage(new TokenServiceManaged(tokenService));
    environment.healthChecks().register("token-blacklist", new TokenBlacklistHealthCheck(blacklist));

    // Bearer auth filter
    TesseraAuthenticator authenticator = new TesseraAuthenticator(tokenService);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TesseraPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TesseraPrincipal.class));
  }

  public SessionService getSessionService() {
    return sessionService;
  }

  public TokenService getTokenService() {
    return tokenService;
  }

  public TokenBlacklist getBlacklist() {
    return blacklist;
  }

  TokenConfig buildTokenConfig(C configuration) {
    return TokenConfig.builder()
        .accessSecret(secret(configuration.getAccessSecretHex(), "access"))
        .refreshSecret(secret(configuration.getRefreshSecretHex(), "refresh"))
        .accessTtl(Duration.ofSeconds(configuration.getAccessTtlSeconds()))
        .refreshTtl(Duration.ofSeconds(configuration.getRefreshTtlSeconds()))
        .issuer(configuration.getIssuer())
        .clockSkewLeeway(Duration.ofSeconds(configuration.getClockSkewLeewaySeconds()))
        .cleanupInterval(Duration.ofSeconds(configuration.getCleanupIntervalSeconds()))
        .disableCleanupJob(configuration.isDisableCleanupJob())
        .revokeSessionOnReuse(configuration.isRevokeSessionOnReuse())
        .fingerprintSecret(optionalHex(configuration.getFingerprintSecretHex()))
        .build();
  }

  private static byte[] secret(String hex, String name) {
    if (hex == null || hex.isEmpty()) {
      log.warn("No {} token secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.", name);
      byte[] secret = new byte[GENERATED_SECRET_BYTES];
      new SecureRandom().nextBytes(secret);
      return secret;
    }
    return parseHex(hex, name);
  }

  private static byte[] optionalHex(String hex) {
    return hex == null || hex.isEmpty() ? null : parseHex(hex, "fingerprint");
  }

  private static byte[] parseHex(String hex, String name) {
    try {
      return HexFormat.of().parseHex(hex);
    } catch (IllegalArgumentException e) {
      throw new TokenConfigurationException("The " + name + " secret is not valid hex", e);
    }
  }

  // The token service cleanup job already prunes the blacklist, so no sweeper of its own.
  TokenBlacklist buildBlacklist(C configuration) {
    String address = configuration.getRedisAddress();
    if (address == null || address.isEmpty()) {
      log.warn("No Redis address configured, using the in-memory token blacklist. "
          + "Revoked tokens are forgotten on restart and not shared across nodes.");
      return new InMemoryTokenBlacklist(clock);
    }
    Config redissonConfig = new Config();
    redissonConfig.useSingleServer()
        .setAddress(address)
        .setRetryAttempts(3)
        .setRetryInterval(1500)
        .setTimeout(configuration.getRedisTimeoutMillis())
        .setConnectTimeout(5000);
    RedissonClient client = Redisson.create(redissonConfig);
    log.info("Token blacklist backed by Redis at {}", address);
    return new RedisTokenBlacklist(client, clock, true);
  }
}
