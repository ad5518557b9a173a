package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.server.claims.InMemoryClaimsProvider;
import com.codeheadsystems.tessera.server.manager.SessionSecurityNotifier;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.InMemoryUserStore;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class TesseraTestApplication extends Application<TesseraConfiguration> {

  private final InMemoryUserStore userStore = new InMemoryUserStore();
  private final InMemoryClaimsProvider claimsProvider = new InMemoryClaimsProvider();
  private final TesseraBundle<TesseraConfiguration> bundle = new TesseraBundle<>(
      new InMemorySessionStore(), userStore, claimsProvider, SessionSecurityNotifier.NO_OP);

  @Override
  public String getName() {
    return "tessera-test";
  }

  @Override
  public void initialize(Bootstrap<TesseraConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(TesseraConfiguration configuration, Environment environment) {
    // Register a test-only protected endpoint to exercise bearer auth in integration tests
    environment.jersey().register(new WhoAmIResource());
  }

  public TesseraBundle<TesseraConfiguration> bundle() {
    return bundle;
  }

  public InMemoryUserStore userStore() {
    return userStore;
  }

  public InMemoryClaimsProvider claimsProvider() {
    return claimsProvider;
  }
}
