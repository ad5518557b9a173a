package com.codeheadsystems.tessera.dropwizard.managed;

import com.codeheadsystems.tessera.server.auth.TokenService;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ties the token service's cleanup job and blacklist to the Dropwizard lifecycle.
 */
public class TokenServiceManaged implements Managed {

  private static final Logger log = LoggerFactory.getLogger(TokenServiceManaged.class);

  private final TokenService tokenService;

  public TokenServiceManaged(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @Override
  public void stop() {
    log.info("Stopping token service");
    tokenService.shutdown();
  }
}
