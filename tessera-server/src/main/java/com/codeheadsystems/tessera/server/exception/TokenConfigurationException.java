package com.codeheadsystems.tessera.server.exception;

/**
 * Malformed or missing signing secret or TTL. Fatal at startup.
 */
public class TokenConfigurationException extends IllegalStateException {

  public TokenConfigurationException(String message) {
    super(message);
  }

  public TokenConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
