package com.codeheadsystems.tessera.server.exception;

/**
 * The single caller-facing authorization failure.
 * <p>
 * Every token-trust failure (bad signature, expiry, blacklist hit, secret mismatch, dead session)
 * collapses into this type with the same message. The specific {@link RejectionReason} is kept
 * for server-side logging and metrics.
 */
public class UnauthorizedException extends SecurityException {

  public static final String MESSAGE = "Authentication failed";

  private final transient RejectionReason reason;

  /**
   * Instantiates a new Unauthorized exception.
   *
   * @param reason the internal rejection reason
   */
  public UnauthorizedException(RejectionReason reason) {
    super(MESSAGE);
    this.reason = reason;
  }

  /**
   * Internal rejection reason. Do not surface to clients.
   *
   * @return the reason
   */
  public RejectionReason reason() {
    return reason;
  }
}
