package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.store.SessionRecord;

/**
 * Hook for security-relevant session events, e.g. to write an audit trail or email the user.
 * Both methods default to no-ops; implement the ones you need.
 */
public interface SessionSecurityNotifier {

  SessionSecurityNotifier NO_OP = new SessionSecurityNotifier() {
  };

  /**
   * The device presenting a session does not match the fingerprint recorded at login.
   *
   * @param session             the session
   * @param presentedFingerprint fingerprint computed from the presenting device
   * @param device              the presenting device
   */
  default void fingerprintMismatch(SessionRecord session, String presentedFingerprint,
                                   DeviceMetadata device) {
  }

  /**
   * A session was revoked.
   *
   * @param event the event
   */
  default void sessionRevoked(SessionRevokedEvent event) {
  }
}
