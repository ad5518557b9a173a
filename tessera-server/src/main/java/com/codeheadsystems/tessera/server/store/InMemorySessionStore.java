package com.codeheadsystems.tessera.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Single-row mutations go through {@link ConcurrentHashMap#computeIfPresent}, which gives the
 * per-row atomicity the compare-and-swap contract needs. All sessions are lost on restart.
 * Suitable for development and testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionRecord> store = new ConcurrentHashMap<>();
  // Reverse index: userId -> session ids, kept in sync with store.
  private final ConcurrentHashMap<String, Set<String>> userToSessions = new ConcurrentHashMap<>();

  @Override
  public void create(SessionRecord session) {
    SessionRecord existing = store.putIfAbsent(session.id(), session);
    if (existing != null) {
      throw new IllegalArgumentException("Session already exists: " + session.id());
    }
    userToSessions.computeIfAbsent(session.userId(), k -> ConcurrentHashMap.newKeySet())
        .add(session.id());
    log.debug("Stored session id={}", session.id());
  }

  @Override
  public Optional<SessionRecord> findById(String sessionId) {
    return Optional.ofNullable(store.get(sessionId));
  }

  @Override
  public List<SessionRecord> findByUserId(String userId) {
    Set<String> ids = userToSessions.get(userId);
    if (ids == null) {
      return List.of();
    }
    return ids.stream()
        .map(store::get)
        .filter(Objects::nonNull)
        .toList();
  }

  @Override
  public boolean compareAndSetRefreshSecret(String sessionId, String expectedHash, String newHash,
                                            Instant newExpiresAt) {
    AtomicBoolean swapped = new AtomicBoolean(false);
    store.computeIfPresent(sessionId, (id, current) -> {
      if (current.revocation().isRevoked() || !current.refreshSecretHash().equals(expectedHash)) {
        return current;
      }
      swapped.set(true);
      return current.withRefreshSecret(newHash, newExpiresAt);
    });
    log.debug("Refresh secret swap for session id={} swapped={}", sessionId, swapped.get());
    return swapped.get();
  }

  @Override
  public boolean revoke(String sessionId, SessionRevocation.Revoked revocation) {
    AtomicBoolean revoked = new AtomicBoolean(false);
    store.computeIfPresent(sessionId, (id, current) -> {
      if (current.revocation().isRevoked()) {
        return current;
      }
      revoked.set(true);
      return current.withRevocation(revocation);
    });
    return revoked.get();
  }

  @Override
  public int revokeAllForUser(String userId, SessionRevocation.Revoked revocation) {
    Set<String> ids = userToSessions.get(userId);
    if (ids == null) {
      return 0;
    }
    int count = 0;
    for (String id : ids) {
      if (revoke(id, revocation)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public int revokeExpired(Instant now, SessionRevocation.Revoked revocation) {
    int count = 0;
    for (String id : store.keySet()) {
      AtomicBoolean revoked = new AtomicBoolean(false);
      store.computeIfPresent(id, (key, current) -> {
        if (current.revocation().isRevoked() || current.expiresAt().isAfter(now)) {
          return current;
        }
        revoked.set(true);
        return current.withRevocation(revocation);
      });
      if (revoked.get()) {
        count++;
      }
    }
    return count;
  }
}
