package com.codeheadsystems.tessera.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore}. Development and testing only.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<String, UserRecord> users = new ConcurrentHashMap<>();

  /**
   * Adds or replaces a user.
   *
   * @param user the user
   */
  public void put(UserRecord user) {
    users.put(user.id(), user);
    log.debug("Stored user id={} status={}", user.id(), user.status());
  }

  public void remove(String userId) {
    users.remove(userId);
  }

  @Override
  public Optional<UserRecord> findUserById(String userId) {
    return Optional.ofNullable(users.get(userId));
  }
}
