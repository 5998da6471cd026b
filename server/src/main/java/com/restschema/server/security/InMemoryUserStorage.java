package com.restschema.server.security;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link UserStorage} backed by in-process maps, one per authentication mode.
 */
public class InMemoryUserStorage implements UserStorage {
  private final Map<AuthMode, Map<String, User>> users = new EnumMap<>(AuthMode.class);

  public InMemoryUserStorage() {
    for (AuthMode mode : AuthMode.values()) {
      users.put(mode, new ConcurrentHashMap<>());
    }
  }

  /** Registers {@code user} under an identity; a later registration of the same identity wins. */
  public InMemoryUserStorage register(AuthMode identifiedWith, String identity, User user) {
    users.get(identifiedWith).put(identity, user);
    return this;
  }

  @Override
  public Optional<User> getUser(AuthMode identifiedWith, String identity) {
    return Optional.ofNullable(users.get(identifiedWith).get(identity));
  }
}
