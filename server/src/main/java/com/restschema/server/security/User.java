package com.restschema.server.security;

import java.util.Objects;

/**
 * An authenticated caller.
 *
 * @param userId stable identifier of the user
 * @param displayName human readable name, safe to log
 */
public record User(String userId, String displayName) {
  public static final User ANONYMOUS = new User("anonymous", "Anonymous");

  public User {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(displayName, "displayName");
  }
}
