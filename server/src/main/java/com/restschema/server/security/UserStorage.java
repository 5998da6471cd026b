package com.restschema.server.security;

import java.util.Optional;

/**
 * Looks up users by the identity an {@link Authenticator} extracted from a request.
 *
 * <p>Implementations are shared by every request thread and must be thread-safe.
 */
public interface UserStorage {

  /**
   * Finds the user owning an identity.
   *
   * @param identifiedWith the authentication mode that produced the identity
   * @param identity the raw identity, such as an API key
   * @return the user, or empty when the identity is unknown
   */
  Optional<User> getUser(AuthMode identifiedWith, String identity);
}
