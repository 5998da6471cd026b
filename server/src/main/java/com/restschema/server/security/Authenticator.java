package com.restschema.server.security;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Identifies the caller of a request and records the result in the request context.
 *
 * <p>An authenticator never rejects a request by itself. A successful lookup stores the user
 * under {@link #USER_CONTEXT_KEY}; an identity that could not be resolved adds this
 * authenticator's challenge under {@link #CHALLENGES_CONTEXT_KEY}. Handlers that need a user
 * call {@link Authorization#requireUser}.
 */
public abstract class Authenticator {
  public static final String USER_CONTEXT_KEY = "user";
  public static final String CHALLENGES_CONTEXT_KEY = "challenges";

  protected final UserStorage storage;

  protected Authenticator(UserStorage storage) {
    this.storage = storage;
  }

  /** The mode this authenticator implements. */
  public abstract AuthMode mode();

  /**
   * Extracts the caller's identity from the request.
   *
   * @return the identity, or null when the request carries none
   */
  @Nullable
  protected abstract String identify(RequestHeaders headers);

  /** Value of the {@code WWW-Authenticate} challenge for this scheme, or null for none. */
  @Nullable
  public String challenge() {
    return null;
  }

  /**
   * Authenticates one request. Does nothing when an earlier authenticator already stored a
   * user in {@code context}.
   */
  public void authenticate(RequestHeaders headers, Map<String, Object> context) {
    if (context.containsKey(USER_CONTEXT_KEY)) {
      return;
    }
    String identity = identify(headers);
    Optional<User> user = Strings.isNullOrEmpty(identity)
        ? Optional.empty()
        : storage.getUser(mode(), identity);
    if (user.isPresent()) {
      Logger.info("Authenticated {} with {}", user.get().displayName(), mode());
      context.put(USER_CONTEXT_KEY, user.get());
      return;
    }
    Logger.info("{} authentication: identity {}", mode(), identity == null ? "absent" : "rejected");
    if (challenge() != null) {
      challenges(context).add(challenge());
    }
  }

  @SuppressWarnings("unchecked")
  static List<String> challenges(Map<String, Object> context) {
    return (List<String>) context.computeIfAbsent(CHALLENGES_CONTEXT_KEY, k -> new ArrayList<String>());
  }
}
