package com.restschema.server.security;

import com.restschema.errors.ResourceException;
import com.restschema.resources.Invocation;
import java.util.List;

/**
 * Access checks for resource handlers.
 */
public final class Authorization {

  private Authorization() {
    // Utility class, no instances
  }

  /**
   * Returns the authenticated user of an invocation.
   *
   * @throws ResourceException with status 401 naming the challenges the request could answer
   */
  public static User requireUser(Invocation invocation) {
    return invocation.contextValue(Authenticator.USER_CONTEXT_KEY, User.class)
        .orElseThrow(() -> ResourceException.unauthenticated(describeChallenges(invocation)));
  }

  private static String describeChallenges(Invocation invocation) {
    Object value = invocation.context().get(Authenticator.CHALLENGES_CONTEXT_KEY);
    List<?> challenges = value instanceof List ? (List<?>) value : List.of();
    String message = "This resource requires authentication";
    return challenges.isEmpty() ? message : message + " (accepted: " + challenges + ")";
  }
}
