package com.restschema.resources;

import java.util.Locale;
import java.util.Optional;

/** HTTP methods a resource can answer. */
public enum Verb {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE,
  OPTIONS;

  /** Verbs whose request body is decoded through the resource serializer. */
  public boolean isMutating() {
    return this == POST || this == PUT || this == PATCH;
  }

  /** Verbs that decode their body as a partial update. */
  public boolean isPartial() {
    return this == PATCH;
  }

  /**
   * Parses a method name case-insensitively.
   *
   * @return the verb, or empty for methods outside this set (HEAD, TRACE, extension methods)
   */
  public static Optional<Verb> parse(String method) {
    if (method == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(method.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
