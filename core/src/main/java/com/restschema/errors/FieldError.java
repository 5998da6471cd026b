package com.restschema.errors;

import javax.annotation.Nullable;

/**
 * A single problem found while resolving parameters or decoding a representation.
 *
 * @param name the parameter or field name, or null for object-level errors
 * @param message the client-facing message
 */
public record FieldError(@Nullable String name, String message) {

  public static FieldError of(String name, String message) {
    return new FieldError(name, message);
  }

  /** An error about the object as a whole rather than one of its fields. */
  public static FieldError objectLevel(String message) {
    return new FieldError(null, message);
  }

  @Override
  public String toString() {
    return name == null ? message : name + ": " + message;
  }
}
