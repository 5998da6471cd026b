package com.restschema.errors;

import java.util.List;

/**
 * Raised when a request body fails field-level or object-level validation.
 */
public class ValidationException extends AggregateException {
  public static final String TITLE = "Representation validation failed";

  public ValidationException(List<FieldError> errors) {
    super(TITLE, errors);
  }
}
