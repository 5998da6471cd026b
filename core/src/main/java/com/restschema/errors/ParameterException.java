package com.restschema.errors;

import java.util.List;

/**
 * Raised once per request when any query parameter is missing, malformed or invalid.
 */
public class ParameterException extends AggregateException {
  public static final String TITLE = "Invalid parameters";

  public ParameterException(List<FieldError> errors) {
    super(TITLE, errors);
  }
}
