package com.restschema.errors;

import com.google.common.collect.ImmutableList;
import com.restschema.common.status.Status;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base for the 400-class failures that report every offending input at once.
 */
public abstract class AggregateException extends ResourceException {
  private final ImmutableList<FieldError> errors;

  protected AggregateException(String title, List<FieldError> errors) {
    super(Status.invalidArgument(describe(errors)), title);
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("an aggregate error needs at least one entry");
    }
    this.errors = ImmutableList.copyOf(errors);
  }

  public ImmutableList<FieldError> getErrors() {
    return errors;
  }

  /** Names of the inputs that failed, in the order they were reported. */
  public List<String> getNames() {
    return errors.stream()
        .map(FieldError::name)
        .filter(name -> name != null)
        .distinct()
        .collect(Collectors.toList());
  }

  private static String describe(List<FieldError> errors) {
    return errors.stream().map(FieldError::toString).collect(Collectors.joining("; "));
  }
}
