package com.restschema.validation;

import com.restschema.common.status.Status;

/**
 * A pure check run on an already coerced value.
 *
 * @param <T> the type of value checked
 */
@FunctionalInterface
public interface Validator<T> {

  /**
   * Checks the value.
   *
   * @param value the coerced value
   * @return {@link Status#ok()} when the value is acceptable, otherwise an INVALID_ARGUMENT
   *     status with the reason
   */
  Status validate(T value);
}
