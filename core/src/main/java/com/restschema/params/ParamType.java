package com.restschema.params;

import com.restschema.common.TypeSpec;
import com.restschema.common.status.StatusOr;
import javax.annotation.Nullable;

/**
 * Coercion rule turning one raw query string value into a typed value.
 *
 * @param <T> the coerced type
 */
public interface ParamType<T> {

  /**
   * Parses a raw query string value.
   *
   * @param raw the raw value, never null
   * @return the coerced value, or an INVALID_ARGUMENT status explaining the failure
   */
  StatusOr<T> parse(String raw);

  /** Formats a value back into the raw form {@link #parse} accepts. */
  default String format(T value) {
    return String.valueOf(value);
  }

  /** Type tag published in descriptions. */
  String typeName();

  /** Optional reference to the format definition, published in descriptions. */
  @Nullable
  default TypeSpec spec() {
    return null;
  }
}
