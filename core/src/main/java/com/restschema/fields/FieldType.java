package com.restschema.fields;

import com.restschema.common.TypeSpec;
import com.restschema.common.status.StatusOr;
import javax.annotation.Nullable;

/**
 * Bidirectional coercion rule of a representation field.
 *
 * @param <I> the internal type
 */
public interface FieldType<I> {

  /**
   * Converts a representation value (as produced by the content-type codec) to its internal
   * form.
   *
   * @param raw the representation value, never null
   * @return the internal value, or an INVALID_ARGUMENT status
   */
  StatusOr<I> fromRepresentation(Object raw);

  /** Converts an internal value to its representation. */
  Object toRepresentation(I value);

  String typeName();

  @Nullable
  default TypeSpec spec() {
    return null;
  }
}
