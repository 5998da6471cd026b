package com.restschema.serializers;

import com.restschema.errors.FieldError;
import java.util.List;
import java.util.Map;

/**
 * Whole-object check run after every field of a representation decoded cleanly, for rules that
 * span several fields.
 */
@FunctionalInterface
public interface ObjectValidator {

  /**
   * Validates a decoded object dictionary.
   *
   * @param objectDict decoded values keyed by field source
   * @param partial whether absent fields were allowed
   * @return the problems found, empty when the object is valid
   */
  List<FieldError> validate(Map<String, Object> objectDict, boolean partial);
}
