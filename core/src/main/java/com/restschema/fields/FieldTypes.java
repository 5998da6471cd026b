package com.restschema.fields;

import com.google.common.collect.ImmutableSet;
import com.restschema.common.status.StatusOr;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Function;

/**
 * Built-in representation field types.
 */
public final class FieldTypes {

  private static final ImmutableSet<Object> TRUE_VALUES =
      ImmutableSet.of("True", "true", "TRUE", "T", "t", "1", Boolean.TRUE);
  private static final ImmutableSet<Object> FALSE_VALUES =
      ImmutableSet.of("False", "false", "FALSE", "F", "f", "0", Boolean.FALSE);

  private FieldTypes() {
    // Utility class, no instances
  }

  /** Passes values through unchanged in both directions. */
  public static FieldType<Object> raw() {
    return of("string", StatusOr::ofValue, value -> value);
  }

  /** Accepts only string representations. */
  public static FieldType<String> string() {
    return of("string",
        raw -> raw instanceof String
            ? StatusOr.ofValue((String) raw)
            : StatusOr.invalid(raw + " is not a string"),
        value -> value);
  }

  /** Integral numbers, or strings holding one. */
  public static FieldType<Integer> integer() {
    return of("int", FieldTypes::toInteger, value -> value);
  }

  public static FieldType<Double> floating() {
    return of("float",
        raw -> {
          if (raw instanceof Number) {
            return StatusOr.ofValue(((Number) raw).doubleValue());
          } else if (raw instanceof String) {
            return StatusOr.parsing(((String) raw).trim(), Double::valueOf);
          }
          return StatusOr.invalid(raw + " is not a number");
        },
        value -> value);
  }

  /** Arbitrary precision numbers, represented as plain strings so no precision is lost. */
  public static FieldType<BigDecimal> decimal() {
    return of("decimal",
        raw -> {
          if (raw instanceof BigDecimal) {
            return StatusOr.ofValue((BigDecimal) raw);
          } else if (raw instanceof Number || raw instanceof String) {
            return StatusOr.parsing(raw.toString().trim(), BigDecimal::new);
          }
          return StatusOr.invalid(raw + " is not a decimal");
        },
        BigDecimal::toPlainString);
  }

  /** Booleans accepting the common spellings, represented as JSON booleans. */
  public static FieldType<Boolean> bool() {
    return of("bool",
        raw -> {
          if (TRUE_VALUES.contains(raw) || isNumber(raw, 1)) {
            return StatusOr.ofValue(Boolean.TRUE);
          } else if (FALSE_VALUES.contains(raw) || isNumber(raw, 0)) {
            return StatusOr.ofValue(Boolean.FALSE);
          }
          return StatusOr.invalid(
              "bool type value must be one of " + TRUE_VALUES + " or " + FALSE_VALUES);
        },
        value -> value);
  }

  /**
   * Booleans with custom representations; only those two values are accepted on input.
   *
   * @param falseRepresentation representation of {@code false}
   * @param trueRepresentation representation of {@code true}
   */
  public static FieldType<Boolean> bool(Object falseRepresentation, Object trueRepresentation) {
    if (Objects.equals(falseRepresentation, trueRepresentation)) {
      throw new IllegalArgumentException("bool representations must differ");
    }
    return of("bool",
        raw -> {
          if (matches(raw, trueRepresentation)) {
            return StatusOr.ofValue(Boolean.TRUE);
          } else if (matches(raw, falseRepresentation)) {
            return StatusOr.ofValue(Boolean.FALSE);
          }
          return StatusOr.invalid("bool type value must be one of ["
              + trueRepresentation + ", " + falseRepresentation + "]");
        },
        value -> value ? trueRepresentation : falseRepresentation);
  }

  /**
   * Adapts a pair of conversion functions into a field type.
   *
   * @param typeName type tag for descriptions
   * @param decode representation to internal value
   * @param encode internal value to representation
   */
  public static <I> FieldType<I> of(
      String typeName, Function<Object, StatusOr<I>> decode, Function<I, Object> encode) {
    return new FieldType<>() {
      @Override
      public StatusOr<I> fromRepresentation(Object raw) {
        return decode.apply(raw);
      }

      @Override
      public Object toRepresentation(I value) {
        return encode.apply(value);
      }

      @Override
      public String typeName() {
        return typeName;
      }
    };
  }

  private static StatusOr<Integer> toInteger(Object raw) {
    if (raw instanceof Integer) {
      return StatusOr.ofValue((Integer) raw);
    }
    if (raw instanceof String) {
      return StatusOr.parsing(((String) raw).trim(), Integer::valueOf);
    }
    if (raw instanceof Number) {
      StatusOr<BigDecimal> exact = StatusOr.parsing(raw.toString(), BigDecimal::new);
      return exact.flatMap(value -> StatusOr.parsing(value, BigDecimal::intValueExact));
    }
    return StatusOr.invalid(raw + " is not an integer");
  }

  private static boolean isNumber(Object raw, int expected) {
    return raw instanceof Number && ((Number) raw).doubleValue() == expected;
  }

  /** Numbers match by value so a JSON {@code 1} decoded as Long matches an Integer {@code 1}. */
  private static boolean matches(Object raw, Object representation) {
    if (raw instanceof Number && representation instanceof Number) {
      return ((Number) raw).doubleValue() == ((Number) representation).doubleValue();
    }
    return raw.equals(representation);
  }
}
