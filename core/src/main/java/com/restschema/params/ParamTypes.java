package com.restschema.params;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.BaseEncoding;
import com.restschema.common.TypeSpec;
import com.restschema.common.status.StatusOr;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Built-in query parameter types.
 */
public final class ParamTypes {

  static final TypeSpec BASE64_SPEC =
      new TypeSpec("RFC-4648 Section 4", "https://tools.ietf.org/html/rfc4648#section-4");

  private static final ImmutableSet<String> TRUE_VALUES =
      ImmutableSet.of("True", "TRUE", "true", "1", "yes", "Y");
  private static final ImmutableSet<String> FALSE_VALUES =
      ImmutableSet.of("False", "FALSE", "false", "0", "0.0", "no", "N");

  private ParamTypes() {
    // Utility class, no instances
  }

  /** Value is passed through as given in the query string. */
  public static ParamType<String> string() {
    return simple("string", StatusOr::ofValue);
  }

  public static ParamType<Integer> integer() {
    return simple("integer", raw -> StatusOr.parsing(raw.trim(), Integer::valueOf));
  }

  public static ParamType<Long> longInteger() {
    return simple("integer", raw -> StatusOr.parsing(raw.trim(), Long::valueOf));
  }

  public static ParamType<Double> floating() {
    return simple("float", raw -> StatusOr.parsing(raw.trim(), Double::valueOf));
  }

  public static ParamType<BigDecimal> decimal() {
    return simple("decimal", raw -> {
      StatusOr<BigDecimal> parsed = StatusOr.parsing(raw.trim(), BigDecimal::new);
      return parsed.isOk()
          ? parsed
          : StatusOr.invalid("Could not parse '" + raw + "' value as decimal");
    });
  }

  public static ParamType<Boolean> bool() {
    return simple("bool", raw -> {
      if (TRUE_VALUES.contains(raw)) {
        return StatusOr.ofValue(Boolean.TRUE);
      } else if (FALSE_VALUES.contains(raw)) {
        return StatusOr.ofValue(Boolean.FALSE);
      }
      return StatusOr.invalid(
          raw + " is not a valid bool, use one of " + TRUE_VALUES + " or " + FALSE_VALUES);
    });
  }

  /** Base64 encoded UTF-8 text, decoded to a plain string. */
  public static ParamType<String> base64() {
    return new ParamType<>() {
      @Override
      public StatusOr<String> parse(String raw) {
        return StatusOr.parsing(raw, value ->
            new String(BaseEncoding.base64().decode(value), StandardCharsets.UTF_8));
      }

      @Override
      public String format(String value) {
        return BaseEncoding.base64().encode(value.getBytes(StandardCharsets.UTF_8));
      }

      @Override
      public String typeName() {
        return "string";
      }

      @Override
      public TypeSpec spec() {
        return BASE64_SPEC;
      }
    };
  }

  /** Enum constant matched by name, ignoring case. */
  public static <E extends Enum<E>> ParamType<E> enumOf(Class<E> enumType) {
    return new ParamType<>() {
      @Override
      public StatusOr<E> parse(String raw) {
        for (E constant : enumType.getEnumConstants()) {
          if (constant.name().equalsIgnoreCase(raw.trim())) {
            return StatusOr.ofValue(constant);
          }
        }
        return StatusOr.invalid(raw + " is not one of " + ImmutableSet.copyOf(enumType.getEnumConstants()));
      }

      @Override
      public String format(E value) {
        return value.name().toLowerCase(Locale.ROOT);
      }

      @Override
      public String typeName() {
        return "string";
      }
    };
  }

  /**
   * Adapts a parse function into a parameter type.
   *
   * @param typeName type tag for descriptions
   * @param parser parse function returning a status
   * @param spec optional format reference
   */
  public static <T> ParamType<T> of(
      String typeName, Function<String, StatusOr<T>> parser, @Nullable TypeSpec spec) {
    return new ParamType<>() {
      @Override
      public StatusOr<T> parse(String raw) {
        return parser.apply(raw);
      }

      @Override
      public String typeName() {
        return typeName;
      }

      @Override
      public TypeSpec spec() {
        return spec;
      }
    };
  }

  private static <T> ParamType<T> simple(String typeName, Function<String, StatusOr<T>> parser) {
    return of(typeName, parser, null);
  }
}
