package com.restschema.validation;

import com.google.common.base.Strings;
import com.restschema.common.status.Status;
import com.restschema.errors.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Factory for the common validators and the evaluation of validator chains.
 */
public final class Validators {

  private Validators() {
    // Utility class, no instances
  }

  /** Fails when the value is less than {@code minValue}. */
  public static <T extends Comparable<? super T>> Validator<T> min(T minValue) {
    return value -> value.compareTo(minValue) < 0
        ? Status.invalidArgument(value + " is not >= " + minValue)
        : Status.ok();
  }

  /** Fails when the value is greater than {@code maxValue}. */
  public static <T extends Comparable<? super T>> Validator<T> max(T maxValue) {
    return value -> value.compareTo(maxValue) > 0
        ? Status.invalidArgument(value + " is not <= " + maxValue)
        : Status.ok();
  }

  /** Inclusive range check; reports the bound that was crossed. */
  public static <T extends Comparable<? super T>> Validator<T> range(T minValue, T maxValue) {
    if (minValue.compareTo(maxValue) > 0) {
      throw new ConfigurationException(
          "range(" + minValue + ", " + maxValue + "): minimum is greater than maximum");
    }
    Validator<T> lower = min(minValue);
    Validator<T> upper = max(maxValue);
    return value -> {
      Status status = lower.validate(value);
      return status.isOk() ? upper.validate(value) : status;
    };
  }

  /** Fails when the value is not one of {@code choices}. */
  public static <T> Validator<T> choices(Collection<? extends T> choices) {
    List<T> allowed = new ArrayList<>(choices);
    return value -> allowed.contains(value)
        ? Status.ok()
        : Status.invalidArgument(value + " is not in " + allowed);
  }

  /**
   * Fails when the value does not match {@code regex} from its first character, as the
   * validator is meant for prefix-anchored patterns such as {@code \w+}.
   *
   * @throws ConfigurationException if the pattern does not compile
   */
  public static Validator<String> match(String regex) {
    Pattern compiled;
    try {
      compiled = Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException("invalid match pattern: " + regex, e);
    }
    return match(compiled);
  }

  /** Fails when the value does not match {@code pattern} from its first character. */
  public static Validator<String> match(Pattern pattern) {
    return value -> pattern.matcher(value).lookingAt()
        ? Status.ok()
        : Status.invalidArgument(value + " does not match pattern: " + pattern.pattern());
  }

  /** Fails on empty or whitespace-only strings. */
  public static Validator<String> notBlank() {
    return value -> Strings.isNullOrEmpty(value) || value.isBlank()
        ? Status.invalidArgument("value must not be blank")
        : Status.ok();
  }

  /**
   * Runs the validators in order and returns the first failure, or OK when all pass.
   *
   * @param validators the chain
   * @param value the value to check
   * @return the first non-OK status, or OK
   */
  public static <T> Status runChain(Iterable<? extends Validator<? super T>> validators, T value) {
    for (Validator<? super T> validator : validators) {
      Status status = validator.validate(value);
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }
}
