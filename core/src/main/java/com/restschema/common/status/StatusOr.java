package com.restschema.common.status;

import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Either a coerced value or the error status explaining why coercion failed.
 *
 * <p>Unlike a plain optional, a successful result may hold {@code null}: a representation field
 * can legitimately decode to null, and that must stay distinguishable from a failure.
 *
 * @param <T> The type of the value in case of success.
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    if (!status.isOk() && value != null) {
      throw new IllegalArgumentException("Value must be null when status is not OK");
    }
    this.status = Objects.requireNonNull(status);
    this.value = value;
  }

  /**
   * Creates a new StatusOr with the given value and an OK status.
   *
   * @param value the value to wrap, possibly null
   * @return a new StatusOr containing the value
   */
  public static <T> StatusOr<T> ofValue(@Nullable T value) {
    return new StatusOr<>(Status.ok(), value);
  }

  /**
   * Creates a new StatusOr with the given non-OK status and no value.
   *
   * @param status the non-OK status to wrap
   * @return a new StatusOr representing the error
   * @throws IllegalArgumentException if status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("Status must not be OK when using ofStatus");
    }
    return new StatusOr<>(status, null);
  }

  /** Shorthand for an INVALID_ARGUMENT failure. */
  public static <T> StatusOr<T> invalid(String message) {
    return ofStatus(Status.invalidArgument(message));
  }

  /**
   * Runs a parse function, turning the runtime exceptions that parsers throw for malformed
   * input ({@link IllegalArgumentException}, {@link ArithmeticException}) into an
   * INVALID_ARGUMENT status.
   *
   * @param input the raw input
   * @param parser the parse function
   * @return the parsed value or the failure
   */
  public static <S, T> StatusOr<T> parsing(S input, @Nonnull Function<S, T> parser) {
    try {
      return ofValue(parser.apply(input));
    } catch (IllegalArgumentException | ArithmeticException e) {
      String message = e.getMessage() == null ? "could not parse '" + input + "'" : e.getMessage();
      return ofStatus(Status.invalidArgument(message, e));
    }
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value if this StatusOr is OK, otherwise throws an IllegalStateException.
   *
   * @throws IllegalStateException if the status is not OK
   */
  @Nullable
  public T getValue() {
    if (!status.isOk()) {
      throw new IllegalStateException("Cannot get value from failed StatusOr: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return !status.isOk();
  }

  /**
   * Maps the value if this StatusOr is OK, otherwise returns a StatusOr with the same error.
   *
   * @param mapper the function to apply to the value
   * @return a new StatusOr with either the mapped value or the original error
   */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    if (status.isOk()) {
      return StatusOr.ofValue(mapper.apply(value));
    }
    return StatusOr.ofStatus(status);
  }

  /**
   * Applies a function that returns a StatusOr to the value if this StatusOr is OK, otherwise
   * returns a StatusOr with the same error.
   *
   * @param mapper the function to apply to the value
   * @return a new StatusOr with either the result of the mapper or the original error
   */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    if (status.isOk()) {
      return mapper.apply(value);
    }
    return StatusOr.ofStatus(status);
  }

  @Override
  public String toString() {
    if (status.isOk()) {
      return "StatusOr{value=" + value + "}";
    }
    return "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    StatusOr<?> other = (StatusOr<?>) obj;
    return Objects.equals(status, other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}
