package com.restschema.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Outcome of a coercion or validation step. An OK status carries nothing; any other status
 * carries the code and a message meant for the API client.
 */
public final class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause);
  }

  /** Returns the shared OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new INVALID_ARGUMENT status that remembers the parse failure behind it. */
  public static Status invalidArgument(String message, Throwable cause) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, cause);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new UNAUTHENTICATED status with the given message. */
  public static Status unauthenticated(String message) {
    return new Status(StatusCode.UNAUTHENTICATED, message, null);
  }

  /** Creates a new PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return new Status(StatusCode.PERMISSION_DENIED, message, null);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  public boolean isOk() {
    return code == StatusCode.OK;
  }

  public boolean isError() {
    return code != StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
