package com.restschema.errors;

import com.restschema.common.status.Status;
import com.restschema.common.status.StatusCode;
import java.util.Objects;

/**
 * An error a host turns into an error envelope with the HTTP status of its {@link Status}.
 *
 * <p>Handlers throw these for domain failures ("not found", "conflict"); the dispatcher lets
 * them propagate unchanged. Anything else a handler throws is not a ResourceException and is
 * left entirely to the host.
 */
public class ResourceException extends RuntimeException {
  private final Status status;
  private final String title;

  public ResourceException(Status status) {
    this(status, status.getCode().getTitle());
  }

  protected ResourceException(Status status, String title) {
    super(status.getMessage(), status.getCause());
    if (status.isOk()) {
      throw new IllegalArgumentException("ResourceException requires an error status");
    }
    this.status = status;
    this.title = Objects.requireNonNull(title);
  }

  public static ResourceException notFound(String message) {
    return new ResourceException(Status.notFound(message));
  }

  public static ResourceException unauthenticated(String message) {
    return new ResourceException(Status.unauthenticated(message));
  }

  public static ResourceException permissionDenied(String message) {
    return new ResourceException(Status.permissionDenied(message));
  }

  public static ResourceException conflict(String message) {
    return new ResourceException(Status.of(StatusCode.ALREADY_EXISTS, message));
  }

  public static ResourceException methodNotAllowed(String message) {
    return new ResourceException(Status.of(StatusCode.METHOD_NOT_ALLOWED, message));
  }

  public static ResourceException unsupportedMediaType(String message) {
    return new ResourceException(Status.of(StatusCode.UNSUPPORTED_MEDIA_TYPE, message));
  }

  public static ResourceException badRequest(String message) {
    return new ResourceException(Status.invalidArgument(message));
  }

  public Status getStatus() {
    return status;
  }

  public int getHttpCode() {
    return status.getHttpCode();
  }

  /** Short kind of the failure, used as the error envelope title. */
  public String getTitle() {
    return title;
  }

  /** Full client-facing description, used as the error envelope description. */
  public String getDescription() {
    return status.getMessage() == null ? title : status.getMessage();
  }
}
