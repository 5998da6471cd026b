package com.restschema.resources;

import com.google.common.collect.ImmutableMap;
import com.restschema.errors.ResourceException;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Everything a handler receives besides parameters and meta.
 *
 * @param validated decoded and validated body keyed by field source, or null when the verb
 *     carries no body or the resource has no serializer
 * @param routeParams captures from the route template
 * @param context per-request values set by the host, such as the authenticated user
 */
public record Invocation(
    @Nullable Map<String, Object> validated,
    ImmutableMap<String, String> routeParams,
    Map<String, Object> context) {

  /**
   * Returns a route capture.
   *
   * @throws ResourceException with status 404 when the route did not capture {@code name}
   */
  public String routeParam(String name) {
    String value = routeParams.get(name);
    if (value == null) {
      throw ResourceException.notFound("no route parameter '" + name + "'");
    }
    return value;
  }

  /** Returns the validated body, failing with 400 when there is none. */
  public Map<String, Object> requireValidated() {
    if (validated == null) {
      throw ResourceException.badRequest("request body is required");
    }
    return validated;
  }

  public <T> Optional<T> contextValue(String key, Class<T> type) {
    Object value = context.get(key);
    return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
  }
}
