package com.restschema.errors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code {"title", "description"}} body sent for every failed request.
 *
 * @param title short kind of the failure
 * @param description what went wrong, aggregated across every offending input
 */
public record ErrorEnvelope(String title, String description) {

  public static ErrorEnvelope from(ResourceException e) {
    return new ErrorEnvelope(e.getTitle(), e.getDescription());
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("title", title);
    map.put("description", description);
    return map;
  }
}
