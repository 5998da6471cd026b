package com.restschema.resources;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Per-request response metadata. Created fresh for every dispatch with the echoed parameters
 * under {@code params}; handlers and extensions may add any other key.
 */
public final class Meta {
  public static final String PARAMS = "params";

  private final Map<String, Object> values = new LinkedHashMap<>();

  public Meta(Map<String, Object> echoedParams) {
    values.put(PARAMS, echoedParams);
  }

  public Meta put(String key, @Nullable Object value) {
    values.put(key, value);
    return this;
  }

  @Nullable
  public Object get(String key) {
    return values.get(key);
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  /** True only when {@code key} holds {@link Boolean#TRUE}. */
  public boolean isTrue(String key) {
    return Boolean.TRUE.equals(values.get(key));
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> params() {
    return (Map<String, Object>) values.get(PARAMS);
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
