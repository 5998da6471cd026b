package com.restschema.resources;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Transport-neutral view of one request, built by the host adapter.
 *
 * @param verb the request method
 * @param path the route template the request matched, used in self-descriptions
 * @param query raw query string values per name, in arrival order
 * @param body raw body bytes, empty when the request had none
 * @param contentType the request content type, or null
 * @param routeParams captures from the route template
 * @param context mutable per-request values, filled by host middleware such as authentication
 */
public record RestRequest(
    Verb verb,
    String path,
    ImmutableMap<String, ImmutableList<String>> query,
    byte[] body,
    @Nullable String contentType,
    ImmutableMap<String, String> routeParams,
    Map<String, Object> context) {

  public RestRequest {
    Objects.requireNonNull(verb, "verb");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(query, "query");
    body = body == null ? new byte[0] : body;
    Objects.requireNonNull(routeParams, "routeParams");
    Objects.requireNonNull(context, "context");
  }

  public static Builder builder(Verb verb, String path) {
    return new Builder(verb, path);
  }

  public boolean hasBody() {
    return body.length > 0;
  }

  /** Builder for {@link RestRequest}; the context starts empty and stays mutable. */
  public static final class Builder {
    private final Verb verb;
    private final String path;
    private final Map<String, List<String>> query = new LinkedHashMap<>();
    private byte[] body = new byte[0];
    private String contentType;
    private final Map<String, String> routeParams = new LinkedHashMap<>();
    private final Map<String, Object> context = new HashMap<>();

    private Builder(Verb verb, String path) {
      this.verb = verb;
      this.path = path;
    }

    /** Appends values for a query parameter, keeping earlier ones. */
    public Builder query(String name, String... values) {
      query.computeIfAbsent(name, k -> new ArrayList<>()).addAll(List.of(values));
      return this;
    }

    public Builder query(Map<String, ? extends List<String>> values) {
      values.forEach((name, list) -> query(name, list.toArray(new String[0])));
      return this;
    }

    public Builder body(byte[] body, @Nullable String contentType) {
      this.body = body;
      this.contentType = contentType;
      return this;
    }

    public Builder routeParam(String name, String value) {
      routeParams.put(name, value);
      return this;
    }

    public Builder routeParams(Map<String, String> values) {
      routeParams.putAll(values);
      return this;
    }

    public Builder context(String key, Object value) {
      context.put(key, value);
      return this;
    }

    public RestRequest build() {
      ImmutableMap.Builder<String, ImmutableList<String>> frozen = ImmutableMap.builder();
      query.forEach((name, values) -> frozen.put(name, ImmutableList.copyOf(values)));
      return new RestRequest(
          verb, path, frozen.build(), body, contentType, ImmutableMap.copyOf(routeParams), context);
    }
  }
}
