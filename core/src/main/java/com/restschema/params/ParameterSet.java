package com.restschema.params;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.restschema.common.status.StatusOr;
import com.restschema.errors.ConfigurationException;
import com.restschema.errors.FieldError;
import com.restschema.errors.ParameterException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Ordered collection of parameter descriptors bound to one resource.
 *
 * <p>A parameter set is built once when the resource is defined and then resolves the query
 * string of every request routed to it. Resolution works only on its arguments and the
 * immutable descriptors, so one set can serve concurrent requests.
 */
public final class ParameterSet {
  private static final ParameterSet EMPTY = new ParameterSet(ImmutableMap.of());

  private final ImmutableMap<String, ParameterDescriptor<?>> descriptors;

  private ParameterSet(ImmutableMap<String, ParameterDescriptor<?>> descriptors) {
    this.descriptors = descriptors;
  }

  public static ParameterSet empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ParameterSet of(ParameterDescriptor<?>... descriptors) {
    Builder builder = builder();
    for (ParameterDescriptor<?> descriptor : descriptors) {
      builder.add(descriptor);
    }
    return builder.build();
  }

  /** Returns a builder holding this set's descriptors, for extending it. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    descriptors.values().forEach(builder::add);
    return builder;
  }

  /**
   * Outcome of resolving a query string without failing.
   *
   * @param params every parameter that resolved successfully
   * @param errors one entry per parameter that could not be resolved, in declaration order
   */
  public record Resolution(Params params, ImmutableList<FieldError> errors) {
    public boolean isOk() {
      return errors.isEmpty();
    }
  }

  /**
   * Resolves a query string, collecting every problem instead of stopping at the first one.
   *
   * @param query raw values per parameter name, in arrival order
   * @return resolved values and errors
   */
  public Resolution resolveAll(Map<String, ? extends List<String>> query) {
    Objects.requireNonNull(query, "query");
    Map<String, Object> values = new LinkedHashMap<>();
    Map<String, ImmutableList<String>> rawValues = new LinkedHashMap<>();
    Set<String> hidden = new HashSet<>();
    List<FieldError> errors = new ArrayList<>();

    for (ParameterDescriptor<?> descriptor : descriptors.values()) {
      String name = descriptor.getName();
      List<String> raw = query.get(name);

      if (raw == null || raw.isEmpty()) {
        if (descriptor.isRequired()) {
          errors.add(FieldError.of(name, "missing required parameter"));
          continue;
        } else if (descriptor.getDefaultValue() != null) {
          raw = List.of(descriptor.getDefaultValue());
        } else {
          continue;
        }
      }

      StatusOr<Object> value = descriptor.coerce(raw);
      if (value.isNotOk()) {
        errors.add(FieldError.of(name, value.getStatus().getMessage()));
        continue;
      }
      values.put(name, value.getValue());
      rawValues.put(name, descriptor.isMany()
          ? ImmutableList.copyOf(raw)
          : ImmutableList.of(raw.get(raw.size() - 1)));
      if (!descriptor.isEcho()) {
        hidden.add(name);
      }
    }
    return new Resolution(new Params(values, rawValues, hidden), ImmutableList.copyOf(errors));
  }

  /**
   * Resolves a query string.
   *
   * @param query raw values per parameter name, in arrival order
   * @return the resolved parameters
   * @throws ParameterException listing every missing or invalid parameter
   */
  public Params resolve(Map<String, ? extends List<String>> query) {
    Resolution resolution = resolveAll(query);
    if (!resolution.isOk()) {
      throw new ParameterException(resolution.errors());
    }
    return resolution.params();
  }

  /** Describes every parameter in declaration order. */
  public Map<String, Object> describe() {
    Map<String, Object> description = new LinkedHashMap<>();
    descriptors.forEach((name, descriptor) -> description.put(name, descriptor.describe()));
    return description;
  }

  @Nullable
  public ParameterDescriptor<?> get(String name) {
    return descriptors.get(name);
  }

  public boolean contains(String name) {
    return descriptors.containsKey(name);
  }

  public ImmutableList<ParameterDescriptor<?>> descriptors() {
    return descriptors.values().asList();
  }

  public List<String> names() {
    return descriptors.keySet().asList();
  }

  public int size() {
    return descriptors.size();
  }

  /**
   * Builder for {@link ParameterSet}; keeps the order descriptors were added in.
   */
  public static final class Builder {
    private final Map<String, ParameterDescriptor<?>> descriptors = new LinkedHashMap<>();
    private final List<String> duplicates = new ArrayList<>();

    private Builder() {}

    /** Adds a parameter; a second parameter with the same name fails {@link #build()}. */
    public Builder add(ParameterDescriptor<?> descriptor) {
      Objects.requireNonNull(descriptor, "descriptor");
      if (descriptors.putIfAbsent(descriptor.getName(), descriptor) != null) {
        duplicates.add(descriptor.getName());
      }
      return this;
    }

    /** Adds a parameter, overriding an existing one with the same name in its original position. */
    public Builder replace(ParameterDescriptor<?> descriptor) {
      descriptors.put(descriptor.getName(), descriptor);
      return this;
    }

    public Builder addAll(ParameterSet other) {
      other.descriptors().forEach(this::add);
      return this;
    }

    /**
     * Builds the set.
     *
     * @throws ConfigurationException if two parameters share a name
     */
    public ParameterSet build() {
      if (!duplicates.isEmpty()) {
        throw new ConfigurationException("duplicate parameter names: " + duplicates);
      }
      return new ParameterSet(ImmutableMap.copyOf(descriptors));
    }
  }
}
