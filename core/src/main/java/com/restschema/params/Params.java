package com.restschema.params;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Resolved query parameters of one request, in declaration order.
 *
 * <p>Parameters that were absent and have no default are not present at all, which keeps
 * "not specified" distinguishable from a coerced null. Besides the typed values, every entry
 * remembers the raw strings it was built from so links to related pages can be rebuilt exactly.
 */
public final class Params {
  private static final Params EMPTY = new Params(Map.of(), Map.of(), Set.of());

  private final Map<String, Object> values;
  private final Map<String, ImmutableList<String>> rawValues;
  private final Set<String> hidden;

  Params(Map<String, Object> values, Map<String, ImmutableList<String>> rawValues, Set<String> hidden) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.rawValues = Collections.unmodifiableMap(new LinkedHashMap<>(rawValues));
    this.hidden = Set.copyOf(hidden);
  }

  public static Params empty() {
    return EMPTY;
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  @Nullable
  public Object get(String name) {
    return values.get(name);
  }

  /**
   * Returns the value cast to the given type.
   *
   * @throws ClassCastException if the value has a different type
   */
  @Nullable
  public <T> T getAs(String name, Class<T> type) {
    return type.cast(values.get(name));
  }

  /** Returns the value, or {@code fallback} when the parameter was not resolved. */
  public <T> T getOrDefault(String name, Class<T> type, T fallback) {
    return values.containsKey(name) ? type.cast(values.get(name)) : fallback;
  }

  /** Raw query string values the resolved value was built from. */
  public List<String> raw(String name) {
    ImmutableList<String> raw = rawValues.get(name);
    return raw == null ? ImmutableList.of() : raw;
  }

  /** All resolved values in declaration order. */
  public Map<String, Object> asMap() {
    return values;
  }

  /** Raw values of all resolved parameters in declaration order. */
  public Map<String, ImmutableList<String>> rawMap() {
    return rawValues;
  }

  /** Values that may be echoed back to clients; parameters declared with echo off are left out. */
  public Map<String, Object> echoMap() {
    Map<String, Object> echoed = new LinkedHashMap<>();
    values.forEach((name, value) -> {
      if (!hidden.contains(name)) {
        echoed.put(name, value);
      }
    });
    return echoed;
  }

  public boolean isEchoed(String name) {
    return values.containsKey(name) && !hidden.contains(name);
  }

  public int size() {
    return values.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Params)) {
      return false;
    }
    Params other = (Params) obj;
    return values.equals(other.values) && rawValues.equals(other.rawValues);
  }

  @Override
  public int hashCode() {
    return values.hashCode() * 31 + rawValues.hashCode();
  }

  @Override
  public String toString() {
    return "Params" + values;
  }
}
