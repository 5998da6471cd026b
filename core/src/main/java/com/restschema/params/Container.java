package com.restschema.params;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Strategy combining the coerced values of a multi-valued parameter into the stored value.
 */
public final class Container {

  /** The container variants. */
  public enum Kind {
    LIST,
    SET,
    CUSTOM
  }

  private static final Container ORDERED_LIST =
      new Container(Kind.LIST, "list", ImmutableList::copyOf);
  private static final Container SET =
      new Container(Kind.SET, "set", values -> Collections.unmodifiableSet(new LinkedHashSet<>(values)));

  private final Kind kind;
  private final String name;
  private final Function<List<Object>, Object> combine;

  private Container(Kind kind, String name, Function<List<Object>, Object> combine) {
    this.kind = kind;
    this.name = name;
    this.combine = combine;
  }

  /** Values kept in arrival order, duplicates included. */
  public static Container orderedList() {
    return ORDERED_LIST;
  }

  /** Duplicates dropped, first arrival order kept. */
  public static Container set() {
    return SET;
  }

  /**
   * Arbitrary reduction of the coerced values.
   *
   * @param name name published in descriptions
   * @param combine receives the coerced values in arrival order
   */
  public static Container custom(String name, Function<List<Object>, Object> combine) {
    return new Container(Kind.CUSTOM, Objects.requireNonNull(name), Objects.requireNonNull(combine));
  }

  public Kind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  /** Combines values; the input list is never modified. */
  public Object combine(List<Object> values) {
    return combine.apply(Collections.unmodifiableList(values));
  }

  @Override
  public String toString() {
    return "Container{" + name + "}";
  }
}
