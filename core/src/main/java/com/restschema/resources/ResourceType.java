package com.restschema.resources;

import java.util.Locale;

/** Shape of a resource's content: a single object or a list of them. */
public enum ResourceType {
  OBJECT,
  LIST;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
