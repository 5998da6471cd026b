package com.restschema.common;

import java.util.List;

/**
 * Reference to the document defining a wire format, published in resource descriptions.
 *
 * @param title the document and section, e.g. "RFC-4648 Section 4"
 * @param url where the document can be read
 */
public record TypeSpec(String title, String url) {

  /** The description form: a two element list {@code [title, url]}. */
  public List<String> describe() {
    return List.of(title, url);
  }
}
