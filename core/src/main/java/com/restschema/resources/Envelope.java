package com.restschema.resources;

import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Successful dispatch result.
 *
 * @param content encoded content, meaningful only when {@code hasContent}
 * @param meta response metadata
 * @param hasContent whether the handler returned anything
 */
public record Envelope(@Nullable Object content, Map<String, Object> meta, boolean hasContent) {

  /** Wire shape: {@code {"content": ..., "meta": ...}} with content left out when absent. */
  public Map<String, Object> toMap() {
    Map<String, Object> envelope = new LinkedHashMap<>();
    if (hasContent) {
      envelope.put("content", content);
    }
    envelope.put("meta", meta);
    return envelope;
  }
}
