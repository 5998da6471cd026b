package com.restschema.resources;

import java.util.Map;
import javax.annotation.Nullable;

/** Receives the final response of a dispatched request. */
@FunctionalInterface
public interface ResponseSink {

  /**
   * Sends a response.
   *
   * @param status HTTP status code
   * @param headers extra response headers
   * @param payload envelope map, or null for an empty body
   */
  void send(int status, Map<String, String> headers, @Nullable Object payload);
}
