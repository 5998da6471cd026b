package com.restschema.server.security;

import javax.annotation.Nullable;

/** Read access to request headers, independent of the HTTP server. */
@FunctionalInterface
public interface RequestHeaders {

  /** Returns the header value, or null when the request did not send it. */
  @Nullable
  String header(String name);

  /** Address of the peer that opened the connection, or null when unknown. */
  @Nullable
  default String remoteAddress() {
    return null;
  }
}
