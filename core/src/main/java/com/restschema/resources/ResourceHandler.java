package com.restschema.resources;

import com.restschema.params.Params;
import javax.annotation.Nullable;

/**
 * Application code answering one verb of a resource. Handlers only ever see fully resolved
 * parameters and, for mutating verbs, a validated body.
 */
@FunctionalInterface
public interface ResourceHandler {

  /**
   * Handles a request.
   *
   * @param params resolved query parameters
   * @param meta response metadata, already holding the echoed parameters
   * @param invocation validated body, route parameters and request context
   * @return a domain object, a collection or array of them, or null for no content
   */
  @Nullable
  Object handle(Params params, Meta meta, Invocation invocation);
}
