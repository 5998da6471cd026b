package com.restschema.server.rest;

import com.restschema.resources.BodyCodec;
import com.restschema.resources.ResourceDispatcher;
import com.restschema.server.security.Authenticator;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Collects resource dispatchers by route template and registers them with Javalin.
 *
 * <p>Each dispatcher is registered for every verb it has a handler for, plus OPTIONS, which
 * answers with the resource self-description.
 */
public class ResourceRouter {
  private final Map<String, ResourceDispatcher> routes = new LinkedHashMap<>();
  private final BodyCodec codec;
  private final Authenticator authenticator;

  public ResourceRouter(BodyCodec codec, Authenticator authenticator) {
    this.codec = codec;
    this.authenticator = authenticator;
  }

  /**
   * Adds a resource under a Javalin route template such as {@code /v1/cats/{id}}.
   *
   * @throws IllegalArgumentException if the template is already taken
   */
  public ResourceRouter route(String path, ResourceDispatcher dispatcher) {
    if (routes.putIfAbsent(path, dispatcher) != null) {
      throw new IllegalArgumentException("route " + path + " is already registered");
    }
    return this;
  }

  public Map<String, ResourceDispatcher> routes() {
    return Collections.unmodifiableMap(routes);
  }

  /** Javalin handler types a dispatcher answers. */
  static List<HandlerType> handlerTypes(ResourceDispatcher dispatcher) {
    List<HandlerType> types = new ArrayList<>();
    for (String method : dispatcher.allowedMethods()) {
      types.add(HandlerType.valueOf(method));
    }
    return types;
  }

  /** Registers every collected route on {@code app}. */
  public void register(Javalin app) {
    routes.forEach((path, dispatcher) -> {
      JavalinResourceAdapter adapter =
          new JavalinResourceAdapter(path, dispatcher, codec, authenticator);
      for (HandlerType type : handlerTypes(dispatcher)) {
        app.addHttpHandler(type, path, adapter);
      }
      Logger.info("Registered {} at {} for {}", dispatcher.getName(), path, dispatcher.allowedMethods());
    });
  }
}
