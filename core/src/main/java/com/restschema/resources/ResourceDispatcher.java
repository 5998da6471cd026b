package com.restschema.resources;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.restschema.errors.AggregateException;
import com.restschema.errors.ConfigurationException;
import com.restschema.errors.ErrorEnvelope;
import com.restschema.errors.ResourceException;
import com.restschema.params.ParameterSet;
import com.restschema.params.Params;
import com.restschema.serializers.Serializer;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Runs the request lifecycle of one resource: parameter resolution, body decoding, handler
 * invocation and content encoding.
 *
 * <p>One dispatcher serves every request routed to its resource, concurrently. It holds only
 * the immutable configuration it was built with; params, meta and the decoded body of a request
 * live on the stack of the {@link #dispatch} call handling it.
 */
public final class ResourceDispatcher {
  static final String DEFAULT_DETAILS = "This resource does not have description yet";

  private final String name;
  private final String details;
  private final ResourceType type;
  private final ParameterSet parameters;
  @Nullable private final Serializer serializer;
  @Nullable private final BodyCodec bodyCodec;
  private final ImmutableMap<Verb, ResourceHandler> handlers;

  private ResourceDispatcher(Builder builder) {
    this.name = builder.name;
    this.details = builder.details;
    this.type = builder.type;
    this.parameters = builder.parameters;
    this.serializer = builder.serializer;
    this.bodyCodec = builder.bodyCodec;
    this.handlers = Maps.immutableEnumMap(builder.handlers);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Dispatches a request to the handler registered for its verb.
   *
   * @return the success envelope
   * @throws ResourceException with status 405 when no handler answers the verb, or with status
   *     400 when parameters or body are invalid, in which case the handler is never called
   * @throws RuntimeException anything the handler or the encode path throws, unchanged
   */
  public Envelope dispatch(RestRequest request) {
    Objects.requireNonNull(request, "request");
    ResourceHandler handler = handlers.get(request.verb());
    if (handler == null) {
      throw ResourceException.methodNotAllowed(
          request.verb() + " is not allowed, allowed methods: " + allowedMethods());
    }

    DispatchState state = DispatchState.RECEIVED;
    try {
      state = transition(state, DispatchState.PARSING_PARAMS);
      Params params = parameters.resolve(request.query());

      Map<String, Object> validated = null;
      if (request.verb().isMutating() && serializer != null) {
        state = transition(state, DispatchState.PARSING_BODY);
        Map<String, Object> raw = bodyCodec.decode(request.body(), request.contentType());
        validated = serializer.decode(raw, request.verb().isPartial());
      }

      state = transition(state, DispatchState.INVOKING);
      Meta meta = new Meta(params.echoMap());
      Object result = handler.handle(
          params, meta, new Invocation(validated, request.routeParams(), request.context()));

      state = transition(state, DispatchState.SERIALIZING);
      Envelope envelope = result == null
          ? new Envelope(null, meta.asMap(), false)
          : new Envelope(encode(result), meta.asMap(), true);

      transition(state, DispatchState.DONE);
      return envelope;
    } catch (AggregateException e) {
      Logger.warn("{} {} rejected while {}: {}", request.verb(), request.path(), state, e.getDescription());
      transition(state, DispatchState.ERROR);
      throw e;
    } catch (RuntimeException e) {
      transition(state, DispatchState.ERROR);
      throw e;
    }
  }

  /**
   * Dispatches a request and writes the response, as a host would. OPTIONS answers with
   * {@link #describe(String)}. Successful POSTs answer 201, DELETEs without content 204, and
   * everything else 200. A {@link ResourceException} becomes an error envelope with its status;
   * any other exception propagates to the host.
   */
  public void handle(RestRequest request, ResponseSink sink) {
    if (request.verb() == Verb.OPTIONS && !handlers.containsKey(Verb.OPTIONS)) {
      sink.send(200, allowHeader(), describe(request.path()));
      return;
    }
    Envelope envelope;
    try {
      envelope = dispatch(request);
    } catch (ResourceException e) {
      Map<String, String> headers = e.getHttpCode() == 405 ? allowHeader() : ImmutableMap.of();
      sink.send(e.getHttpCode(), headers, ErrorEnvelope.from(e).toMap());
      return;
    }
    if (request.verb() == Verb.DELETE && !envelope.hasContent()) {
      sink.send(204, ImmutableMap.of(), null);
    } else if (request.verb() == Verb.POST) {
      sink.send(201, ImmutableMap.of(), envelope.toMap());
    } else {
      sink.send(200, ImmutableMap.of(), envelope.toMap());
    }
  }

  /**
   * Describes this resource. Depends only on configuration, so repeated calls return equal
   * maps with the same key order.
   *
   * @param path the route template supplied by the host
   */
  public Map<String, Object> describe(String path) {
    Map<String, Object> description = new LinkedHashMap<>();
    description.put("name", name);
    description.put("details", details);
    description.put("methods", allowedMethods());
    description.put("path", path);
    description.put("params", parameters.describe());
    description.put("fields", serializer == null ? null : serializer.describe());
    description.put("type", type.wireName());
    return description;
  }

  /** Names of the verbs this resource answers, always including OPTIONS. */
  public List<String> allowedMethods() {
    List<String> methods = new ArrayList<>();
    for (Verb verb : Verb.values()) {
      if (verb == Verb.OPTIONS || handlers.containsKey(verb)) {
        methods.add(verb.name());
      }
    }
    return methods;
  }

  /** Verbs with a registered handler. */
  public ImmutableList<Verb> verbs() {
    return handlers.keySet().asList();
  }

  public String getName() {
    return name;
  }

  public ResourceType getType() {
    return type;
  }

  public ParameterSet getParameters() {
    return parameters;
  }

  @Nullable
  public Serializer getSerializer() {
    return serializer;
  }

  @Nullable
  public BodyCodec getBodyCodec() {
    return bodyCodec;
  }

  private Object encode(Object result) {
    if (serializer == null) {
      return result;
    }
    if (result instanceof Collection) {
      List<Object> encoded = new ArrayList<>(((Collection<?>) result).size());
      for (Object element : (Collection<?>) result) {
        encoded.add(serializer.encode(element));
      }
      return encoded;
    }
    if (result.getClass().isArray()) {
      List<Object> encoded = new ArrayList<>();
      for (int i = 0; i < Array.getLength(result); i++) {
        encoded.add(serializer.encode(Array.get(result, i)));
      }
      return encoded;
    }
    return serializer.encode(result);
  }

  private Map<String, String> allowHeader() {
    return ImmutableMap.of("Allow", String.join(", ", allowedMethods()));
  }

  private DispatchState transition(DispatchState from, DispatchState to) {
    Logger.debug("{}: {} -> {}", name, from, to);
    return to;
  }

  /** Builder for {@link ResourceDispatcher}. */
  public static final class Builder {
    private final String name;
    private String details = DEFAULT_DETAILS;
    private ResourceType type = ResourceType.OBJECT;
    private ParameterSet parameters = ParameterSet.empty();
    private Serializer serializer;
    private BodyCodec bodyCodec;
    private final EnumMap<Verb, ResourceHandler> handlers = new EnumMap<>(Verb.class);

    private Builder(String name) {
      this.name = name;
    }

    public Builder details(String details) {
      this.details = Strings.isNullOrEmpty(details) ? DEFAULT_DETAILS : details;
      return this;
    }

    public Builder type(ResourceType type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    public Builder parameters(ParameterSet parameters) {
      this.parameters = Objects.requireNonNull(parameters, "parameters");
      return this;
    }

    public Builder serializer(@Nullable Serializer serializer) {
      this.serializer = serializer;
      return this;
    }

    public Builder bodyCodec(@Nullable BodyCodec bodyCodec) {
      this.bodyCodec = bodyCodec;
      return this;
    }

    /** Registers the handler for a verb, replacing any earlier one. */
    public Builder on(Verb verb, ResourceHandler handler) {
      handlers.put(Objects.requireNonNull(verb, "verb"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public ParameterSet getParameters() {
      return parameters;
    }

    @Nullable
    public ResourceHandler getHandler(Verb verb) {
      return handlers.get(verb);
    }

    /**
     * Builds the dispatcher.
     *
     * @throws ConfigurationException on an empty name, or when a mutating verb would need to
     *     decode a body but no body codec is set
     */
    public ResourceDispatcher build() {
      if (Strings.isNullOrEmpty(name)) {
        throw new ConfigurationException("resource name must not be empty");
      }
      if (serializer != null && bodyCodec == null
          && handlers.keySet().stream().anyMatch(Verb::isMutating)) {
        throw new ConfigurationException(
            "resource '" + name + "' decodes request bodies but has no body codec");
      }
      return new ResourceDispatcher(this);
    }
  }
}
