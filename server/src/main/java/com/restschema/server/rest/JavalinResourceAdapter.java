package com.restschema.server.rest;

import com.google.common.collect.ImmutableMap;
import com.restschema.common.status.StatusCode;
import com.restschema.errors.ErrorEnvelope;
import com.restschema.resources.BodyCodec;
import com.restschema.resources.ResourceDispatcher;
import com.restschema.resources.ResponseSink;
import com.restschema.resources.RestRequest;
import com.restschema.resources.Verb;
import com.restschema.server.security.Authenticator;
import com.restschema.server.security.RequestHeaders;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Map;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Bridges one Javalin route to a {@link ResourceDispatcher}.
 *
 * <p>For every request the adapter:
 *
 * <ol>
 *   <li>Builds a {@link RestRequest} from the query string, path captures and body
 *   <li>Runs the configured {@link Authenticator}, which fills the request context
 *   <li>Lets the dispatcher handle the request and write the response through a
 *       {@link ResponseSink} over the Javalin context
 * </ol>
 *
 * <p>Errors the dispatcher reports as {@link com.restschema.errors.ResourceException} arrive as
 * regular error envelopes. Anything else thrown while handling the request is logged and
 * answered with a 500 error envelope.
 */
public class JavalinResourceAdapter implements Handler {
  static final ErrorEnvelope INTERNAL_ERROR =
      new ErrorEnvelope(StatusCode.INTERNAL.getTitle(), "The server failed to handle the request");

  private final String path;
  private final ResourceDispatcher dispatcher;
  private final BodyCodec codec;
  private final Authenticator authenticator;

  public JavalinResourceAdapter(
      String path, ResourceDispatcher dispatcher, BodyCodec codec, Authenticator authenticator) {
    this.path = path;
    this.dispatcher = dispatcher;
    this.codec = codec;
    this.authenticator = authenticator;
  }

  @Override
  public void handle(Context ctx) {
    ResponseSink sink = responseSink(ctx);
    Optional<Verb> verb = Verb.parse(ctx.method().name());
    if (verb.isEmpty()) {
      sink.send(405,
          ImmutableMap.of("Allow", String.join(", ", dispatcher.allowedMethods())),
          new ErrorEnvelope("Method Not Allowed", ctx.method() + " is not supported").toMap());
      return;
    }

    RestRequest request = toRestRequest(ctx, verb.get());
    authenticator.authenticate(requestHeaders(ctx), request.context());
    try {
      dispatcher.handle(request, sink);
    } catch (RuntimeException e) {
      Logger.error(e, "Unexpected failure handling {} {}.", verb.get(), ctx.path());
      sink.send(500, ImmutableMap.of(), INTERNAL_ERROR.toMap());
    }
  }

  /** Converts a Javalin request into the transport-neutral form the dispatcher consumes. */
  RestRequest toRestRequest(Context ctx, Verb verb) {
    return RestRequest.builder(verb, path)
        .query(ctx.queryParamMap())
        .routeParams(ctx.pathParamMap())
        .body(ctx.bodyAsBytes(), ctx.contentType())
        .build();
  }

  /** Header and peer address access for authenticators. */
  static RequestHeaders requestHeaders(Context ctx) {
    return new RequestHeaders() {
      @Override
      public String header(String name) {
        return ctx.header(name);
      }

      @Override
      public String remoteAddress() {
        return ctx.ip();
      }
    };
  }

  /** Writes dispatcher responses to a Javalin context, encoding payloads with the codec. */
  ResponseSink responseSink(Context ctx) {
    return (status, headers, payload) -> {
      if (status >= 500) {
        Logger.error("Error response: {} {} - {}", status, ctx.path(), payload);
      } else if (status >= 400) {
        Logger.warn("Error response: {} {} - {}", status, ctx.path(), payload);
      }
      for (Map.Entry<String, String> header : headers.entrySet()) {
        ctx.header(header.getKey(), header.getValue());
      }
      ctx.status(status);
      if (payload != null) {
        ctx.contentType(codec.contentType());
        ctx.result(codec.encode(payload));
      }
    };
  }

  public String getPath() {
    return path;
  }

  public ResourceDispatcher getDispatcher() {
    return dispatcher;
  }
}
