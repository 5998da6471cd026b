package com.restschema.server.rest;

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.restschema.errors.ResourceException;
import com.restschema.resources.BodyCodec;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * JSON body codec backed by Gson.
 *
 * <p>Requests must either omit the content type or send {@code application/json}. Numbers
 * decode as {@code Long} when integral and {@code Double} otherwise, so field types see the
 * same values a client sent. Encoded output keeps map order and writes nulls explicitly.
 */
public class GsonBodyCodec implements BodyCodec {
  public static final String JSON = "application/json";

  private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

  private final Gson gson;

  public GsonBodyCodec() {
    this(new GsonBuilder()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .serializeNulls()
        .disableHtmlEscaping()
        .create());
  }

  public GsonBodyCodec(Gson gson) {
    this.gson = gson;
  }

  @Override
  public Map<String, Object> decode(byte[] body, @Nullable String contentType) {
    if (!isJson(contentType)) {
      throw ResourceException.unsupportedMediaType(
          "Content type '" + contentType + "' is not supported, use " + JSON);
    }
    String text = new String(body, StandardCharsets.UTF_8);
    if (text.isBlank()) {
      return new LinkedHashMap<>();
    }
    Map<String, Object> decoded;
    try {
      decoded = gson.fromJson(text, MAP_TYPE);
    } catch (JsonParseException e) {
      throw ResourceException.badRequest("Could not decode body - " + e.getMessage());
    }
    if (decoded == null) {
      throw ResourceException.badRequest("Request body must be a JSON object");
    }
    return decoded;
  }

  @Override
  public String encode(@Nullable Object payload) {
    return gson.toJson(payload);
  }

  @Override
  public String contentType() {
    return JSON;
  }

  private static boolean isJson(@Nullable String contentType) {
    if (Strings.isNullOrEmpty(contentType)) {
      return true;
    }
    String mediaType = contentType.split(";", 2)[0].trim();
    return Ascii.equalsIgnoreCase(mediaType, JSON);
  }
}
