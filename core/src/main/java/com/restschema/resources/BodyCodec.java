package com.restschema.resources;

import com.restschema.errors.ResourceException;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Converts request bodies to raw mappings and response payloads to text for one content type.
 * The dispatcher only consumes and produces already-decoded mappings.
 */
public interface BodyCodec {

  /**
   * Decodes a request body into a raw representation mapping.
   *
   * @param body the body bytes, possibly empty
   * @param contentType the request content type, or null when the client sent none
   * @throws ResourceException with status 400 for malformed bodies, or 415 for content types
   *     this codec cannot read
   */
  Map<String, Object> decode(byte[] body, @Nullable String contentType);

  /** Encodes a response payload (an envelope map, usually). */
  String encode(@Nullable Object payload);

  /** Content type of encoded payloads. */
  String contentType();
}
