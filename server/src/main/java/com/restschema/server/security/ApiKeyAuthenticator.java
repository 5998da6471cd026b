package com.restschema.server.security;

/**
 * Authenticates callers by the {@code x-api-key} request header.
 */
public class ApiKeyAuthenticator extends Authenticator {
  public static final String API_KEY_HEADER = "x-api-key";

  public ApiKeyAuthenticator(UserStorage storage) {
    super(storage);
  }

  @Override
  public AuthMode mode() {
    return AuthMode.API_KEY;
  }

  @Override
  protected String identify(RequestHeaders headers) {
    String key = headers.header(API_KEY_HEADER);
    return key == null ? null : key.trim();
  }

  @Override
  public String challenge() {
    return "X-Api-Key";
  }
}
