package com.restschema.server.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.restschema.errors.ConfigurationException;
import com.restschema.server.security.AuthMode;
import com.restschema.server.security.User;
import java.util.List;
import java.util.Map;

/**
 * Configuration record for the REST server, read from the process environment.
 *
 * <p>Recognized variables:
 * <ul>
 *   <li>{@code REST_PORT}: listening port, 8080 when unset
 *   <li>{@code AUTH_MODE}: one of {@link AuthMode}, {@code ANONYMOUS} when unset
 *   <li>{@code API_KEYS}: comma separated {@code key=userId} pairs; the same keys are accepted
 *       by the {@code API_KEY} and {@code TOKEN} modes
 *   <li>{@code DEFAULT_PAGE_SIZE} and {@code MAX_PAGE_SIZE}: page size limits of paginated lists
 *   <li>{@code IP_WHITELIST}: comma separated addresses or CIDR blocks accepted by the
 *       {@code X_FORWARDED_FOR} mode
 * </ul>
 *
 * @param restPort The port the Javalin server listens on
 * @param authMode The authentication scheme applied to every request
 * @param apiKeys Users by key, used by key based authentication modes
 * @param defaultPageSize Page size used when a client sends none
 * @param maxPageSize Largest page size a client may ask for
 * @param ipWhitelist Client address ranges trusted by address based authentication
 */
public record ServerConfig(
    int restPort,
    AuthMode authMode,
    ImmutableMap<String, User> apiKeys,
    int defaultPageSize,
    int maxPageSize,
    ImmutableList<String> ipWhitelist) {
  public static final int DEFAULT_REST_PORT = 8080;

  /**
   * Reads the configuration from environment variables.
   *
   * @param env the environment, usually {@link System#getenv()}
   * @throws ConfigurationException when a variable holds an unusable value
   */
  public static ServerConfig fromEnvironment(Map<String, String> env) {
    int port = parseInt(env, "REST_PORT", DEFAULT_REST_PORT);
    if (port < 0 || port > 65535) {
      throw new ConfigurationException("REST_PORT out of range: " + port);
    }
    AuthMode mode;
    try {
      mode = AuthMode.parse(MoreObjects.firstNonNull(env.get("AUTH_MODE"), "ANONYMOUS"));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("unknown AUTH_MODE: " + env.get("AUTH_MODE"), e);
    }
    return new ServerConfig(
        port,
        mode,
        parseApiKeys(Strings.nullToEmpty(env.get("API_KEYS"))),
        parseInt(env, "DEFAULT_PAGE_SIZE", 10),
        parseInt(env, "MAX_PAGE_SIZE", 100),
        ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings()
            .split(Strings.nullToEmpty(env.get("IP_WHITELIST")))));
  }

  private static int parseInt(Map<String, String> env, String name, int fallback) {
    String value = env.get(name);
    if (Strings.isNullOrEmpty(value)) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(name + " is not a number: " + value, e);
    }
  }

  static ImmutableMap<String, User> parseApiKeys(String value) {
    ImmutableMap.Builder<String, User> keys = ImmutableMap.builder();
    for (String pair : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
      List<String> parts = Splitter.on('=').trimResults().limit(2).splitToList(pair);
      if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
        throw new ConfigurationException("API_KEYS entries must look like key=user");
      }
      keys.put(parts.get(0), new User(parts.get(1), parts.get(1)));
    }
    return keys.buildOrThrow();
  }

  /**
   * Returns a string representation of this object without the API keys.
   *
   * @return A string safe for logs, listing only how many keys are configured
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("restPort", restPort())
        .add("authMode", authMode())
        .add("apiKeys", apiKeys().size())
        .add("defaultPageSize", defaultPageSize())
        .add("maxPageSize", maxPageSize())
        .add("ipWhitelist", ipWhitelist())
        .toString();
  }
}
