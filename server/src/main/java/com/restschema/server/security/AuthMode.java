package com.restschema.server.security;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Supported authentication schemes, each carrying the factory of its {@link Authenticator}.
 *
 * <p>The mode is picked once from configuration; requests never dispatch on authenticator
 * types at runtime.
 *
 * <ul>
 *   <li>{@link #ANONYMOUS}: every request runs as {@link User#ANONYMOUS}
 *   <li>{@link #API_KEY}: the {@code x-api-key} header is looked up in the user storage
 *   <li>{@link #TOKEN}: an {@code Authorization: Token <key>} header is looked up in the user
 *       storage
 *   <li>{@link #X_FORWARDED_FOR}: the client address, taken from the first
 *       {@code X-Forwarded-For} entry or else the connection's remote address, is looked up in
 *       the user storage, usually an {@link IpWhitelistStorage}. Only safe behind a proxy that
 *       controls the header.
 * </ul>
 */
public enum AuthMode {
  ANONYMOUS {
    @Override
    public Authenticator create(UserStorage storage) {
      return new Authenticator(storage) {
        @Override
        public AuthMode mode() {
          return ANONYMOUS;
        }

        @Override
        protected String identify(RequestHeaders headers) {
          return null;
        }

        @Override
        public void authenticate(RequestHeaders headers, Map<String, Object> context) {
          context.putIfAbsent(USER_CONTEXT_KEY, User.ANONYMOUS);
        }
      };
    }
  },

  API_KEY {
    @Override
    public Authenticator create(UserStorage storage) {
      return new ApiKeyAuthenticator(storage);
    }
  },

  TOKEN {
    @Override
    public Authenticator create(UserStorage storage) {
      return new Authenticator(storage) {
        @Override
        public AuthMode mode() {
          return TOKEN;
        }

        @Override
        protected String identify(RequestHeaders headers) {
          return parseToken(headers.header("Authorization"));
        }

        @Override
        public String challenge() {
          return "Token";
        }
      };
    }
  },

  X_FORWARDED_FOR {
    @Override
    public Authenticator create(UserStorage storage) {
      return new Authenticator(storage) {
        @Override
        public AuthMode mode() {
          return X_FORWARDED_FOR;
        }

        @Override
        protected String identify(RequestHeaders headers) {
          return clientAddress(headers);
        }
      };
    }
  };

  /** Creates the authenticator of this mode over {@code storage}. */
  public abstract Authenticator create(UserStorage storage);

  /**
   * Parses a mode name case-insensitively.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static AuthMode parse(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  /** First {@code X-Forwarded-For} entry, falling back to the remote address. */
  @Nullable
  static String clientAddress(RequestHeaders headers) {
    String forwardedFor = headers.header("X-Forwarded-For");
    if (forwardedFor != null) {
      String first = Splitter.on(',').trimResults().split(forwardedFor).iterator().next();
      if (!first.isEmpty()) {
        return first;
      }
    }
    return headers.remoteAddress();
  }

  /** Extracts the key from {@code Token <key>}; anything else yields null. */
  @Nullable
  static String parseToken(@Nullable String header) {
    if (header == null) {
      return null;
    }
    List<String> parts = Splitter.on(' ').omitEmptyStrings().splitToList(header.trim());
    if (parts.size() != 2 || !parts.get(0).equals("Token")) {
      return null;
    }
    return parts.get(1);
  }
}
