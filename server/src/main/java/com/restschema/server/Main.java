package com.restschema.server;

import com.restschema.pagination.PaginationConfig;
import com.restschema.server.config.ServerConfig;
import com.restschema.server.demo.CatResources;
import com.restschema.server.demo.CatStore;
import com.restschema.server.rest.GsonBodyCodec;
import com.restschema.server.rest.ResourceRouter;
import com.restschema.server.security.AuthMode;
import com.restschema.server.security.Authenticator;
import com.restschema.server.security.InMemoryUserStorage;
import com.restschema.server.security.IpWhitelistStorage;
import com.restschema.server.security.User;
import com.restschema.server.security.UserStorage;
import io.javalin.Javalin;
import org.tinylog.Logger;

/**
 * Entry point of the demo REST server.
 *
 * <p>Reads {@link ServerConfig} from the environment, builds the authenticator selected by
 * {@code AUTH_MODE}, registers the cat resources and starts Javalin.
 *
 * <h2>Error Handling</h2>
 *
 * <ul>
 *   <li>Invalid parameters and bodies return 400 Bad Request
 *   <li>Missing authentication returns 401 Unauthorized
 *   <li>Unknown cats return 404 Not Found
 *   <li>Unsupported verbs return 405, other content types 415
 *   <li>Unexpected failures return 500 Internal Server Error
 * </ul>
 */
public class Main {
  static final User WHITELISTED_USER = new User("whitelisted", "Whitelisted client");

  private final ServerConfig config;
  private final ResourceRouter router;
  private Javalin app;

  public Main(ServerConfig config) {
    this.config = config;

    Authenticator authenticator = config.authMode().create(userStorage(config));

    GsonBodyCodec codec = new GsonBodyCodec();
    this.router = new ResourceRouter(codec, authenticator);
    new CatResources(
            new CatStore(),
            codec,
            new PaginationConfig(config.defaultPageSize(), config.maxPageSize()))
        .register(router);
  }

  /** Whitelisted clients for address based authentication, configured API keys otherwise. */
  static UserStorage userStorage(ServerConfig config) {
    if (config.authMode() == AuthMode.X_FORWARDED_FOR) {
      return new IpWhitelistStorage(config.ipWhitelist(), WHITELISTED_USER);
    }
    InMemoryUserStorage storage = new InMemoryUserStorage();
    config.apiKeys().forEach((key, user) -> {
      storage.register(AuthMode.API_KEY, key, user);
      storage.register(AuthMode.TOKEN, key, user);
    });
    return storage;
  }

  public ResourceRouter getRouter() {
    return router;
  }

  public void startJavalinServer() {
    app = Javalin.create();
    router.register(app);
    app.start(config.restPort());
    Logger.info("REST server started, listening on port {}.", config.restPort());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  app.stop();
                }));
  }

  public static void main(String[] args) {
    ServerConfig config = ServerConfig.fromEnvironment(System.getenv());
    Logger.info("Configured server: {}", config.toSecureString());
    new Main(config).startJavalinServer();
  }
}
