package com.restschema.server.rest;

import com.restschema.resources.ResourceDispatcher;
import com.restschema.resources.Verb;
import com.restschema.server.security.AuthMode;
import com.restschema.server.security.InMemoryUserStorage;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ResourceRouterTest {

    @Mock
    private Javalin app;

    private final ResourceRouter router = new ResourceRouter(
        new GsonBodyCodec(), AuthMode.ANONYMOUS.create(new InMemoryUserStorage()));

    private static ResourceDispatcher dispatcher(String name) {
        return ResourceDispatcher.builder(name)
            .on(Verb.GET, (params, meta, invocation) -> "ok")
            .on(Verb.DELETE, (params, meta, invocation) -> null)
            .build();
    }

    @Test
    void testHandlerTypes() {
        assertEquals(List.of(HandlerType.GET, HandlerType.DELETE, HandlerType.OPTIONS),
            ResourceRouter.handlerTypes(dispatcher("Thing")));
    }

    @Test
    void testDuplicateRoute() {
        router.route("/things", dispatcher("Things"));
        assertThrows(IllegalArgumentException.class, () -> router.route("/things", dispatcher("Other")));
    }

    @Test
    void testRegister() {
        router.route("/things", dispatcher("Things")).route("/things/{id}", dispatcher("Thing"));

        router.register(app);

        verify(app).addHttpHandler(eq(HandlerType.GET), eq("/things"), any(JavalinResourceAdapter.class));
        verify(app).addHttpHandler(eq(HandlerType.OPTIONS), eq("/things/{id}"), any(JavalinResourceAdapter.class));
        verify(app, times(6)).addHttpHandler(any(HandlerType.class), any(String.class), any(JavalinResourceAdapter.class));
        assertEquals(List.of("/things", "/things/{id}"), List.copyOf(router.routes().keySet()));
    }
}
