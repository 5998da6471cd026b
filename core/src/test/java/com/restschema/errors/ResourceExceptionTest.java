package com.restschema.errors;

import com.restschema.common.status.Status;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceExceptionTest {

    @Test
    void testFactories() {
        assertEquals(404, ResourceException.notFound("x").getHttpCode());
        assertEquals(401, ResourceException.unauthenticated("x").getHttpCode());
        assertEquals(403, ResourceException.permissionDenied("x").getHttpCode());
        assertEquals(409, ResourceException.conflict("x").getHttpCode());
        assertEquals(415, ResourceException.unsupportedMediaType("x").getHttpCode());
        assertEquals(400, ResourceException.badRequest("x").getHttpCode());
    }

    @Test
    void testOkStatusRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceException(Status.ok()));
    }

    @Test
    void testErrorEnvelope() {
        ErrorEnvelope envelope = ErrorEnvelope.from(ResourceException.notFound("No cat with id 3"));
        assertEquals(new ErrorEnvelope("Not Found", "No cat with id 3"), envelope);
        assertEquals(List.of("title", "description"), List.copyOf(envelope.toMap().keySet()));
    }

    @Test
    void testAggregate() {
        ParameterException e = new ParameterException(List.of(
            FieldError.of("a", "missing required parameter"),
            FieldError.of("b", "x is not in [1, 2]")));
        assertEquals("a: missing required parameter; b: x is not in [1, 2]", e.getDescription());
        assertEquals(Map.of("title", "Invalid parameters",
                "description", "a: missing required parameter; b: x is not in [1, 2]"),
            ErrorEnvelope.from(e).toMap());
        assertThrows(IllegalArgumentException.class, () -> new ValidationException(List.of()));
    }
}
