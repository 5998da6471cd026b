package com.restschema.server.rest;

import com.restschema.errors.ResourceException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GsonBodyCodecTest {

    private final GsonBodyCodec codec = new GsonBodyCodec();

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testDecode_KeepsOrderAndNumberKinds() {
        Map<String, Object> decoded = codec.decode(
            bytes("{\"name\": \"Molly\", \"age\": 3, \"weight\": 4.5, \"tags\": [1, 2]}"),
            "application/json; charset=utf-8");
        assertEquals(List.of("name", "age", "weight", "tags"), List.copyOf(decoded.keySet()));
        assertEquals(3L, decoded.get("age"));
        assertEquals(4.5, decoded.get("weight"));
        assertEquals(List.of(1L, 2L), decoded.get("tags"));
    }

    @Test
    void testDecode_MissingContentTypeIsJson() {
        assertEquals(Map.of("a", "b"), codec.decode(bytes("{\"a\": \"b\"}"), null));
    }

    @Test
    void testDecode_EmptyBody() {
        assertTrue(codec.decode(new byte[0], "application/json").isEmpty());
    }

    @Test
    void testDecode_InvalidJson() {
        ResourceException e = assertThrows(ResourceException.class,
            () -> codec.decode(bytes("{\"a\": "), "application/json"));
        assertEquals(400, e.getHttpCode());

        ResourceException array = assertThrows(ResourceException.class,
            () -> codec.decode(bytes("[1, 2]"), "application/json"));
        assertEquals(400, array.getHttpCode());

        ResourceException literal = assertThrows(ResourceException.class,
            () -> codec.decode(bytes("null"), "application/json"));
        assertEquals(400, literal.getHttpCode());
    }

    @Test
    void testDecode_UnsupportedMediaType() {
        ResourceException e = assertThrows(ResourceException.class,
            () -> codec.decode(bytes("name=Molly"), "application/x-www-form-urlencoded"));
        assertEquals(415, e.getHttpCode());
    }

    @Test
    void testEncode_KeepsOrderAndNulls() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", Arrays.asList("a", null));
        payload.put("meta", Map.of("prev", "page=0&page_size=10"));
        payload.put("next", null);
        assertEquals("{\"content\":[\"a\",null],\"meta\":{\"prev\":\"page=0&page_size=10\"},\"next\":null}",
            codec.encode(payload));
        assertEquals("application/json", codec.contentType());
    }
}
