package com.restschema.params;

import com.restschema.common.status.StatusOr;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParamTypesTest {

    enum Color { RED, GREEN }

    @Test
    void testInteger() {
        assertEquals(12, ParamTypes.integer().parse("12").getValue());
        assertEquals(12, ParamTypes.integer().parse(" 12 ").getValue());
        assertTrue(ParamTypes.integer().parse("1.5").isNotOk());
        assertEquals("integer", ParamTypes.integer().typeName());
    }

    @Test
    void testLongAndFloat() {
        assertEquals(10_000_000_000L, ParamTypes.longInteger().parse("10000000000").getValue());
        assertEquals(1.5, ParamTypes.floating().parse("1.5").getValue());
        assertTrue(ParamTypes.floating().parse("abc").isNotOk());
    }

    @Test
    void testDecimal() {
        assertEquals(new BigDecimal("1.10"), ParamTypes.decimal().parse("1.10").getValue());
        StatusOr<BigDecimal> failed = ParamTypes.decimal().parse("ten");
        assertEquals("Could not parse 'ten' value as decimal", failed.getStatus().getMessage());
    }

    @Test
    void testBool() {
        for (String raw : List.of("True", "TRUE", "true", "1", "yes", "Y")) {
            assertEquals(Boolean.TRUE, ParamTypes.bool().parse(raw).getValue(), raw);
        }
        for (String raw : List.of("False", "FALSE", "false", "0", "0.0", "no", "N")) {
            assertEquals(Boolean.FALSE, ParamTypes.bool().parse(raw).getValue(), raw);
        }
        assertTrue(ParamTypes.bool().parse("maybe").isNotOk());
    }

    @Test
    void testBase64() {
        ParamType<String> base64 = ParamTypes.base64();
        assertEquals("cats", base64.parse("Y2F0cw==").getValue());
        assertEquals("Y2F0cw==", base64.format("cats"));
        assertTrue(base64.parse("not base64!").isNotOk());
        assertEquals(List.of("RFC-4648 Section 4", "https://tools.ietf.org/html/rfc4648#section-4"),
            base64.spec().describe());
    }

    @Test
    void testEnumOf() {
        ParamType<Color> color = ParamTypes.enumOf(Color.class);
        assertEquals(Color.GREEN, color.parse("green").getValue());
        assertEquals(Color.RED, color.parse("RED").getValue());
        assertEquals("red", color.format(Color.RED));
        assertTrue(color.parse("blue").isNotOk());
    }
}
