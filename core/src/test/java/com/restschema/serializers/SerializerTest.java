package com.restschema.serializers;

import com.restschema.errors.ConfigurationException;
import com.restschema.errors.FieldError;
import com.restschema.errors.ValidationException;
import com.restschema.fields.FieldDescriptor;
import com.restschema.fields.FieldTypes;
import com.restschema.validation.Validators;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SerializerTest {

    private static Serializer catSerializer() {
        return Serializer.builder()
            .field(FieldDescriptor.builder("name", FieldTypes.raw()).build())
            .field(FieldDescriptor.builder("age", FieldTypes.integer())
                .validator(Validators.range(0, 30))
                .build())
            .build();
    }

    @Test
    void testDecodeThenEncode_KeepsDeclaredOrder() {
        Serializer serializer = catSerializer();
        Map<String, Object> representation = new LinkedHashMap<>();
        representation.put("age", "3");
        representation.put("name", "Molly");

        Map<String, Object> objectDict = serializer.decode(representation, false);
        assertEquals(Map.of("name", "Molly", "age", 3), objectDict);
        assertEquals(List.of("name", "age"), List.copyOf(objectDict.keySet()));

        Map<String, Object> encoded = serializer.encode(objectDict);
        assertEquals(List.of("name", "age"), List.copyOf(encoded.keySet()));
        assertEquals("{name=Molly, age=3}", encoded.toString());
    }

    @Test
    void testPartialDecode_KeysBySource() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("name", FieldTypes.string()).required(true).build())
            .field(FieldDescriptor.builder("age", FieldTypes.integer()).source("age_source").build())
            .build();

        Map<String, Object> objectDict = serializer.decode(Map.of("age", "5"), true);
        assertEquals(Map.of("age_source", 5), objectDict);
    }

    @Test
    void testFullDecode_ReportsMissingRequiredFields() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("name", FieldTypes.string()).required(true).build())
            .field(FieldDescriptor.builder("age", FieldTypes.integer()).source("age_source").build())
            .build();

        ValidationException e = assertThrows(ValidationException.class,
            () -> serializer.decode(Map.of("age", "5"), false));
        assertEquals(List.of(FieldError.of("name", "missing")), e.getErrors());
    }

    @Test
    void testFullDecode_SkipsAbsentOptionalFields() {
        Serializer serializer = catSerializer();
        assertEquals(Map.of("age", 5), serializer.decode(Map.of("age", "5"), false),
            "fields that are not required stay optional on full decodes");
    }

    @Test
    void testDecode_AggregatesFieldErrors() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("name", FieldTypes.string()).build())
            .field(FieldDescriptor.builder("age", FieldTypes.integer())
                .validator(Validators.range(0, 30))
                .build())
            .build();

        ValidationException e = assertThrows(ValidationException.class,
            () -> serializer.decode(Map.of("name", 7, "age", 99), true));
        assertEquals(400, e.getHttpCode());
        assertEquals(ValidationException.TITLE, e.getTitle());
        assertEquals(List.of("name", "age"), e.getNames());
        assertEquals("name: 7 is not a string; age: 99 is not <= 30", e.getDescription());
    }

    @Test
    void testDecode_SkipsReadOnlyAndEncode_SkipsWriteOnly() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("id", FieldTypes.integer()).readOnly(true).build())
            .field(FieldDescriptor.builder("password", FieldTypes.string()).writeOnly(true).build())
            .build();

        assertEquals(Map.of("password", "x"), serializer.decode(Map.of("id", 1, "password", "x"), false));
        assertEquals(Map.of("id", 1), serializer.encode(Map.of("id", 1, "password", "x")));
    }

    @Test
    void testForbidUnknown() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("id", FieldTypes.integer()).readOnly(true).build())
            .field(FieldDescriptor.builder("name", FieldTypes.string()).build())
            .forbidUnknown()
            .build();

        ValidationException e = assertThrows(ValidationException.class,
            () -> serializer.decode(Map.of("id", 1, "name", "Molly", "color", "black"), true));
        assertEquals(2, e.getErrors().size());
        assertTrue(e.getErrors().contains(FieldError.of("id", "forbidden")));
        assertTrue(e.getErrors().contains(FieldError.of("color", "forbidden")));
    }

    @Test
    void testObjectValidator_RunsOnlyWithoutFieldErrors() {
        int[] calls = {0};
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("min", FieldTypes.integer()).build())
            .field(FieldDescriptor.builder("max", FieldTypes.integer()).build())
            .validator((objectDict, partial) -> {
                calls[0]++;
                if (partial) {
                    return List.of();
                }
                return (Integer) objectDict.get("min") > (Integer) objectDict.get("max")
                    ? List.of(FieldError.objectLevel("min must not exceed max"))
                    : List.of();
            })
            .build();

        assertEquals(Map.of("min", 1, "max", 2), serializer.decode(Map.of("min", 1, "max", 2), false));

        ValidationException e = assertThrows(ValidationException.class,
            () -> serializer.decode(Map.of("min", 3, "max", 2), false));
        assertEquals(List.of(FieldError.objectLevel("min must not exceed max")), e.getErrors());
        assertTrue(e.getNames().isEmpty());

        assertThrows(ValidationException.class,
            () -> serializer.decode(Map.of("min", "x", "max", 2), false));
        assertEquals(2, calls[0], "object validator is skipped after field errors");
    }

    @Test
    void testUpdate_WritesThroughAccessors() {
        Serializer serializer = Serializer.builder()
            .field(FieldDescriptor.builder("age", FieldTypes.integer()).source("age_source").build())
            .build();
        Map<String, Object> target = new LinkedHashMap<>();
        serializer.update(target, serializer.decode(Map.of("age", 4), true));
        assertEquals(Map.of("age_source", 4), target);
    }

    @Test
    void testBuild_DuplicateFieldNames() {
        Serializer.Builder builder = Serializer.builder()
            .field(FieldDescriptor.builder("name", FieldTypes.raw()).build())
            .field(FieldDescriptor.builder("name", FieldTypes.string()).build());
        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void testDescribe() {
        Map<String, Object> description = catSerializer().describe();
        assertEquals(List.of("name", "age"), List.copyOf(description.keySet()));
        assertEquals(description, catSerializer().describe());
    }
}
