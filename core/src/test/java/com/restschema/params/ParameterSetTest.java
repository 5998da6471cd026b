package com.restschema.params;

import com.restschema.errors.ConfigurationException;
import com.restschema.errors.FieldError;
import com.restschema.errors.ParameterException;
import com.restschema.validation.Validators;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterSetTest {

    private static ParameterSet catFilters() {
        return ParameterSet.of(
            ParameterDescriptor.builder("breed", ParamTypes.string()).build(),
            ParameterDescriptor.builder("x", ParamTypes.integer()).many(true).build(),
            ParameterDescriptor.builder("limit", ParamTypes.integer())
                .defaultValue("10")
                .validator(Validators.max(50))
                .build(),
            ParameterDescriptor.builder("secret", ParamTypes.string()).echo(false).build());
    }

    @Test
    void testResolve_EmptyQueryWithOptionalParams() {
        ParameterSet parameters = ParameterSet.of(
            ParameterDescriptor.builder("a", ParamTypes.string()).build(),
            ParameterDescriptor.builder("b", ParamTypes.integer()).many(true).build());
        Params params = parameters.resolve(Map.of());
        assertEquals(0, params.size());
        assertTrue(params.asMap().isEmpty());
    }

    @Test
    void testResolve_LastOccurrenceIsDeterministic() {
        Map<String, List<String>> query = Map.of("breed", List.of("a", "b"));
        for (int i = 0; i < 5; i++) {
            Params params = catFilters().resolve(query);
            assertEquals("b", params.get("breed"));
            assertEquals(List.of("b"), params.raw("breed"));
        }
    }

    @Test
    void testResolve_ManyPreservesOrder() {
        Params params = catFilters().resolve(Map.of("x", List.of("1", "2", "3")));
        assertEquals(List.of(1, 2, 3), params.get("x"));
        assertEquals(List.of("1", "2", "3"), params.raw("x"));
    }

    @Test
    void testResolve_DefaultIsUsedAsRawValue() {
        Params params = catFilters().resolve(Map.of());
        assertEquals(10, params.get("limit"));
        assertEquals(List.of("10"), params.raw("limit"));
        assertFalse(params.contains("breed"), "absent optional parameters are omitted");
    }

    @Test
    void testResolve_EmptyValueListCountsAsAbsent() {
        Params params = catFilters().resolve(Map.of("limit", List.of()));
        assertEquals(10, params.get("limit"));
    }

    @Test
    void testResolve_AggregatesAllErrors() {
        ParameterSet parameters = ParameterSet.of(
            ParameterDescriptor.builder("id", ParamTypes.integer()).required(true).build(),
            ParameterDescriptor.builder("limit", ParamTypes.integer()).validator(Validators.max(50)).build(),
            ParameterDescriptor.builder("flag", ParamTypes.bool()).build());

        ParameterException e = assertThrows(ParameterException.class,
            () -> parameters.resolve(Map.of("limit", List.of("99"), "flag", List.of("maybe"))));

        assertEquals(400, e.getHttpCode());
        assertEquals(ParameterException.TITLE, e.getTitle());
        assertEquals(List.of("id", "limit", "flag"), e.getNames());
        assertEquals(FieldError.of("id", "missing required parameter"), e.getErrors().get(0));
        assertEquals(FieldError.of("limit", "99 is not <= 50"), e.getErrors().get(1));
    }

    @Test
    void testResolveAll_ReturnsPartialResults() {
        ParameterSet.Resolution resolution = catFilters().resolveAll(
            Map.of("breed", List.of("persian"), "limit", List.of("nope")));
        assertFalse(resolution.isOk());
        assertEquals("persian", resolution.params().get("breed"));
        assertFalse(resolution.params().contains("limit"));
        assertEquals(1, resolution.errors().size());
    }

    @Test
    void testEchoMap_HidesNonEchoedParams() {
        Params params = catFilters().resolve(Map.of("secret", List.of("s3cr3t"), "breed", List.of("a")));
        assertEquals("s3cr3t", params.get("secret"));
        assertFalse(params.echoMap().containsKey("secret"));
        assertEquals(List.of("breed", "limit"), List.copyOf(params.echoMap().keySet()));
        assertFalse(params.isEchoed("secret"));
    }

    @Test
    void testBuild_DuplicateNames() {
        ParameterSet.Builder builder = ParameterSet.builder()
            .add(ParameterDescriptor.builder("a", ParamTypes.string()).build())
            .add(ParameterDescriptor.builder("a", ParamTypes.integer()).build());
        ConfigurationException e = assertThrows(ConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("[a]"), e.getMessage());
    }

    @Test
    void testReplace_KeepsPosition() {
        ParameterSet extended = catFilters().toBuilder()
            .replace(ParameterDescriptor.builder("breed", ParamTypes.integer()).build())
            .build();
        assertEquals(List.of("breed", "x", "limit", "secret"), extended.names());
        assertEquals("integer", extended.get("breed").getType().typeName());
    }

    @Test
    void testDescribe_IsStable() {
        ParameterSet parameters = catFilters();
        assertEquals(parameters.describe(), parameters.describe());
        assertEquals(List.of("breed", "x", "limit", "secret"), List.copyOf(parameters.describe().keySet()));
    }
}
