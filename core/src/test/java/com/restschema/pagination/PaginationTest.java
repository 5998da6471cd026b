package com.restschema.pagination;

import com.restschema.errors.ConfigurationException;
import com.restschema.errors.ParameterException;
import com.restschema.params.ParamTypes;
import com.restschema.params.ParameterDescriptor;
import com.restschema.params.ParameterSet;
import com.restschema.resources.Envelope;
import com.restschema.resources.ResourceDispatcher;
import com.restschema.resources.ResourceType;
import com.restschema.resources.RestRequest;
import com.restschema.resources.Verb;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PaginationTest {

    private static ResourceDispatcher paginated(ParameterSet parameters, boolean hasMore) {
        ResourceDispatcher.Builder builder = ResourceDispatcher.builder("Things")
            .parameters(parameters)
            .on(Verb.GET, (params, meta, invocation) -> {
                meta.put(Pagination.HAS_MORE, hasMore);
                return List.of();
            });
        return Pagination.of(PaginationConfig.defaults()).decorate(builder).build();
    }

    @Test
    void testNextAndPrev() {
        ResourceDispatcher dispatcher = paginated(ParameterSet.empty(), true);

        Envelope envelope = dispatcher.dispatch(RestRequest.builder(Verb.GET, "/things")
            .query("page", "2")
            .query("page_size", "10")
            .build());

        Map<String, Object> meta = envelope.meta();
        assertEquals(Map.of("page", 2, "page_size", 10), meta.get("params"));
        assertEquals(2, meta.get("page"));
        assertEquals(10, meta.get("page_size"));
        assertEquals("page=3&page_size=10", meta.get("next"));
        assertEquals("page=1&page_size=10", meta.get("prev"));
    }

    @Test
    void testDefaults_FirstPageHasNoPrev() {
        Envelope envelope = paginated(ParameterSet.empty(), true)
            .dispatch(RestRequest.builder(Verb.GET, "/things").build());

        assertEquals(0, envelope.meta().get("page"));
        assertEquals(PaginationConfig.DEFAULT_PAGE_SIZE, envelope.meta().get("page_size"));
        assertNull(envelope.meta().get("prev"));
        assertEquals("page=1&page_size=10", envelope.meta().get("next"));
    }

    @Test
    void testNoNextWithoutMore() {
        Envelope envelope = paginated(ParameterSet.empty(), false)
            .dispatch(RestRequest.builder(Verb.GET, "/things").query("page", "1").build());
        assertNull(envelope.meta().get("next"));
        assertEquals("page=0&page_size=10", envelope.meta().get("prev"));
    }

    @Test
    void testLinksEchoOtherParams() {
        ParameterSet parameters = ParameterSet.of(
            ParameterDescriptor.builder("breed", ParamTypes.string()).many(true).build(),
            ParameterDescriptor.builder("q", ParamTypes.string()).build(),
            ParameterDescriptor.builder("key", ParamTypes.string()).echo(false).build());

        Envelope envelope = paginated(parameters, true).dispatch(RestRequest.builder(Verb.GET, "/things")
            .query("q", "black cat")
            .query("breed", "siamese", "maine coon")
            .query("key", "hidden")
            .query("page_size", "5")
            .build());

        assertEquals("page=1&page_size=5&breed=siamese&breed=maine+coon&q=black+cat",
            envelope.meta().get("next"));
    }

    @Test
    void testPageValidation() {
        ResourceDispatcher dispatcher = paginated(ParameterSet.empty(), false);

        ParameterException e = assertThrows(ParameterException.class, () -> dispatcher.dispatch(
            RestRequest.builder(Verb.GET, "/things")
                .query("page", "-1")
                .query("page_size", "101")
                .build()));
        assertEquals(List.of("page", "page_size"), e.getNames());
        assertEquals("page: -1 is not >= 0; page_size: 101 is not <= 100", e.getDescription());

        assertThrows(ParameterException.class, () -> dispatcher.dispatch(
            RestRequest.builder(Verb.GET, "/things").query("page_size", "0").build()));
    }

    @Test
    void testLastPage_HasNoNextAndLaterPagesAreRejected() {
        Pagination pagination = Pagination.of(PaginationConfig.defaults());
        assertEquals(Integer.MAX_VALUE / 100 - 1, pagination.getLastPage());
        ResourceDispatcher dispatcher = paginated(ParameterSet.empty(), true);

        Envelope envelope = dispatcher.dispatch(RestRequest.builder(Verb.GET, "/things")
            .query("page", String.valueOf(pagination.getLastPage()))
            .build());
        assertNull(envelope.meta().get("next"));
        assertEquals("page=" + (pagination.getLastPage() - 1) + "&page_size=10", envelope.meta().get("prev"));

        ParameterException e = assertThrows(ParameterException.class, () -> dispatcher.dispatch(
            RestRequest.builder(Verb.GET, "/things").query("page", String.valueOf(Integer.MAX_VALUE)).build()));
        assertEquals(List.of("page"), e.getNames());
    }

    @Test
    void testDecorate_MarksListAndDescribesParams() {
        ResourceDispatcher dispatcher = paginated(ParameterSet.empty(), false);
        assertEquals(ResourceType.LIST, dispatcher.getType());
        Map<String, Object> description = dispatcher.describe("/things");
        assertEquals("list", description.get("type"));
        assertEquals(List.of("page", "page_size"),
            List.copyOf(((Map<?, ?>) description.get("params")).keySet()));
    }

    @Test
    void testDecorate_KeepsDeclaredPageParameter() {
        ParameterSet parameters = ParameterSet.of(
            ParameterDescriptor.builder("page", ParamTypes.integer()).defaultValue("3").build());
        Envelope envelope = paginated(parameters, false)
            .dispatch(RestRequest.builder(Verb.GET, "/things").build());
        assertEquals(3, envelope.meta().get("page"));
    }

    @Test
    void testDecorate_RequiresGetHandler() {
        assertThrows(ConfigurationException.class,
            () -> Pagination.of(PaginationConfig.defaults()).decorate(ResourceDispatcher.builder("Empty")));
    }

    @Test
    void testConfigValidation() {
        assertThrows(ConfigurationException.class, () -> new PaginationConfig(0, 10));
        assertThrows(ConfigurationException.class, () -> new PaginationConfig(20, 10));
        assertEquals(new PaginationConfig(10, 100), PaginationConfig.defaults());
    }
}
