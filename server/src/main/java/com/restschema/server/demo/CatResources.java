package com.restschema.server.demo;

import com.restschema.errors.ResourceException;
import com.restschema.fields.FieldDescriptor;
import com.restschema.fields.FieldTypes;
import com.restschema.pagination.Pagination;
import com.restschema.pagination.PaginationConfig;
import com.restschema.params.Container;
import com.restschema.params.ParamTypes;
import com.restschema.params.ParameterDescriptor;
import com.restschema.params.ParameterSet;
import com.restschema.params.Params;
import com.restschema.resources.BodyCodec;
import com.restschema.resources.Invocation;
import com.restschema.resources.Meta;
import com.restschema.resources.ResourceDispatcher;
import com.restschema.resources.Verb;
import com.restschema.serializers.Serializer;
import com.restschema.server.rest.ResourceRouter;
import com.restschema.server.security.Authorization;
import com.restschema.validation.Validators;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The demo "cats" API.
 *
 * <ul>
 *   <li>{@code /v1/cats}: paginated list filtered by {@code breed}, and POST to create
 *   <li>{@code /v1/cats/{id}}: GET, PUT, PATCH and DELETE of a single cat
 * </ul>
 *
 * <p>Writes require an authenticated user.
 */
public class CatResources {
  public static final String LIST_PATH = "/v1/cats";
  public static final String ITEM_PATH = "/v1/cats/{id}";

  static final Serializer SERIALIZER = Serializer.builder()
      .field(FieldDescriptor.builder("id", FieldTypes.integer())
          .details("Identifier assigned on creation")
          .readOnly(true)
          .build())
      .field(FieldDescriptor.builder("name", FieldTypes.string())
          .details("Name of the cat")
          .required(true)
          .validator(Validators.notBlank())
          .build())
      .field(FieldDescriptor.builder("breed", FieldTypes.string())
          .details("Breed of the cat, null when unknown")
          .nullable(true)
          .build())
      .field(FieldDescriptor.builder("age", FieldTypes.integer())
          .details("Age in years")
          .validator(Validators.range(0, 30))
          .build())
      .build();

  static final ParameterSet LIST_PARAMETERS = ParameterSet.of(
      ParameterDescriptor.builder("breed", ParamTypes.string())
          .details("Only list cats of these breeds, case-insensitive")
          .many(true)
          .container(Container.set())
          .build());

  private final CatStore store;
  private final BodyCodec codec;
  private final PaginationConfig paginationConfig;

  public CatResources(CatStore store, BodyCodec codec, PaginationConfig paginationConfig) {
    this.store = store;
    this.codec = codec;
    this.paginationConfig = paginationConfig;
  }

  /** Adds both cat resources to {@code router}. */
  public void register(ResourceRouter router) {
    router.route(LIST_PATH, catList()).route(ITEM_PATH, catItem());
  }

  public ResourceDispatcher catList() {
    ResourceDispatcher.Builder builder = ResourceDispatcher.builder("CatList")
        .details("List of all cats, newest last")
        .parameters(LIST_PARAMETERS)
        .serializer(SERIALIZER)
        .bodyCodec(codec)
        .on(Verb.GET, this::list)
        .on(Verb.POST, this::create);
    return Pagination.of(paginationConfig).decorate(builder).build();
  }

  public ResourceDispatcher catItem() {
    return ResourceDispatcher.builder("CatItem")
        .details("Single cat")
        .serializer(SERIALIZER)
        .bodyCodec(codec)
        .on(Verb.GET, this::retrieve)
        .on(Verb.PUT, this::replace)
        .on(Verb.PATCH, this::update)
        .on(Verb.DELETE, this::delete)
        .build();
  }

  @SuppressWarnings("unchecked")
  private Object list(Params params, Meta meta, Invocation invocation) {
    int page = params.getAs(Pagination.PAGE, Integer.class);
    int pageSize = params.getAs(Pagination.PAGE_SIZE, Integer.class);
    Collection<String> breeds = (Collection<String>) params.getOrDefault("breed", Set.class, Set.of());
    List<Cat> cats = store.list(breeds, page * pageSize, pageSize + 1);
    meta.put(Pagination.HAS_MORE, cats.size() > pageSize);
    return cats.size() > pageSize ? cats.subList(0, pageSize) : cats;
  }

  private Object create(Params params, Meta meta, Invocation invocation) {
    Authorization.requireUser(invocation);
    return store.create(cat -> SERIALIZER.update(cat, invocation.requireValidated()));
  }

  private Object retrieve(Params params, Meta meta, Invocation invocation) {
    int id = catId(invocation);
    return store.get(id).orElseThrow(() -> notFound(id));
  }

  private Object replace(Params params, Meta meta, Invocation invocation) {
    Authorization.requireUser(invocation);
    int id = catId(invocation);
    return store.replace(id, cat -> SERIALIZER.update(cat, invocation.requireValidated()))
        .orElseThrow(() -> notFound(id));
  }

  private Object update(Params params, Meta meta, Invocation invocation) {
    Authorization.requireUser(invocation);
    int id = catId(invocation);
    return store.update(id, cat -> SERIALIZER.update(cat, invocation.requireValidated()))
        .orElseThrow(() -> notFound(id));
  }

  private Object delete(Params params, Meta meta, Invocation invocation) {
    Authorization.requireUser(invocation);
    int id = catId(invocation);
    if (!store.delete(id)) {
      throw notFound(id);
    }
    return null;
  }

  private static int catId(Invocation invocation) {
    String raw = invocation.routeParam("id");
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw ResourceException.notFound("No cat with id " + raw);
    }
  }

  private static ResourceException notFound(int id) {
    return ResourceException.notFound("No cat with id " + id);
  }
}
