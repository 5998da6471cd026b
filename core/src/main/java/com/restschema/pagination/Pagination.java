package com.restschema.pagination;

import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.restschema.errors.ConfigurationException;
import com.restschema.params.ParamType;
import com.restschema.params.ParamTypes;
import com.restschema.params.ParameterDescriptor;
import com.restschema.params.ParameterSet;
import com.restschema.params.Params;
import com.restschema.resources.Meta;
import com.restschema.resources.ResourceDispatcher;
import com.restschema.resources.ResourceHandler;
import com.restschema.resources.ResourceType;
import com.restschema.resources.Verb;
import com.restschema.validation.Validators;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a list resource into a paginated one.
 *
 * <p>Adds the {@code page} and {@code page_size} parameters and, after the GET handler ran,
 * the {@code page}, {@code page_size}, {@code prev} and {@code next} meta entries. {@code next}
 * is only set when the handler reported {@code has_more} and a later page can still be
 * addressed. Both links are query strings holding
 * the page parameters followed by every other echoed parameter.
 *
 * <pre>{@code
 * ResourceDispatcher.Builder cats = ResourceDispatcher.builder("CatList")
 *     .on(Verb.GET, (params, meta, invocation) -> store.page(...));
 * Pagination.of(PaginationConfig.defaults()).decorate(cats);
 * }</pre>
 */
public final class Pagination {
  public static final String PAGE = "page";
  public static final String PAGE_SIZE = "page_size";
  public static final String HAS_MORE = "has_more";
  public static final String NEXT = "next";
  public static final String PREV = "prev";

  private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();
  private static final ParamType<Integer> PAGE_TYPE = ParamTypes.integer();

  private final PaginationConfig config;
  private final int lastPage;
  private final ParameterDescriptor<Integer> page;
  private final ParameterDescriptor<Integer> pageSize;

  private Pagination(PaginationConfig config) {
    this.config = config;
    // page * page_size must stay within int range for every accepted page size
    this.lastPage = Integer.MAX_VALUE / config.maxPageSize() - 1;
    this.page = ParameterDescriptor.builder(PAGE, PAGE_TYPE)
        .details("Specifies number of results page for response. Page count starts from 0")
        .defaultValue("0")
        .validator(Validators.range(0, lastPage))
        .build();
    this.pageSize = ParameterDescriptor.builder(PAGE_SIZE, PAGE_TYPE)
        .details("Specifies number of result entries in single response")
        .defaultValue(String.valueOf(config.defaultPageSize()))
        .validator(Validators.range(1, config.maxPageSize()))
        .build();
  }

  public static Pagination of(PaginationConfig config) {
    return new Pagination(Objects.requireNonNull(config, "config"));
  }

  public PaginationConfig getConfig() {
    return config;
  }

  /** Highest page number clients may request. */
  public int getLastPage() {
    return lastPage;
  }

  /**
   * Adds the pagination parameters and wraps the GET handler already registered on
   * {@code builder}. Parameters named {@code page} or {@code page_size} that the resource
   * declares itself are kept.
   *
   * @return the same builder
   * @throws ConfigurationException if the builder has no GET handler
   */
  public ResourceDispatcher.Builder decorate(ResourceDispatcher.Builder builder) {
    ResourceHandler list = builder.getHandler(Verb.GET);
    if (list == null) {
      throw new ConfigurationException("pagination needs a GET handler to wrap");
    }
    ParameterSet declared = builder.getParameters();
    ParameterSet.Builder parameters = declared.toBuilder();
    if (!declared.contains(PAGE)) {
      parameters.add(page);
    }
    if (!declared.contains(PAGE_SIZE)) {
      parameters.add(pageSize);
    }
    return builder
        .parameters(parameters.build())
        .type(ResourceType.LIST)
        .on(Verb.GET, (params, meta, invocation) -> {
          Object result = list.handle(params, meta, invocation);
          addPaginationMeta(params, meta);
          return result;
        });
  }

  /** Writes page, page size and the prev/next links into {@code meta}. */
  public void addPaginationMeta(Params params, Meta meta) {
    int currentPage = intParam(params, PAGE);
    int currentSize = intParam(params, PAGE_SIZE);
    meta.put(PAGE, currentPage);
    meta.put(PAGE_SIZE, currentSize);
    meta.put(PREV, currentPage > 0 ? queryString(params, currentPage - 1, currentSize) : null);
    boolean hasNext = meta.isTrue(HAS_MORE) && currentPage < lastPage;
    meta.put(NEXT, hasNext ? queryString(params, currentPage + 1, currentSize) : null);
  }

  /**
   * Builds the query string of another page, echoing every other resolved parameter with the
   * raw values it was given, in declaration order.
   */
  static String queryString(Params params, int targetPage, int targetSize) {
    StringBuilder query = new StringBuilder()
        .append(PAGE).append('=').append(PAGE_TYPE.format(targetPage))
        .append('&').append(PAGE_SIZE).append('=').append(PAGE_TYPE.format(targetSize));
    for (Map.Entry<String, ImmutableList<String>> entry : params.rawMap().entrySet()) {
      String name = entry.getKey();
      if (name.equals(PAGE) || name.equals(PAGE_SIZE) || !params.isEchoed(name)) {
        continue;
      }
      for (String raw : entry.getValue()) {
        query.append('&').append(ESCAPER.escape(name)).append('=').append(ESCAPER.escape(raw));
      }
    }
    return query.toString();
  }

  private static int intParam(Params params, String name) {
    Object value = params.get(name);
    if (!(value instanceof Number)) {
      throw new IllegalStateException("pagination parameter '" + name + "' did not resolve to a number");
    }
    return ((Number) value).intValue();
  }
}
