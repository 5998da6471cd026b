package com.restschema.pagination;

import com.restschema.errors.ConfigurationException;

/**
 * Page size limits of a paginated resource.
 *
 * @param defaultPageSize page size used when the client sends none
 * @param maxPageSize largest page size a client may ask for
 */
public record PaginationConfig(int defaultPageSize, int maxPageSize) {
  public static final int DEFAULT_PAGE_SIZE = 10;
  public static final int MAX_PAGE_SIZE = 100;

  public PaginationConfig {
    if (defaultPageSize < 1) {
      throw new ConfigurationException("defaultPageSize must be positive, got " + defaultPageSize);
    }
    if (maxPageSize < defaultPageSize) {
      throw new ConfigurationException(
          "maxPageSize " + maxPageSize + " is smaller than defaultPageSize " + defaultPageSize);
    }
  }

  public static PaginationConfig defaults() {
    return new PaginationConfig(DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
  }
}
