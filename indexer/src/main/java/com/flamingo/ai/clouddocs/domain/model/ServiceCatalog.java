package com.flamingo.ai.clouddocs.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * The full list of documented services.
 *
 * @param categories categories in catalog order
 * @param fetchedAt when the catalog was obtained
 * @param source where the catalog came from
 */
public record ServiceCatalog(List<ServiceCategory> categories, Instant fetchedAt, Source source) {

  /** Origin of a catalog instance. */
  public enum Source {
    REMOTE,
    CACHED,
    BUILT_IN
  }

  public ServiceCatalog {
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  /** Returns every service across all categories, in catalog order. */
  public List<CloudService> allServices() {
    return categories.stream().flatMap(category -> category.services().stream()).toList();
  }

  public int serviceCount() {
    return categories.stream().mapToInt(category -> category.services().size()).sum();
  }

  public ServiceCatalog withSource(Source newSource) {
    return new ServiceCatalog(categories, fetchedAt, newSource);
  }
}
