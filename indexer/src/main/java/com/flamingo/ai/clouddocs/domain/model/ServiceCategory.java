package com.flamingo.ai.clouddocs.domain.model;

import java.util.List;

/** Display grouping of services in the catalog. Not used for indexing. */
public record ServiceCategory(
    String code, String name, String enName, List<CloudService> services) {

  public ServiceCategory {
    services = services == null ? List.of() : List.copyOf(services);
  }
}
