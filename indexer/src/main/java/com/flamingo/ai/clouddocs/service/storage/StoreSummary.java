package com.flamingo.ai.clouddocs.service.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Contents of a store's {@code metadata.json}, written at the end of a crawl.
 *
 * @param timestamp when the summary was written
 * @param totalServices number of service directories
 * @param totalDocuments number of stored documents
 * @param services document count per service code
 */
public record StoreSummary(
    Instant timestamp, int totalServices, int totalDocuments, Map<String, Integer> services) {

  public StoreSummary {
    services = services == null ? Map.of() : Map.copyOf(services);
  }
}
