package com.flamingo.ai.clouddocs.service.crawl;

import java.util.List;

/**
 * Options of a crawl run.
 *
 * @param services service codes to crawl, empty for the whole catalog; matched case-insensitively
 * @param force re-fetch pages already present in the clean store
 * @param maxPages upper bound on fetched pages across all services, null for no limit
 * @param skipFailed leave out pages currently recorded in the failed-page ledger
 */
public record CrawlOptions(
    List<String> services, boolean force, Integer maxPages, boolean skipFailed) {

  public CrawlOptions {
    services = services == null ? List.of() : List.copyOf(services);
    if (maxPages != null && maxPages < 1) {
      throw new IllegalArgumentException("maxPages must be positive, got " + maxPages);
    }
  }

  public static CrawlOptions defaults() {
    return new CrawlOptions(List.of(), false, null, false);
  }
}
