package com.flamingo.ai.clouddocs.service.crawl;

import com.flamingo.ai.clouddocs.domain.model.FailedPageRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of a crawl or retry run.
 *
 * @param totalServices services targeted by the run
 * @param totalPages pages stored during the run
 * @param services per-service outcomes, in crawl order
 * @param failedPages pages that failed during the run
 * @param timestamp when the run finished
 * @param duration wall time of the run
 */
public record CrawlReport(
    int totalServices,
    int totalPages,
    List<ServiceCrawlResult> services,
    List<FailedPageRecord> failedPages,
    Instant timestamp,
    Duration duration) {

  public CrawlReport {
    services = services == null ? List.of() : List.copyOf(services);
    failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
  }

  public long countWithStatus(ServiceCrawlResult.Status status) {
    return services.stream().filter(s -> s.status() == status).count();
  }
}
