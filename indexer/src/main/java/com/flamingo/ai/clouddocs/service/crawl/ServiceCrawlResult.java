package com.flamingo.ai.clouddocs.service.crawl;

import java.time.Duration;

/**
 * Outcome of crawling one service.
 *
 * @param service service code
 * @param pagesFound pages listed in the navigation
 * @param pagesScraped pages fetched and stored
 * @param pagesFailed pages that failed and were recorded in the ledger
 * @param pagesSkipped pages left out because they were cached or previously failed
 * @param status overall status
 * @param error service-level error, null unless navigation or processing aborted
 * @param duration wall time spent on the service
 */
public record ServiceCrawlResult(
    String service,
    int pagesFound,
    int pagesScraped,
    int pagesFailed,
    int pagesSkipped,
    Status status,
    String error,
    Duration duration) {

  /** Service-level status. */
  public enum Status {
    SUCCESS,
    PARTIAL,
    ERROR
  }

  static Status statusOf(int scraped, int failed) {
    if (failed == 0) {
      return Status.SUCCESS;
    }
    return scraped == 0 ? Status.ERROR : Status.PARTIAL;
  }

  static ServiceCrawlResult error(String service, String error, Duration duration) {
    return new ServiceCrawlResult(service, 0, 0, 0, 0, Status.ERROR, error, duration);
  }
}
