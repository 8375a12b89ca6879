package com.flamingo.ai.clouddocs.domain.enums;

/** Lifecycle of a documentation page within one crawl run. */
public enum PageStatus {
  /** Discovered from navigation, not yet fetched. */
  PENDING,

  /** Fetch or normalization is in flight. */
  PROCESSING,

  /** Raw and clean documents were stored. */
  SCRAPED,

  /** Fetch or normalization failed; the page is in the failed-page ledger. */
  FAILED;

  /**
   * Returns whether a page in this status may move to {@code next}.
   *
   * @param next the requested status
   * @return true for {@code PENDING -> PROCESSING} and {@code PROCESSING -> SCRAPED|FAILED}
   */
  public boolean canTransitionTo(PageStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING;
      case PROCESSING -> next == SCRAPED || next == FAILED;
      case SCRAPED, FAILED -> false;
    };
  }
}
