package com.flamingo.ai.clouddocs.service.crawl.fetch;

/**
 * Progress event emitted once per completed page, in completion order.
 *
 * @param completed pages completed so far, including this one
 * @param total pages submitted
 * @param pageId the page that just completed
 * @param success whether it was fetched
 */
public record FetchProgress(int completed, int total, String pageId, boolean success) {

  public int percent() {
    return total > 0 ? (int) Math.round(completed * 100.0 / total) : 100;
  }
}
