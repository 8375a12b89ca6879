package com.flamingo.ai.clouddocs.service.crawl.fetch;

import com.flamingo.ai.clouddocs.domain.model.RawHtmlDocument;
import com.flamingo.ai.clouddocs.exception.FetchException;

/**
 * Outcome of fetching one page. Exactly one of {@code document} and {@code error} is set.
 *
 * @param pageId page id
 * @param url fetched URL
 * @param service service code
 * @param document raw page on success
 * @param error human-readable failure description
 * @param cause classified failure, null on success
 * @param attempts attempts spent
 */
public record FetchResult(
    String pageId,
    String url,
    String service,
    RawHtmlDocument document,
    String error,
    FetchException cause,
    int attempts) {

  public static FetchResult success(
      String pageId, String url, String service, RawHtmlDocument document, int attempts) {
    return new FetchResult(pageId, url, service, document, null, null, attempts);
  }

  public static FetchResult failure(
      String pageId, String url, String service, FetchException cause, int attempts) {
    String message = "Failed after " + attempts + " attempts: " + cause.getMessage();
    return new FetchResult(pageId, url, service, null, message, cause, attempts);
  }

  public boolean success() {
    return document != null;
  }
}
