package com.flamingo.ai.clouddocs.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Raw page markup as returned by the documentation site.
 *
 * @param metadata response metadata, persisted next to the markup
 * @param html the response body
 */
public record RawHtmlDocument(Metadata metadata, String html) {

  /**
   * @param id page id
   * @param url fetched URL
   * @param service service code
   * @param status HTTP status of the response
   * @param headers response headers, first value per name
   * @param fetchedAt when the response completed
   * @param contentType response content type, may be null
   * @param contentLength length of the body in characters
   */
  public record Metadata(
      String id,
      String url,
      String service,
      int status,
      Map<String, String> headers,
      Instant fetchedAt,
      String contentType,
      int contentLength) {

    public Metadata {
      headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
  }
}
