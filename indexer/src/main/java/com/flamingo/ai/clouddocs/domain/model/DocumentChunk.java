package com.flamingo.ai.clouddocs.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * A retrievable slice of a {@link CleanDocument}.
 *
 * @param id {@code {service}_{pageId}_chunk{position}}
 * @param content whitespace-collapsed section body, without the heading path
 * @param service service code
 * @param pageId page id within the service
 * @param headers heading path, outermost first
 * @param url page URL
 * @param position zero-based position within the page
 * @param tokenCount tokens in {@code content}
 */
public record DocumentChunk(
    String id,
    String content,
    String service,
    String pageId,
    List<String> headers,
    String url,
    int position,
    int tokenCount) {

  public static final String HEADER_SEPARATOR = " > ";

  public DocumentChunk {
    headers = headers == null ? List.of() : List.copyOf(headers);
  }

  public static String chunkId(String service, String pageId, int position) {
    return service + "_" + pageId + "_chunk" + position;
  }

  /** Heading path joined with {@code " > "}, empty when the chunk has no heading. */
  @JsonIgnore
  public String headerPath() {
    return String.join(HEADER_SEPARATOR, headers);
  }

  /** Text sent to the embedding model: the heading path followed by the content. */
  @JsonIgnore
  public String embeddingText() {
    return headers.isEmpty() ? content : headerPath() + "\n\n" + content;
  }
}
