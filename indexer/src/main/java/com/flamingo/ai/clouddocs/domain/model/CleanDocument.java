package com.flamingo.ai.clouddocs.domain.model;

import com.flamingo.ai.clouddocs.domain.enums.DocumentCategory;
import java.time.Instant;

/**
 * Normalized markdown derived from a {@link RawHtmlDocument}.
 *
 * @param metadata page metadata, persisted next to the markdown
 * @param content markdown content, never truncated
 */
public record CleanDocument(Metadata metadata, String content) {

  /** Metadata of a normalized page. */
  public record Metadata(
      String id,
      String url,
      String title,
      String service,
      DocumentCategory category,
      String handbookCode,
      int contentLength,
      Instant processedAt) {}
}
