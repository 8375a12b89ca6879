package com.flamingo.ai.clouddocs.service.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns a raw documentation page into a title and markdown content. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentNormalizer {

  private final HtmlCleaner htmlCleaner;
  private final MarkdownConverter markdownConverter;

  /**
   * Cleans the page markup and converts the remaining content to markdown.
   *
   * <p>The title is read from the original markup, before the page header is removed.
   *
   * @param html raw page markup
   * @return the normalized content, never null
   */
  public NormalizedContent normalize(String html) {
    String title = htmlCleaner.extractTitle(html);
    String cleaned = htmlCleaner.clean(html);
    String markdown = cleaned.isEmpty() ? "" : markdownConverter.convert(cleaned);
    log.debug(
        "Normalized '{}': {} chars of markup, {} chars of markdown",
        title,
        cleaned.length(),
        markdown.length());
    return new NormalizedContent(title, cleaned, markdown);
  }
}
