package com.flamingo.ai.clouddocs.service.parser;

/**
 * Output of {@link ContentNormalizer#normalize(String)}.
 *
 * @param title page title, {@code "Untitled"} when none was found
 * @param cleanedHtml main content markup, empty when nothing usable was found
 * @param markdown converted content, empty when conversion produced nothing
 */
public record NormalizedContent(String title, String cleanedHtml, String markdown) {

  public boolean isEmpty() {
    return markdown == null || markdown.isBlank();
  }
}
