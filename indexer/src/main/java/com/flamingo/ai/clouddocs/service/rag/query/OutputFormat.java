package com.flamingo.ai.clouddocs.service.rag.query;

import java.util.Locale;

/** Rendering of query results on the console. */
public enum OutputFormat {
  TABLE,
  JSON,
  COMPACT;

  /**
   * Parses a format name case-insensitively.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public static OutputFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return TABLE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown output format '" + value + "', expected table, json or compact", e);
    }
  }
}
