package com.flamingo.ai.clouddocs.service.rag.chunking;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Whitespace tokenizer used for chunk sizing and embedding truncation. */
public final class Tokenizer {

  private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private Tokenizer() {}

  /** Replaces punctuation with spaces and splits on whitespace. */
  public static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String spaced = PUNCTUATION.matcher(text).replaceAll(" ").trim();
    if (spaced.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(WHITESPACE.split(spaced));
  }

  public static int count(String text) {
    return tokenize(text).size();
  }

  /**
   * Keeps the first {@code maxTokens} whitespace-separated words of {@code text}, punctuation
   * intact.
   */
  public static String truncateWords(String text, int maxTokens) {
    if (text == null) {
      return "";
    }
    String[] words = WHITESPACE.split(text.trim());
    if (words.length <= maxTokens) {
      return text;
    }
    return String.join(" ", Arrays.copyOf(words, maxTokens));
  }
}
