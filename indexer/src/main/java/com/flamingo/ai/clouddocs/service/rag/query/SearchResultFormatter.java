package com.flamingo.ai.clouddocs.service.rag.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders {@link QueryResponse}s for the console.
 *
 * <p>{@code TABLE} shows heading path, service, score, URL and a 200 character preview per hit;
 * {@code COMPACT} shows one header line and one score line per hit; {@code JSON} emits the hits
 * with content cut at 500 characters.
 */
@Component
@RequiredArgsConstructor
public class SearchResultFormatter {

  static final int PREVIEW_LENGTH = 200;
  static final int JSON_CONTENT_LENGTH = 500;

  private final ObjectMapper objectMapper;

  public String format(QueryResponse response, OutputFormat format) {
    return switch (format) {
      case JSON -> formatJson(response);
      case COMPACT -> formatCompact(response);
      case TABLE -> formatTable(response);
    };
  }

  private String formatTable(QueryResponse response) {
    StringBuilder sb = new StringBuilder();
    sb.append("Query: \"").append(response.query()).append("\"\n");
    sb.append("Found ")
        .append(response.results().size())
        .append(" results in ")
        .append(response.latencyMs())
        .append("ms\n\n");
    List<SearchResult> results = response.results();
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      DocumentChunk chunk = result.chunk();
      String headers = chunk.headerPath().isEmpty() ? "No headers" : chunk.headerPath();
      sb.append(i + 1).append(". ").append(headers).append('\n');
      sb.append("   Service: ")
          .append(chunk.service())
          .append(" | Score: ")
          .append(percent(result.score()))
          .append('\n');
      sb.append("   URL: ").append(blankToNa(chunk.url())).append('\n');
      sb.append("   Preview: ")
          .append(truncate(chunk.content().replace('\n', ' '), PREVIEW_LENGTH))
          .append("\n\n");
    }
    return sb.toString().stripTrailing();
  }

  private String formatCompact(QueryResponse response) {
    StringBuilder sb = new StringBuilder();
    sb.append("Query: \"")
        .append(response.query())
        .append("\" (")
        .append(response.latencyMs())
        .append("ms)\n");
    List<SearchResult> results = response.results();
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      DocumentChunk chunk = result.chunk();
      sb.append(i + 1)
          .append(". [")
          .append(chunk.service())
          .append("] ")
          .append(chunk.headerPath())
          .append('\n');
      sb.append("   Score: ")
          .append(percent(result.score()))
          .append(" | ")
          .append(blankToNa(chunk.url()))
          .append('\n');
    }
    return sb.toString().stripTrailing();
  }

  private String formatJson(QueryResponse response) {
    List<Map<String, Object>> hits = new ArrayList<>();
    for (SearchResult result : response.results()) {
      DocumentChunk chunk = result.chunk();
      Map<String, Object> hit = new LinkedHashMap<>();
      hit.put("id", chunk.id());
      hit.put("service", chunk.service());
      hit.put("pageId", chunk.pageId());
      hit.put("score", result.score());
      hit.put("headers", chunk.headers());
      hit.put("content", truncate(chunk.content(), JSON_CONTENT_LENGTH));
      hit.put("url", chunk.url());
      hits.add(hit);
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", response.query());
    body.put("latency", response.latencyMs());
    body.put("results", hits);
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query results", e);
    }
  }

  static String percent(double score) {
    return String.format(Locale.ROOT, "%.1f%%", score * 100);
  }

  static String truncate(String text, int max) {
    return text.length() > max ? text.substring(0, max) + "..." : text;
  }

  private static String blankToNa(String value) {
    return value == null || value.isBlank() ? "N/A" : value;
  }
}
