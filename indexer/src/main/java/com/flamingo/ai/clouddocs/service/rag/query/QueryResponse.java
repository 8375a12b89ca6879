package com.flamingo.ai.clouddocs.service.rag.query;

import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.util.List;

/**
 * Results of one query.
 *
 * @param query the query text
 * @param results hits, best first
 * @param latencyMs time spent embedding and searching
 */
public record QueryResponse(String query, List<SearchResult> results, long latencyMs) {

  public QueryResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
