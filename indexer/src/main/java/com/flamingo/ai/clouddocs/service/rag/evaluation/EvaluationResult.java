package com.flamingo.ai.clouddocs.service.rag.evaluation;

import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.util.List;

/**
 * Outcome of one evaluation query.
 *
 * @param query the query
 * @param results retrieved hits, best first
 * @param relevantFound whether any hit belongs to an expected service
 * @param topRelevantRank 1-based rank of the first relevant hit, null when none
 * @param latencyMs time spent embedding and searching
 */
public record EvaluationResult(
    EvaluationQuery query,
    List<SearchResult> results,
    boolean relevantFound,
    Integer topRelevantRank,
    long latencyMs) {

  public EvaluationResult {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** Service codes of the first {@code n} hits. */
  public List<String> topServices(int n) {
    return results.stream().limit(n).map(r -> r.chunk().service()).toList();
  }
}
