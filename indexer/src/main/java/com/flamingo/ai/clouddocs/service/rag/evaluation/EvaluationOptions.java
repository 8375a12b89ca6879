package com.flamingo.ai.clouddocs.service.rag.evaluation;

/**
 * Parameters of an evaluation run.
 *
 * @param topK results checked per query
 * @param queryId run only this query, or null for all
 * @param saveResults write {@code test-results.json} to the logs directory
 * @param hybrid re-rank each query's vector hits with keyword and service scoring
 */
public record EvaluationOptions(int topK, String queryId, boolean saveResults, boolean hybrid) {

  public EvaluationOptions(int topK, String queryId, boolean saveResults) {
    this(topK, queryId, saveResults, false);
  }

  public EvaluationOptions {
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1, got " + topK);
    }
  }
}
