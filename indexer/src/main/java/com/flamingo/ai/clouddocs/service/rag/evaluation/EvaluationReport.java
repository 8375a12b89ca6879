package com.flamingo.ai.clouddocs.service.rag.evaluation;

import java.time.Instant;
import java.util.List;

/**
 * Result of an evaluation run.
 *
 * @param timestamp when the run finished
 * @param topK results checked per query
 * @param metrics aggregate metrics
 * @param results per-query outcomes, in query order
 * @param failureThreshold fraction of failing queries above which the run fails
 */
public record EvaluationReport(
    Instant timestamp,
    int topK,
    RetrievalMetrics metrics,
    List<EvaluationResult> results,
    double failureThreshold) {

  public EvaluationReport {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** True when failures exceed {@code failureThreshold} of the queries. */
  public boolean tooManyFailures() {
    return metrics.failed() > metrics.total() * failureThreshold;
  }
}
