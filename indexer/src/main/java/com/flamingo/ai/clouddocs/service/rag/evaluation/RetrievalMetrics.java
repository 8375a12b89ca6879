package com.flamingo.ai.clouddocs.service.rag.evaluation;

import java.util.List;

/**
 * Aggregate retrieval quality over a set of evaluation queries.
 *
 * @param total queries run
 * @param passed queries with a relevant hit
 * @param failed queries without one
 * @param precisionAtK {@code passed / total}
 * @param mrr mean reciprocal rank of the first relevant hit, 0 for misses
 * @param avgLatencyMs mean query latency
 * @param grade letter grade derived from {@code precisionAtK}
 */
public record RetrievalMetrics(
    int total,
    int passed,
    int failed,
    double precisionAtK,
    double mrr,
    double avgLatencyMs,
    String grade) {

  public static RetrievalMetrics from(List<EvaluationResult> results) {
    int total = results.size();
    if (total == 0) {
      return new RetrievalMetrics(0, 0, 0, 0, 0, 0, grade(0));
    }
    int passed = (int) results.stream().filter(EvaluationResult::relevantFound).count();
    double reciprocalRanks =
        results.stream()
            .filter(r -> r.topRelevantRank() != null)
            .mapToDouble(r -> 1.0 / r.topRelevantRank())
            .sum();
    double latency = results.stream().mapToLong(EvaluationResult::latencyMs).sum();
    double precision = (double) passed / total;
    return new RetrievalMetrics(
        total,
        passed,
        total - passed,
        precision,
        reciprocalRanks / total,
        latency / total,
        grade(precision));
  }

  /** A+ from 0.9, A from 0.8, B from 0.7, C from 0.6, D from 0.5, F below. */
  public static String grade(double precision) {
    if (precision >= 0.9) {
      return "A+";
    } else if (precision >= 0.8) {
      return "A";
    } else if (precision >= 0.7) {
      return "B";
    } else if (precision >= 0.6) {
      return "C";
    } else if (precision >= 0.5) {
      return "D";
    }
    return "F";
  }
}
