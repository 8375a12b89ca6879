package com.flamingo.ai.clouddocs.service.rag.evaluation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.exception.StorageException;
import com.flamingo.ai.clouddocs.service.rag.query.QueryResponse;
import com.flamingo.ai.clouddocs.service.rag.query.QueryService;
import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Runs the fixed retrieval queries against the index and scores them by expected service.
 *
 * <p>A query passes when any of its top-k hits belongs to a service whose lowercased code
 * contains one of the expected codes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEvaluator {

  static final String RESULTS_FILE = "test-results.json";
  private static final TypeReference<List<EvaluationQuery>> QUERY_LIST = new TypeReference<>() {};
  private static final int REPORTED_TOP_RESULTS = 3;

  private final QueryService queryService;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** Loads the query set from {@code rag.evaluation.queries-resource} on the classpath. */
  public List<EvaluationQuery> loadQueries() {
    String resource = ragConfig.getEvaluation().getQueriesResource();
    try (InputStream in = new ClassPathResource(resource).getInputStream()) {
      return objectMapper.readValue(in, QUERY_LIST);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load evaluation queries from " + resource, e);
    }
  }

  /**
   * Runs the evaluation.
   *
   * @param options top-k, optional query id and whether to save results
   * @return metrics and per-query results
   * @throws IllegalArgumentException if {@code queryId} names no known query
   */
  public EvaluationReport evaluate(EvaluationOptions options) {
    List<EvaluationQuery> queries = selectQueries(loadQueries(), options.queryId());
    log.info(
        "Running {} test queries (top-{}, {} retrieval)",
        queries.size(),
        options.topK(),
        options.hybrid() ? "hybrid" : "vector");

    List<EvaluationResult> results = new ArrayList<>(queries.size());
    for (int i = 0; i < queries.size(); i++) {
      EvaluationQuery query = queries.get(i);
      QueryResponse response =
          queryService.search(query.query(), options.topK(), null, options.hybrid());
      EvaluationResult result = score(query, response.results(), response.latencyMs());
      results.add(result);
      if (result.relevantFound()) {
        log.info(
            "[{}/{}] {}: PASS (rank {}, {}ms)",
            i + 1,
            queries.size(),
            query.description(),
            result.topRelevantRank(),
            result.latencyMs());
      } else {
        log.warn(
            "[{}/{}] {}: FAIL (expected {}, got {})",
            i + 1,
            queries.size(),
            query.description(),
            String.join(", ", query.expectedServices()),
            String.join(", ", result.topServices(REPORTED_TOP_RESULTS)));
      }
    }

    EvaluationReport report =
        new EvaluationReport(
            clock.instant(),
            options.topK(),
            RetrievalMetrics.from(results),
            results,
            ragConfig.getEvaluation().getFailureThreshold());
    logSummary(report);
    if (options.saveResults()) {
      saveResults(report);
    }
    return report;
  }

  static List<EvaluationQuery> selectQueries(List<EvaluationQuery> queries, String queryId) {
    if (queryId == null || queryId.isBlank()) {
      return queries;
    }
    List<EvaluationQuery> selected =
        queries.stream().filter(q -> q.id().equals(queryId)).toList();
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("Test query \"" + queryId + "\" not found");
    }
    return selected;
  }

  /** Scores one query's hits against its expected services. */
  static EvaluationResult score(
      EvaluationQuery query, List<SearchResult> results, long latencyMs) {
    Integer topRelevantRank = null;
    for (int rank = 0; rank < results.size(); rank++) {
      String service = results.get(rank).chunk().service().toLowerCase(Locale.ROOT);
      boolean relevant =
          query.expectedServices().stream()
              .anyMatch(expected -> service.contains(expected.toLowerCase(Locale.ROOT)));
      if (relevant) {
        topRelevantRank = rank + 1;
        break;
      }
    }
    return new EvaluationResult(
        query, results, topRelevantRank != null, topRelevantRank, latencyMs);
  }

  private void logSummary(EvaluationReport report) {
    RetrievalMetrics metrics = report.metrics();
    log.info(
        "Test results: {} queries, {} passed, {} failed",
        metrics.total(),
        metrics.passed(),
        metrics.failed());
    log.info(
        "Precision@{}: {}% | MRR: {} | Avg latency: {}ms | Grade: {}",
        report.topK(),
        String.format(Locale.ROOT, "%.1f", metrics.precisionAtK() * 100),
        String.format(Locale.ROOT, "%.3f", metrics.mrr()),
        Math.round(metrics.avgLatencyMs()),
        metrics.grade());
    if (report.tooManyFailures()) {
      log.warn("Too many test failures. Retrieval may need tuning.");
    }
  }

  private void saveResults(EvaluationReport report) {
    Path logsDir = Path.of(ragConfig.getLogsDir());
    Path file = logsDir.resolve(RESULTS_FILE);
    try {
      Files.createDirectories(logsDir);
      objectMapper.writeValue(file.toFile(), toResultsDocument(report));
      log.info("Detailed results saved to {}", file);
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Failed to save evaluation results", e);
    }
  }

  private static Map<String, Object> toResultsDocument(EvaluationReport report) {
    List<Map<String, Object>> entries = new ArrayList<>();
    for (EvaluationResult result : report.results()) {
      EvaluationQuery query = result.query();
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", query.id());
      entry.put("query", query.query());
      entry.put("description", query.description());
      entry.put("expectedServices", query.expectedServices());
      entry.put("relevantFound", result.relevantFound());
      entry.put("topRelevantRank", result.topRelevantRank());
      entry.put("latency", result.latencyMs());
      entry.put(
          "topResults",
          result.results().stream()
              .limit(REPORTED_TOP_RESULTS)
              .map(
                  hit ->
                      Map.of(
                          "service", hit.chunk().service(),
                          "score", hit.score(),
                          "headers", hit.chunk().headers()))
              .toList());
      entries.add(entry);
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("timestamp", report.timestamp());
    document.put("summary", report.metrics());
    document.put("results", entries);
    return document;
  }
}
