package com.flamingo.ai.clouddocs.service.rag.evaluation;

import static com.flamingo.ai.clouddocs.support.TestDocuments.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.JsonConfig;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.service.rag.query.QueryResponse;
import com.flamingo.ai.clouddocs.service.rag.query.QueryService;
import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalEvaluator Tests")
class RetrievalEvaluatorTest {

  private static final Instant NOW = Instant.parse("2025-02-01T08:30:00Z");

  @Mock private QueryService queryService;

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = JsonConfig.storageObjectMapper();
  private RagConfig ragConfig;
  private RetrievalEvaluator evaluator;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.setLogsDir(tempDir.resolve("logs").toString());
    evaluator =
        new RetrievalEvaluator(
            queryService, ragConfig, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static SearchResult hit(String service, double score) {
    return SearchResult.ofScore(chunk(service, "page", 0, "content of " + service), score);
  }

  private static EvaluationQuery query(String id, String... expected) {
    return new EvaluationQuery(id, "question " + id, List.of(expected), "Check " + id);
  }

  @Nested
  @DisplayName("Scoring")
  class Scoring {

    @Test
    @DisplayName("Should report the rank of the first relevant hit")
    void shouldReportFirstRelevantRank() {
      EvaluationResult result =
          RetrievalEvaluator.score(
              query("q", "vpc"), List.of(hit("ecs", 0.9), hit("VPC", 0.8), hit("vpc", 0.7)), 30);

      assertThat(result.relevantFound()).isTrue();
      assertThat(result.topRelevantRank()).isEqualTo(2);
      assertThat(result.latencyMs()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should match services containing an expected code")
    void shouldMatchBySubstring() {
      EvaluationResult result =
          RetrievalEvaluator.score(query("q", "rds"), List.of(hit("taurusdb-rds", 0.6)), 5);

      assertThat(result.topRelevantRank()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report no rank when nothing matches")
    void shouldReportMiss() {
      EvaluationResult result =
          RetrievalEvaluator.score(query("q", "cdn"), List.of(hit("ecs", 0.9), hit("obs", 0.8)), 5);

      assertThat(result.relevantFound()).isFalse();
      assertThat(result.topRelevantRank()).isNull();
      assertThat(result.topServices(3)).containsExactly("ecs", "obs");
    }
  }

  @Nested
  @DisplayName("Metrics")
  class Metrics {

    @Test
    @DisplayName("Should aggregate precision, MRR and latency")
    void shouldAggregate() {
      List<EvaluationResult> results =
          List.of(
              new EvaluationResult(query("a", "x"), List.of(), true, 1, 10),
              new EvaluationResult(query("b", "x"), List.of(), true, 2, 20),
              new EvaluationResult(query("c", "x"), List.of(), false, null, 30),
              new EvaluationResult(query("d", "x"), List.of(), true, 4, 40));

      RetrievalMetrics metrics = RetrievalMetrics.from(results);

      assertThat(metrics.total()).isEqualTo(4);
      assertThat(metrics.passed()).isEqualTo(3);
      assertThat(metrics.failed()).isEqualTo(1);
      assertThat(metrics.precisionAtK()).isEqualTo(0.75);
      assertThat(metrics.mrr()).isCloseTo((1 + 0.5 + 0.25) / 4, within(1e-9));
      assertThat(metrics.avgLatencyMs()).isEqualTo(25.0);
      assertThat(metrics.grade()).isEqualTo("B");
    }

    @Test
    @DisplayName("Should produce zero metrics for no results")
    void shouldHandleEmpty() {
      RetrievalMetrics metrics = RetrievalMetrics.from(List.of());

      assertThat(metrics.total()).isZero();
      assertThat(metrics.grade()).isEqualTo("F");
    }

    @ParameterizedTest
    @CsvSource({"1.0, A+", "0.9, A+", "0.85, A", "0.7, B", "0.65, C", "0.5, D", "0.49, F"})
    @DisplayName("Should grade by precision")
    void shouldGrade(double precision, String grade) {
      assertThat(RetrievalMetrics.grade(precision)).isEqualTo(grade);
    }

    @Test
    @DisplayName("Should flag runs where failures exceed the threshold")
    void shouldFlagTooManyFailures() {
      RetrievalMetrics half = new RetrievalMetrics(4, 2, 2, 0.5, 0.5, 1, "D");
      RetrievalMetrics worse = new RetrievalMetrics(4, 1, 3, 0.25, 0.25, 1, "F");

      assertThat(new EvaluationReport(NOW, 5, half, List.of(), 0.5).tooManyFailures()).isFalse();
      assertThat(new EvaluationReport(NOW, 5, worse, List.of(), 0.5).tooManyFailures()).isTrue();
    }
  }

  @Nested
  @DisplayName("Running queries")
  class Running {

    @BeforeEach
    void stubSearch() {
      lenient()
          .when(queryService.search(anyString(), eq(5), isNull(), eq(false)))
          .thenReturn(new QueryResponse("q", List.of(hit("bms", 0.4)), 8));
      lenient()
          .when(queryService.search(eq("How do I create an ECS instance?"), eq(5), isNull(), eq(false)))
          .thenReturn(new QueryResponse("q", List.of(hit("obs", 0.9), hit("ecs", 0.8)), 12));
    }

    @Test
    @DisplayName("Should load the bundled query set")
    void shouldLoadQueries() {
      List<EvaluationQuery> queries = evaluator.loadQueries();

      assertThat(queries).hasSize(15);
      assertThat(queries.get(0).id()).isEqualTo("ecs-create");
      assertThat(queries.get(0).expectedServices()).contains("ecs");
      assertThat(queries).extracting(EvaluationQuery::id).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should run a single query by id")
    void shouldRunSingleQuery() {
      EvaluationReport report = evaluator.evaluate(new EvaluationOptions(5, "ecs-create", false));

      assertThat(report.results()).hasSize(1);
      assertThat(report.results().get(0).topRelevantRank()).isEqualTo(2);
      assertThat(report.metrics().mrr()).isEqualTo(0.5);
      assertThat(report.timestamp()).isEqualTo(NOW);
      assertThat(report.tooManyFailures()).isFalse();
      verify(queryService, times(1)).search(anyString(), eq(5), isNull(), eq(false));
      assertThat(tempDir.resolve("logs")).doesNotExist();
    }

    @Test
    @DisplayName("Should use hybrid retrieval when requested")
    void shouldRunHybridQueries() {
      when(queryService.search(eq("How do I create an ECS instance?"), eq(5), isNull(), eq(true)))
          .thenReturn(new QueryResponse("q", List.of(hit("ecs", 1.2), hit("obs", 0.6)), 15));

      EvaluationReport report =
          evaluator.evaluate(new EvaluationOptions(5, "ecs-create", false, true));

      assertThat(report.results().get(0).topRelevantRank()).isEqualTo(1);
      assertThat(report.metrics().mrr()).isEqualTo(1.0);
      verify(queryService, never()).search(anyString(), eq(5), isNull(), eq(false));
    }

    @Test
    @DisplayName("Should reject an unknown query id")
    void shouldRejectUnknownQueryId() {
      assertThatThrownBy(() -> evaluator.evaluate(new EvaluationOptions(5, "nope", false)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Test query \"nope\" not found");
      verify(queryService, never()).search(anyString(), eq(5), isNull(), eq(false));
    }

    @Test
    @DisplayName("Should run every query and flag the failing run")
    void shouldRunAllQueries() {
      EvaluationReport report = evaluator.evaluate(new EvaluationOptions(5, null, false));

      assertThat(report.results()).hasSize(15);
      assertThat(report.metrics().passed()).isEqualTo(1);
      assertThat(report.metrics().grade()).isEqualTo("F");
      assertThat(report.tooManyFailures()).isTrue();
    }

    @Test
    @DisplayName("Should save detailed results to the logs directory")
    void shouldSaveResults() throws Exception {
      evaluator.evaluate(new EvaluationOptions(5, "ecs-create", true));

      Path file = tempDir.resolve("logs").resolve(RetrievalEvaluator.RESULTS_FILE);
      assertThat(file).exists();
      JsonNode json = objectMapper.readTree(Files.readString(file));
      assertThat(json.get("timestamp").asText()).isEqualTo("2025-02-01T08:30:00Z");
      assertThat(json.get("summary").get("passed").asInt()).isEqualTo(1);
      JsonNode entry = json.get("results").get(0);
      assertThat(entry.get("id").asText()).isEqualTo("ecs-create");
      assertThat(entry.get("topRelevantRank").asInt()).isEqualTo(2);
      assertThat(entry.get("latency").asLong()).isEqualTo(12);
      assertThat(entry.get("topResults")).hasSize(2);
      assertThat(entry.get("topResults").get(1).get("service").asText()).isEqualTo("ecs");
    }
  }
}
