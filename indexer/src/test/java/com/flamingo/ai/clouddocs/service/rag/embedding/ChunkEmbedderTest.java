package com.flamingo.ai.clouddocs.service.rag.embedding;

import static com.flamingo.ai.clouddocs.support.TestDocuments.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkEmbedder Tests")
class ChunkEmbedderTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;
  @Captor private ArgumentCaptor<List<TextSegment>> segmentsCaptor;

  private RagConfig ragConfig;
  private ChunkEmbedder embedder;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(3);
    RetryRegistry retryRegistry =
        RetryRegistry.of(
            RetryConfig.custom().maxAttempts(3).waitDuration(Duration.ofMillis(1)).build());

    embedder = new ChunkEmbedder(embeddingModel, ragConfig, meterRegistry, retryRegistry);
  }

  private static Response<Embedding> single(float... vector) {
    return Response.from(Embedding.from(vector));
  }

  private static Response<List<Embedding>> batchOf(int size) {
    return Response.from(
        IntStream.range(0, size)
            .mapToObj(i -> Embedding.from(new float[] {i + 1f, 0f, 0f}))
            .toList());
  }

  private static List<DocumentChunk> chunks(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> chunk("ecs", "page", i, "content of chunk " + i))
        .toList();
  }

  @Nested
  @DisplayName("embed")
  class Embed {

    @Test
    @DisplayName("Should return a unit-length vector")
    void shouldNormalizeVector() {
      when(embeddingModel.embed(anyString())).thenReturn(single(3f, 4f, 0f));

      float[] vector = embedder.embed("How do I create an ECS?");

      assertThat(vector[0]).isCloseTo(0.6f, within(1e-6f));
      assertThat(vector[1]).isCloseTo(0.8f, within(1e-6f));
      assertThat(vector[2]).isZero();
      verify(meterRegistry.counter("embedding.requests.success", "type", "single")).increment();
    }

    @Test
    @DisplayName("Should reject a vector of the wrong dimension")
    void shouldRejectWrongDimension() {
      when(embeddingModel.embed(anyString())).thenReturn(single(1f, 0f));

      assertThatThrownBy(() -> embedder.embed("query"))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("expected 3, got 2");
    }

    @Test
    @DisplayName("Should retry a failing model call")
    void shouldRetryModelCall() {
      when(embeddingModel.embed(anyString()))
          .thenThrow(new RuntimeException("connection reset"))
          .thenReturn(single(0f, 0f, 2f));

      float[] vector = embedder.embed("query");

      assertThat(vector).containsExactly(0f, 0f, 1f);
      verify(embeddingModel, times(2)).embed(anyString());
    }

    @Test
    @DisplayName("Should wrap the error once retries are exhausted")
    void shouldWrapFinalFailure() {
      when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("model offline"));

      assertThatThrownBy(() -> embedder.embed("query"))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("model offline");
      verify(embeddingModel, times(3)).embed(anyString());
      verify(meterRegistry.counter("embedding.requests.failure", "type", "single")).increment();
    }

    @Test
    @DisplayName("Should truncate input to the configured token limit")
    void shouldTruncateInput() {
      ragConfig.getEmbedding().setMaxTokens(4);
      when(embeddingModel.embed(anyString())).thenReturn(single(1f, 0f, 0f));

      embedder.embed("one two three four five six");

      verify(embeddingModel).embed("one two three four");
    }
  }

  @Nested
  @DisplayName("embedChunks")
  class EmbedChunks {

    @Test
    @DisplayName("Should embed in batches and key vectors by chunk id")
    void shouldEmbedInBatches() {
      when(embeddingModel.embedAll(anyList())).thenReturn(batchOf(2), batchOf(2), batchOf(1));
      List<DocumentChunk> chunks = chunks(5);

      Map<String, float[]> vectors = embedder.embedChunks(chunks, 2);

      assertThat(vectors.keySet())
          .containsExactly(
              "ecs_page_chunk0",
              "ecs_page_chunk1",
              "ecs_page_chunk2",
              "ecs_page_chunk3",
              "ecs_page_chunk4");
      assertThat(vectors.values()).allSatisfy(v -> assertThat(v).containsExactly(1f, 0f, 0f));
      verify(embeddingModel, times(3)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should embed the heading path with the content")
    void shouldEmbedHeaderPath() {
      when(embeddingModel.embedAll(anyList())).thenReturn(batchOf(1));

      embedder.embedChunks(chunks(1), 8);

      verify(embeddingModel).embedAll(segmentsCaptor.capture());
      assertThat(segmentsCaptor.getValue())
          .extracting(TextSegment::text)
          .containsExactly("Guide > Section 0\n\ncontent of chunk 0");
    }

    @Test
    @DisplayName("Should fail when the model returns fewer vectors than chunks")
    void shouldRejectMissingVectors() {
      when(embeddingModel.embedAll(anyList())).thenReturn(batchOf(1));

      assertThatThrownBy(() -> embedder.embedChunks(chunks(2), 2))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("1 vectors for 2 chunks");
    }

    @Test
    @DisplayName("Should not call the model for an empty list")
    void shouldSkipEmptyInput() {
      assertThat(embedder.embedChunks(List.of(), 4)).isEmpty();
    }

    @Test
    @DisplayName("Should clamp the batch size")
    void shouldClampBatchSize() {
      assertThat(embedder.clampBatchSize(0)).isEqualTo(1);
      assertThat(embedder.clampBatchSize(64)).isEqualTo(64);
      assertThat(embedder.clampBatchSize(1000)).isEqualTo(128);
    }
  }
}
