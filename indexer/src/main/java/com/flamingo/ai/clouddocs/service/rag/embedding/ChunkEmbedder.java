package com.flamingo.ai.clouddocs.service.rag.embedding;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.EmbeddingException;
import com.flamingo.ai.clouddocs.service.rag.chunking.Tokenizer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns chunk and query text into unit-length vectors.
 *
 * <p>Input is truncated to the first {@code rag.embedding.max-tokens} words, batches are clamped
 * to [1, {@code rag.embedding.max-batch-size}] and every vector is checked against {@code
 * rag.embedding.dimension}. Each model call goes through the {@code embedding} retry instance.
 */
@Service
@Slf4j
public class ChunkEmbedder {

  static final String RETRY_INSTANCE = "embedding";

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Retry retry;

  public ChunkEmbedder(
      EmbeddingModel embeddingModel,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      RetryRegistry retryRegistry) {
    this.embeddingModel = embeddingModel;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retry = retryRegistry.retry(RETRY_INSTANCE);
  }

  /**
   * Embeds a single text, typically a query.
   *
   * @param text input text
   * @return normalized vector of the configured dimension
   * @throws EmbeddingException if the model fails after retries or returns a wrong dimension
   */
  @Timed(value = "embedding.embed", description = "Time to embed one text")
  public float[] embed(String text) {
    String input = truncate(text);
    Response<Embedding> response;
    try {
      response = retry.executeSupplier(() -> embeddingModel.embed(input));
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "single").increment();
      throw new EmbeddingException("Failed to embed text: " + e.getMessage(), e);
    }
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return normalize(checkDimension(response.content().vector()));
  }

  public Map<String, float[]> embedChunks(List<DocumentChunk> chunks) {
    return embedChunks(chunks, ragConfig.getEmbedding().getBatchSize());
  }

  /**
   * Embeds chunks in batches.
   *
   * @param chunks chunks to embed, in order
   * @param batchSize requested batch size, clamped to the allowed range
   * @return vectors keyed by chunk id, in chunk order
   * @throws EmbeddingException if any batch fails after retries
   */
  @Timed(value = "embedding.embedChunks", description = "Time to embed a list of chunks")
  public Map<String, float[]> embedChunks(List<DocumentChunk> chunks, int batchSize) {
    Map<String, float[]> vectors = new LinkedHashMap<>();
    if (chunks.isEmpty()) {
      return vectors;
    }
    int size = clampBatchSize(batchSize);
    for (int start = 0; start < chunks.size(); start += size) {
      List<DocumentChunk> batch = chunks.subList(start, Math.min(start + size, chunks.size()));
      List<TextSegment> segments = new ArrayList<>(batch.size());
      for (DocumentChunk chunk : batch) {
        segments.add(TextSegment.from(truncate(chunk.embeddingText())));
      }

      List<Embedding> embeddings = embedBatch(segments);
      if (embeddings.size() != batch.size()) {
        throw new EmbeddingException(
            "Model returned " + embeddings.size() + " vectors for " + batch.size() + " chunks");
      }
      for (int i = 0; i < batch.size(); i++) {
        vectors.put(batch.get(i).id(), normalize(checkDimension(embeddings.get(i).vector())));
      }
      log.debug("Embedded batch {}-{} of {}", start, start + batch.size(), chunks.size());
    }
    return vectors;
  }

  public int getDimension() {
    return ragConfig.getEmbedding().getDimension();
  }

  private List<Embedding> embedBatch(List<TextSegment> segments) {
    try {
      List<Embedding> embeddings =
          retry.executeSupplier(() -> embeddingModel.embedAll(segments).content());
      meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
      return embeddings;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
      throw new EmbeddingException(
          "Failed to embed batch of " + segments.size() + ": " + e.getMessage(), e);
    }
  }

  int clampBatchSize(int requested) {
    return Math.max(1, Math.min(requested, ragConfig.getEmbedding().getMaxBatchSize()));
  }

  private String truncate(String text) {
    return Tokenizer.truncateWords(
        text == null ? "" : text, ragConfig.getEmbedding().getMaxTokens());
  }

  private float[] checkDimension(float[] vector) {
    int expected = ragConfig.getEmbedding().getDimension();
    if (vector.length != expected) {
      throw new EmbeddingException(
          "Embedding dimension mismatch: expected " + expected + ", got " + vector.length);
    }
    return vector;
  }

  static float[] normalize(float[] vector) {
    double sum = 0;
    for (float v : vector) {
      sum += (double) v * v;
    }
    if (sum == 0) {
      return vector.clone();
    }
    double norm = Math.sqrt(sum);
    float[] normalized = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      normalized[i] = (float) (vector[i] / norm);
    }
    return normalized;
  }
}
