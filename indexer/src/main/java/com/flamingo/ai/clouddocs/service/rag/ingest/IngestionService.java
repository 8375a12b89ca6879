package com.flamingo.ai.clouddocs.service.rag.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.CleanDocument;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.StorageException;
import com.flamingo.ai.clouddocs.service.rag.chunking.SemanticChunker;
import com.flamingo.ai.clouddocs.service.rag.embedding.ChunkEmbedder;
import com.flamingo.ai.clouddocs.service.storage.CleanDocumentStore;
import com.flamingo.ai.clouddocs.vectorstore.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Indexes the clean document store: chunk, embed, add to the vector store.
 *
 * <p>Documents are processed service by service in store order. A document that fails to load,
 * chunk, embed or index is logged, counted and skipped; the run continues with the next one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  static final String STATS_FILE = "ingestion-stats.json";
  static final String ERRORS_FILE = "ingestion-errors.log";
  private static final int PROGRESS_EVERY = 10;

  private final CleanDocumentStore cleanStore;
  private final SemanticChunker chunker;
  private final ChunkEmbedder embedder;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Runs one ingestion.
   *
   * @param options clear, dry-run and batch size
   * @return counts for the run; also written to the logs directory unless it is a dry run
   * @throws StorageException if the stats files cannot be written
   */
  public IngestionStats ingest(IngestionOptions options) {
    Instant start = clock.instant();
    List<String> services = cleanStore.getServices();
    int totalDocuments =
        services.stream().mapToInt(s -> cleanStore.getServiceDocuments(s).size()).sum();
    log.info("Found {} documents in {} services", totalDocuments, services.size());

    if (options.dryRun()) {
      long estimate = Math.round(totalDocuments * IngestionStats.ESTIMATED_CHUNKS_PER_DOCUMENT);
      log.info(
          "Dry run - would process {} documents, estimated ~{} chunks", totalDocuments, estimate);
      return new IngestionStats(
          totalDocuments, 0, 0, estimate, -1, true, start, clock.instant(), List.of());
    }

    vectorStore.initialize();
    if (options.clear()) {
      log.info("Clearing collection {}", vectorStore.getCollectionName());
      vectorStore.clear();
    }

    int batchSize =
        options.batchSize() != null
            ? options.batchSize()
            : ragConfig.getEmbedding().getBatchSize();
    int processed = 0;
    int failed = 0;
    long totalChunks = 0;
    List<String> errors = new ArrayList<>();

    for (int i = 0; i < services.size(); i++) {
      String service = services.get(i);
      List<String> pageIds = cleanStore.getServiceDocuments(service);
      log.info(
          "[{}/{}] Service: {} ({} documents)", i + 1, services.size(), service, pageIds.size());

      int serviceProcessed = 0;
      for (String pageId : pageIds) {
        try {
          totalChunks += ingestDocument(service, pageId, batchSize);
          processed++;
          serviceProcessed++;
          if (serviceProcessed % PROGRESS_EVERY == 0) {
            log.debug("Progress for {}: {}/{}", service, serviceProcessed, pageIds.size());
          }
        } catch (RuntimeException e) {
          failed++;
          String path = service + "/" + pageId;
          errors.add(path + ": " + e.getMessage());
          meterRegistry.counter("ingestion.documents.failed").increment();
          log.error("Failed to ingest {}: {}", path, e.getMessage());
        }
      }
      log.info(
          "Completed {}: {} docs, {} total chunks", service, serviceProcessed, totalChunks);
    }

    vectorStore.flush();
    long collectionSize = vectorStore.getStats().count();
    IngestionStats stats =
        new IngestionStats(
            totalDocuments,
            processed,
            failed,
            totalChunks,
            collectionSize,
            false,
            start,
            clock.instant(),
            errors);
    logSummary(stats);
    writeStats(stats);
    return stats;
  }

  private int ingestDocument(String service, String pageId, int batchSize) {
    Optional<CleanDocument> document = cleanStore.loadDocument(service, pageId);
    if (document.isEmpty()) {
      throw new StorageException(
          cleanStore.getBaseDir().resolve(service).resolve(pageId + ".md").toString(),
          "Document could not be loaded");
    }
    List<DocumentChunk> chunks = chunker.chunkDocument(document.get());
    if (chunks.isEmpty()) {
      log.debug("No chunks for {}/{}", service, pageId);
      return 0;
    }
    Map<String, float[]> embeddings = embedder.embedChunks(chunks, batchSize);
    int written = vectorStore.addChunks(chunks, embeddings);
    meterRegistry.counter("ingestion.chunks.indexed").increment(written);
    return written;
  }

  private void logSummary(IngestionStats stats) {
    log.info(
        "Ingestion complete: {} processed, {} failed, {} chunks in {}s (avg {} chunks/doc)",
        stats.processedDocuments(),
        stats.failedDocuments(),
        stats.totalChunks(),
        stats.duration().toSeconds(),
        String.format("%.1f", stats.averageChunksPerDocument()));
    log.info(
        "Collection {} holds {} vectors", vectorStore.getCollectionName(), stats.collectionSize());
  }

  private void writeStats(IngestionStats stats) {
    Path logsDir = Path.of(ragConfig.getLogsDir());
    Path statsFile = logsDir.resolve(STATS_FILE);
    try {
      Files.createDirectories(logsDir);
      objectMapper.writeValue(statsFile.toFile(), stats);
      log.info("Stats saved to {}", statsFile);
      if (!stats.errors().isEmpty()) {
        Path errorsFile = logsDir.resolve(ERRORS_FILE);
        Files.writeString(errorsFile, String.join("\n", stats.errors()), StandardCharsets.UTF_8);
        log.info("Errors saved to {}", errorsFile);
      }
    } catch (IOException e) {
      throw new StorageException(statsFile.toString(), "Failed to write ingestion stats", e);
    }
  }
}
