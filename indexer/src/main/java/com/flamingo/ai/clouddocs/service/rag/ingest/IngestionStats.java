package com.flamingo.ai.clouddocs.service.rag.ingest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of an ingestion run, written to {@code ingestion-stats.json}.
 *
 * @param totalDocuments clean documents found
 * @param processedDocuments documents chunked and indexed, including those yielding no chunks
 * @param failedDocuments documents skipped because of an error
 * @param totalChunks chunks written to the vector store, or the estimate for a dry run
 * @param collectionSize vectors in the collection after the run, -1 for a dry run
 * @param dryRun whether anything was indexed
 * @param startTime start of the run
 * @param endTime end of the run
 * @param errors {@code path: message} per failed document
 */
public record IngestionStats(
    int totalDocuments,
    int processedDocuments,
    int failedDocuments,
    long totalChunks,
    long collectionSize,
    boolean dryRun,
    Instant startTime,
    Instant endTime,
    List<String> errors) {

  static final double ESTIMATED_CHUNKS_PER_DOCUMENT = 2.5;

  public IngestionStats {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public Duration duration() {
    return Duration.between(startTime, endTime);
  }

  public double averageChunksPerDocument() {
    return processedDocuments == 0 ? 0 : (double) totalChunks / processedDocuments;
  }
}
