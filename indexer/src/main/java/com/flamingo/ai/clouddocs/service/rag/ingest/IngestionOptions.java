package com.flamingo.ai.clouddocs.service.rag.ingest;

/**
 * Parameters of an ingestion run.
 *
 * @param clear empty the collection before indexing
 * @param dryRun only count documents and estimate chunks
 * @param batchSize chunks per embedding call, or null for {@code rag.embedding.batch-size}
 */
public record IngestionOptions(boolean clear, boolean dryRun, Integer batchSize) {

  public IngestionOptions {
    if (batchSize != null && batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
    }
  }

  public static IngestionOptions defaults() {
    return new IngestionOptions(false, false, null);
  }
}
