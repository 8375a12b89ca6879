package com.flamingo.ai.clouddocs.service.rag.chunking;

import com.flamingo.ai.clouddocs.config.RagConfig;

/**
 * Token limits for {@link SemanticChunker}.
 *
 * @param targetSize preferred chunk size
 * @param maxSize sections above this are split at paragraph boundaries
 * @param minSize sections and trailing buffers below this are dropped
 */
public record ChunkingOptions(int targetSize, int maxSize, int minSize) {

  public static final ChunkingOptions DEFAULT = new ChunkingOptions(500, 1000, 100);

  public ChunkingOptions {
    if (minSize < 0 || maxSize <= 0 || minSize > maxSize) {
      throw new IllegalArgumentException(
          "Invalid chunk sizes: min=" + minSize + ", target=" + targetSize + ", max=" + maxSize);
    }
  }

  public static ChunkingOptions from(RagConfig.Chunking config) {
    return new ChunkingOptions(config.getTargetSize(), config.getMaxSize(), config.getMinSize());
  }
}
