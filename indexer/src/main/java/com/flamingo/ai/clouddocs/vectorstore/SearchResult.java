package com.flamingo.ai.clouddocs.vectorstore;

import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;

/**
 * A ranked search hit.
 *
 * @param chunk the matching chunk
 * @param score cosine similarity to the query, or the combined score after hybrid re-ranking
 * @param distance cosine distance, {@code 1 - score}
 */
public record SearchResult(DocumentChunk chunk, double score, double distance) {

  public static SearchResult ofScore(DocumentChunk chunk, double score) {
    return new SearchResult(chunk, score, 1.0 - score);
  }
}
