package com.flamingo.ai.clouddocs.vectorstore;

import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import java.util.List;
import java.util.Map;

/**
 * Index of chunk embeddings searchable by cosine similarity.
 *
 * <p>Results are ordered by descending cosine; equal scores keep insertion order. The service
 * filter is applied before ranking, and {@code topK} is clamped to {@code rag.retrieval.max-top-k}.
 */
public interface VectorStore {

  /** Opens or creates the collection. Safe to call more than once. */
  void initialize();

  /** Removes every entry from the collection. */
  void clear();

  /**
   * Adds or replaces chunks. Chunks without an embedding are skipped.
   *
   * @param chunks chunks to index
   * @param embeddings vectors keyed by chunk id
   * @return number of chunks written
   * @throws com.flamingo.ai.clouddocs.exception.SearchException on a dimension mismatch or a write
   *     failure
   */
  int addChunks(List<DocumentChunk> chunks, Map<String, float[]> embeddings);

  /**
   * Makes every chunk added so far durable and visible to searches in other processes. Called
   * once at the end of an ingestion run rather than after every document.
   *
   * @throws com.flamingo.ai.clouddocs.exception.SearchException if the write fails
   */
  void flush();

  /**
   * Returns the chunks nearest to {@code queryVector}.
   *
   * @param queryVector query embedding of the collection's dimension
   * @param options result count and optional service filter
   * @return results, best first
   */
  List<SearchResult> search(float[] queryVector, SearchOptions options);

  VectorStoreStats getStats();

  String getCollectionName();
}
