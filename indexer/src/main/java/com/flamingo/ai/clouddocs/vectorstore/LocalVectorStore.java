package com.flamingo.ai.clouddocs.vectorstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.SearchException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Exact cosine search over an in-memory list, persisted as one JSON file per collection under
 * {@code rag.vector-store.index-dir}. Added chunks are searchable at once but only reach the file
 * on {@link #flush()}.
 */
@Component
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalVectorStore implements VectorStore {

  static final String TYPE = "local";

  private final Path indexFile;
  private final String collectionName;
  private final int dimension;
  private final int maxTopK;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  // guarded by this
  private final List<IndexEntry> entries = new ArrayList<>();
  private final Map<String, Integer> positionsById = new HashMap<>();
  private boolean initialized;
  private boolean dirty;

  /** One stored chunk with its vector. */
  public record IndexEntry(DocumentChunk chunk, float[] vector) {}

  /** Persisted form of a collection. */
  public record IndexFile(String collection, int dimension, List<IndexEntry> entries) {}

  @Autowired
  public LocalVectorStore(
      RagConfig ragConfig, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this(
        Path.of(ragConfig.getVectorStore().getIndexDir()),
        ragConfig.getVectorStore().getCollectionName(),
        ragConfig.getEmbedding().getDimension(),
        ragConfig.getRetrieval().getMaxTopK(),
        objectMapper,
        meterRegistry);
  }

  public LocalVectorStore(
      Path indexDir,
      String collectionName,
      int dimension,
      int maxTopK,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.indexFile = indexDir.resolve(collectionName + ".json");
    this.collectionName = collectionName;
    this.dimension = dimension;
    this.maxTopK = maxTopK;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    entries.clear();
    positionsById.clear();
    if (Files.isRegularFile(indexFile)) {
      IndexFile stored;
      try {
        stored = objectMapper.readValue(indexFile.toFile(), IndexFile.class);
      } catch (IOException e) {
        throw new SearchException(
            collectionName, "Failed to read vector index " + indexFile + ": " + e.getMessage(), e);
      }
      if (stored.dimension() != dimension) {
        throw new SearchException(
            collectionName,
            "Collection '"
                + collectionName
                + "' has dimension "
                + stored.dimension()
                + " but the embedding model produces "
                + dimension
                + ". Clear the index and ingest again.");
      }
      if (stored.entries() != null) {
        stored.entries().forEach(this::put);
      }
      log.info("Loaded collection '{}' with {} chunks", collectionName, entries.size());
    } else {
      log.info("Created collection '{}' at {}", collectionName, indexFile);
    }
    initialized = true;
  }

  @Override
  public synchronized void clear() {
    entries.clear();
    positionsById.clear();
    dirty = false;
    try {
      Files.deleteIfExists(indexFile);
    } catch (IOException e) {
      throw new SearchException(collectionName, "Failed to delete " + indexFile, e);
    }
    initialized = true;
    log.info("Cleared collection '{}'", collectionName);
  }

  @Override
  @Timed(value = "vectorstore.add", description = "Time to add chunks to the vector index")
  public synchronized int addChunks(List<DocumentChunk> chunks, Map<String, float[]> embeddings) {
    initialize();
    int added = 0;
    for (DocumentChunk chunk : chunks) {
      float[] vector = embeddings.get(chunk.id());
      if (vector == null) {
        log.warn("No embedding for chunk {}, skipping", chunk.id());
        continue;
      }
      checkDimension(vector.length);
      put(new IndexEntry(chunk, vector.clone()));
      added++;
    }
    if (added > 0) {
      dirty = true;
    }
    meterRegistry.counter("vectorstore.chunks.added", "type", TYPE).increment(added);
    return added;
  }

  @Override
  @Timed(value = "vectorstore.flush", description = "Time to write the vector index file")
  public synchronized void flush() {
    if (!dirty) {
      return;
    }
    persist();
    dirty = false;
    log.info("Wrote {} chunks of '{}' to {}", entries.size(), collectionName, indexFile);
  }

  @Override
  @Timed(value = "vectorstore.search", description = "Time for vector search")
  public synchronized List<SearchResult> search(float[] queryVector, SearchOptions options) {
    initialize();
    checkDimension(queryVector.length);
    int topK = options.effectiveTopK(maxTopK);

    List<SearchResult> candidates = new ArrayList<>();
    for (IndexEntry entry : entries) {
      if (options.hasServiceFilter() && !options.service().equals(entry.chunk().service())) {
        continue;
      }
      candidates.add(
          SearchResult.ofScore(entry.chunk(), VectorMath.cosine(queryVector, entry.vector())));
    }
    // List.sort is stable, so equal scores keep insertion order
    candidates.sort(Comparator.comparingDouble(SearchResult::score).reversed());
    meterRegistry.counter("vectorstore.searches", "type", TYPE).increment();
    return List.copyOf(candidates.subList(0, Math.min(topK, candidates.size())));
  }

  @Override
  public synchronized VectorStoreStats getStats() {
    initialize();
    return new VectorStoreStats(collectionName, entries.size(), dimension, TYPE);
  }

  @Override
  public String getCollectionName() {
    return collectionName;
  }

  private void put(IndexEntry entry) {
    Integer existing = positionsById.get(entry.chunk().id());
    if (existing != null) {
      entries.set(existing, entry);
    } else {
      positionsById.put(entry.chunk().id(), entries.size());
      entries.add(entry);
    }
  }

  private void checkDimension(int actual) {
    if (actual != dimension) {
      throw new SearchException(
          collectionName,
          "Vector dimension mismatch: expected " + dimension + ", got " + actual);
    }
  }

  private void persist() {
    try {
      Files.createDirectories(indexFile.toAbsolutePath().getParent());
      objectMapper.writeValue(
          indexFile.toFile(), new IndexFile(collectionName, dimension, List.copyOf(entries)));
    } catch (IOException e) {
      throw new SearchException(collectionName, "Failed to write " + indexFile, e);
    }
  }
}
