package com.flamingo.ai.clouddocs.vectorstore;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Vector index backed by an Elasticsearch {@code dense_vector} field with cosine similarity.
 *
 * <p>Elasticsearch reports cosine hits as {@code (1 + cos) / 2}; scores are converted back to
 * cosine before they are returned. Each document carries a {@code sequence} number assigned at
 * write time, used to order equal scores by insertion.
 */
@Component
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  static final String TYPE = "elasticsearch";
  static final String EMBEDDING_FIELD = "embedding";
  static final String SEQUENCE_FIELD = "sequence";
  private static final int MIN_CANDIDATES = 100;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int dimension;
  private final int maxTopK;
  private final AtomicLong sequence = new AtomicLong();
  private volatile boolean initialized;

  @Autowired
  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        ragConfig.getVectorStore().getCollectionName(),
        ragConfig.getEmbedding().getDimension(),
        ragConfig.getRetrieval().getMaxTopK());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int dimension,
      int maxTopK) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.dimension = dimension;
    this.maxTopK = maxTopK;
  }

  @Override
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        sequence.set(elasticsearchClient.count(c -> c.index(indexName)).count());
        log.info("Using Elasticsearch index '{}' with {} chunks", indexName, sequence.get());
      }
      initialized = true;
    } catch (IOException | RuntimeException e) {
      throw new SearchException(
          indexName,
          "Failed to initialize Elasticsearch index '" + indexName + "': " + e.getMessage(),
          e);
    }
  }

  @Override
  public synchronized void clear() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (exists) {
        elasticsearchClient.indices().delete(d -> d.index(indexName));
      }
      createIndex();
      sequence.set(0);
      initialized = true;
      log.info("Cleared Elasticsearch index '{}'", indexName);
    } catch (IOException e) {
      throw new SearchException(indexName, "Failed to clear index '" + indexName + "'", e);
    }
  }

  @Override
  @Timed(value = "vectorstore.add", description = "Time to add chunks to the vector index")
  public int addChunks(List<DocumentChunk> chunks, Map<String, float[]> embeddings) {
    initialize();
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    int added = 0;
    for (DocumentChunk chunk : chunks) {
      float[] vector = embeddings.get(chunk.id());
      if (vector == null) {
        log.warn("No embedding for chunk {}, skipping", chunk.id());
        continue;
      }
      checkDimension(vector.length);
      Map<String, Object> document = toDocument(chunk, vector, sequence.getAndIncrement());
      bulk.operations(
          op -> op.index(idx -> idx.index(indexName).id(chunk.id()).document(document)));
      added++;
    }
    if (added == 0) {
      return 0;
    }
    try {
      BulkResponse response = elasticsearchClient.bulk(bulk.build());
      if (response.errors()) {
        long failed = response.items().stream().filter(item -> item.error() != null).count();
        meterRegistry.counter("vectorstore.index.errors", "type", TYPE).increment(failed);
        throw new SearchException(
            indexName, failed + " of " + added + " chunks failed to index in " + indexName);
      }
    } catch (IOException e) {
      throw new SearchException(indexName, "Failed to index chunks: " + e.getMessage(), e);
    }
    meterRegistry.counter("vectorstore.chunks.added", "type", TYPE).increment(added);
    log.debug("Indexed {} chunks to {}", added, indexName);
    return added;
  }

  @Override
  public void flush() {
    initialize();
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
    } catch (IOException e) {
      throw new SearchException(indexName, "Failed to refresh " + indexName, e);
    }
  }

  @Override
  @Timed(value = "vectorstore.search", description = "Time for vector search")
  @SuppressWarnings("rawtypes")
  public List<SearchResult> search(float[] queryVector, SearchOptions options) {
    initialize();
    checkDimension(queryVector.length);
    int topK = options.effectiveTopK(maxTopK);
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(buildSearchRequest(queryVector, options, topK), Map.class);
      meterRegistry.counter("vectorstore.searches", "type", TYPE).increment();
      List<SearchResult> results = toSearchResults(response.hits().hits());
      return results.subList(0, Math.min(topK, results.size()));
    } catch (IOException e) {
      throw new SearchException(indexName, "Vector search failed: " + e.getMessage(), e);
    }
  }

  @Override
  public VectorStoreStats getStats() {
    initialize();
    try {
      long count = elasticsearchClient.count(c -> c.index(indexName)).count();
      return new VectorStoreStats(indexName, count, dimension, TYPE);
    } catch (IOException e) {
      throw new SearchException(indexName, "Failed to count chunks: " + e.getMessage(), e);
    }
  }

  @Override
  public String getCollectionName() {
    return indexName;
  }

  @VisibleForTesting
  SearchRequest buildSearchRequest(float[] queryVector, SearchOptions options, int topK) {
    List<Float> vector = new ArrayList<>(queryVector.length);
    for (float v : queryVector) {
      vector.add(v);
    }
    int candidates = Math.max(MIN_CANDIDATES, topK * 10);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field(EMBEDDING_FIELD)
                          .queryVector(vector)
                          .k(topK)
                          .numCandidates(candidates);
                      if (options.hasServiceFilter()) {
                        k.filter(f -> f.term(t -> t.field("service").value(options.service())));
                      }
                      return k;
                    })
                .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                .size(topK));
  }

  @VisibleForTesting
  @SuppressWarnings({"rawtypes", "unchecked"})
  List<SearchResult> toSearchResults(List<Hit<Map>> hits) {
    record Ranked(SearchResult result, long sequence) {}

    List<Ranked> ranked = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null || hit.score() == null) {
        continue;
      }
      double cosine = 2.0 * hit.score() - 1.0;
      Object seq = source.get(SEQUENCE_FIELD);
      long order = seq instanceof Number n ? n.longValue() : Long.MAX_VALUE;
      ranked.add(new Ranked(SearchResult.ofScore(fromDocument(hit.id(), source), cosine), order));
    }
    ranked.sort(
        Comparator.comparingDouble((Ranked r) -> r.result().score())
            .reversed()
            .thenComparingLong(Ranked::sequence));
    return ranked.stream().map(Ranked::result).toList();
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("chunkId", Property.of(p -> p.keyword(k -> k)));
    properties.put("service", Property.of(p -> p.keyword(k -> k)));
    properties.put("pageId", Property.of(p -> p.keyword(k -> k)));
    properties.put("url", Property.of(p -> p.keyword(k -> k)));
    properties.put("headers", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("position", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put(SEQUENCE_FIELD, Property.of(p -> p.long_(l -> l)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimension)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  private static Map<String, Object> toDocument(DocumentChunk chunk, float[] vector, long seq) {
    List<Float> embedding = new ArrayList<>(vector.length);
    for (float v : vector) {
      embedding.add(v);
    }
    Map<String, Object> document = new HashMap<>();
    document.put("chunkId", chunk.id());
    document.put("service", chunk.service());
    document.put("pageId", chunk.pageId());
    document.put("url", chunk.url());
    document.put("headers", chunk.headers());
    document.put("content", chunk.content());
    document.put("position", chunk.position());
    document.put("tokenCount", chunk.tokenCount());
    document.put(SEQUENCE_FIELD, seq);
    document.put(EMBEDDING_FIELD, embedding);
    return document;
  }

  @SuppressWarnings("unchecked")
  private static DocumentChunk fromDocument(String id, Map<String, Object> source) {
    Object headers = source.get("headers");
    return new DocumentChunk(
        source.get("chunkId") != null ? (String) source.get("chunkId") : id,
        (String) source.get("content"),
        (String) source.get("service"),
        (String) source.get("pageId"),
        headers instanceof List<?> list ? (List<String>) list : List.of(),
        (String) source.get("url"),
        source.get("position") instanceof Number position ? position.intValue() : 0,
        source.get("tokenCount") instanceof Number tokens ? tokens.intValue() : 0);
  }

  private void checkDimension(int actual) {
    if (actual != dimension) {
      throw new SearchException(
          indexName, "Vector dimension mismatch: expected " + dimension + ", got " + actual);
    }
  }
}
