package com.flamingo.ai.clouddocs.service.rag.query;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.exception.EmbeddingException;
import com.flamingo.ai.clouddocs.exception.SearchException;
import com.flamingo.ai.clouddocs.service.rag.embedding.ChunkEmbedder;
import com.flamingo.ai.clouddocs.service.rag.rerank.HybridReranker;
import com.flamingo.ai.clouddocs.vectorstore.SearchOptions;
import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import com.flamingo.ai.clouddocs.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers similarity queries against the vector store, optionally re-ranking a larger candidate
 * set with {@link HybridReranker}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

  private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

  private final ChunkEmbedder embedder;
  private final VectorStore vectorStore;
  private final SearchResultFormatter formatter;
  private final HybridReranker hybridReranker;
  private final RagConfig ragConfig;
  private final Clock clock;

  @Timed(value = "rag.query", description = "Time to embed and search a query")
  public QueryResponse search(String query, Integer topK, String service) {
    return search(query, topK, service, false);
  }

  /**
   * Embeds {@code query} and returns its nearest chunks.
   *
   * <p>In hybrid mode the query is expanded with related terms before embedding, {@code
   * candidates-multiplier} times as many hits are fetched (still bounded by {@code max-top-k}),
   * and those are re-ranked by keyword relevance and service boost.
   *
   * @param query query text, must not be blank
   * @param topK requested results, or null for {@code rag.retrieval.default-top-k}; clamped to
   *     {@code rag.retrieval.max-top-k}
   * @param service optional service filter
   * @param hybrid whether to re-rank the vector hits
   * @return results and latency
   * @throws EmbeddingException if the query cannot be embedded
   * @throws SearchException if the store cannot be queried
   */
  @Timed(value = "rag.query", description = "Time to embed and search a query")
  public QueryResponse search(String query, Integer topK, String service, boolean hybrid) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    int requested = topK != null ? topK : retrieval.getDefaultTopK();
    int limit = Math.max(1, Math.min(requested, retrieval.getMaxTopK()));

    Instant start = clock.instant();
    List<SearchResult> results;
    if (hybrid) {
      int candidates =
          Math.min(limit * retrieval.getHybrid().getCandidatesMultiplier(), retrieval.getMaxTopK());
      float[] vector = embedder.embed(hybridReranker.expandQuery(query));
      List<SearchResult> pool =
          vectorStore.search(vector, new SearchOptions(Math.max(limit, candidates), service));
      results = hybridReranker.rerank(query, pool, limit);
    } else {
      float[] vector = embedder.embed(query);
      results = vectorStore.search(vector, new SearchOptions(limit, service));
    }
    long latencyMs = Duration.between(start, clock.instant()).toMillis();
    log.debug(
        "Query '{}' returned {} results in {}ms (hybrid: {})",
        query,
        results.size(),
        latencyMs,
        hybrid);
    return new QueryResponse(query, results, latencyMs);
  }

  /** Runs one query and prints it; errors are printed rather than thrown. */
  public boolean runQuery(
      String query,
      Integer topK,
      String service,
      boolean hybrid,
      OutputFormat format,
      PrintStream out) {
    try {
      out.println(formatter.format(search(query, topK, service, hybrid), format));
      return true;
    } catch (EmbeddingException e) {
      log.error("Error embedding query '{}': {}", query, e.getMessage());
      out.println("Error executing query: " + e.getUserMessage());
      return false;
    } catch (SearchException e) {
      log.error("Error executing query '{}': {}", query, e.getMessage());
      out.println("Error executing query: " + e.getUserMessage());
      return false;
    }
  }

  /**
   * Reads queries from {@code in} until {@code exit}, {@code quit} or end of input. Blank lines
   * are ignored.
   *
   * @return number of queries executed
   */
  public int interactive(
      BufferedReader in,
      PrintStream out,
      Integer topK,
      String service,
      boolean hybrid,
      OutputFormat format) {
    log.info(
        "Collection {} ready with {} vectors",
        vectorStore.getCollectionName(),
        vectorStore.getStats().count());
    out.println("Enter your query (or type \"quit\" to exit):");
    int executed = 0;
    try {
      while (true) {
        out.print("Query: ");
        out.flush();
        String line = in.readLine();
        if (line == null) {
          break;
        }
        String query = line.trim();
        if (EXIT_COMMANDS.contains(query.toLowerCase(Locale.ROOT))) {
          out.println("Goodbye!");
          break;
        }
        if (query.isEmpty()) {
          continue;
        }
        runQuery(query, topK, service, hybrid, format, out);
        executed++;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read query input", e);
    }
    return executed;
  }
}
