package com.flamingo.ai.clouddocs.service.rag.rerank;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.vectorstore.SearchResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Re-ranks vector candidates by a weighted sum of cosine similarity and BM25, multiplied by the
 * thesaurus service boost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HybridReranker {

  private final QueryThesaurus thesaurus;
  private final RagConfig ragConfig;

  /** Query text to embed for the candidate search. */
  public String expandQuery(String query) {
    return thesaurus.expand(query);
  }

  /**
   * Combines the scores and keeps the best {@code topK}. Each result carries the combined score;
   * its distance stays the cosine distance of the vector hit. Equal scores keep candidate order.
   *
   * @param query the original, unexpanded query
   * @param candidates vector hits, best first
   * @param topK results to keep
   * @return re-ranked results, best first
   */
  public List<SearchResult> rerank(String query, List<SearchResult> candidates, int topK) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    RagConfig.Hybrid settings = ragConfig.getRetrieval().getHybrid();
    double[] keywordScores =
        Bm25Scorer.score(query, candidates.stream().map(r -> r.chunk().embeddingText()).toList());

    List<SearchResult> reranked = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      SearchResult candidate = candidates.get(i);
      double blended =
          candidate.score() * settings.getVectorWeight()
              + keywordScores[i] * settings.getKeywordWeight();
      double combined = blended * thesaurus.serviceBoost(query, candidate.chunk().service());
      reranked.add(new SearchResult(candidate.chunk(), combined, candidate.distance()));
    }
    reranked.sort(Comparator.comparingDouble(SearchResult::score).reversed());

    List<SearchResult> top = List.copyOf(reranked.subList(0, Math.min(topK, reranked.size())));
    log.debug("Re-ranked {} candidates for '{}' into {}", candidates.size(), query, top.size());
    return top;
  }
}
