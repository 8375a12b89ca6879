package com.flamingo.ai.clouddocs.service.rag.rerank;

import com.flamingo.ai.clouddocs.service.rag.chunking.Tokenizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 over a small candidate set. Statistics come from the candidates themselves, and
 * scores are scaled so the best candidate scores 1.
 */
public final class Bm25Scorer {

  static final double K1 = 1.2;
  static final double B = 0.75;

  private Bm25Scorer() {}

  /**
   * Scores every document against the query terms.
   *
   * @param query query text
   * @param documents candidate texts
   * @return one score in [0, 1] per document, all zero when no query term occurs
   */
  public static double[] score(String query, List<String> documents) {
    int count = documents.size();
    double[] scores = new double[count];
    Set<String> queryTerms = new LinkedHashSet<>(terms(query));
    if (queryTerms.isEmpty() || count == 0) {
      return scores;
    }

    List<Map<String, Integer>> termFrequencies = new ArrayList<>(count);
    Map<String, Integer> documentFrequencies = new HashMap<>();
    int[] lengths = new int[count];
    long totalLength = 0;
    for (int i = 0; i < count; i++) {
      List<String> tokens = terms(documents.get(i));
      lengths[i] = tokens.size();
      totalLength += tokens.size();
      Map<String, Integer> frequencies = new HashMap<>();
      tokens.forEach(token -> frequencies.merge(token, 1, Integer::sum));
      termFrequencies.add(frequencies);
      for (String term : queryTerms) {
        if (frequencies.containsKey(term)) {
          documentFrequencies.merge(term, 1, Integer::sum);
        }
      }
    }
    if (totalLength == 0) {
      return scores;
    }

    double averageLength = (double) totalLength / count;
    double best = 0;
    for (int i = 0; i < count; i++) {
      double score = 0;
      for (String term : queryTerms) {
        Integer frequency = termFrequencies.get(i).get(term);
        if (frequency == null) {
          continue;
        }
        int df = documentFrequencies.get(term);
        double idf = Math.log(1 + (count - df + 0.5) / (df + 0.5));
        double norm = K1 * (1 - B + B * lengths[i] / averageLength);
        score += idf * frequency * (K1 + 1) / (frequency + norm);
      }
      scores[i] = score;
      best = Math.max(best, score);
    }
    if (best > 0) {
      for (int i = 0; i < count; i++) {
        scores[i] /= best;
      }
    }
    return scores;
  }

  static List<String> terms(String text) {
    return Tokenizer.tokenize(text).stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
  }
}
