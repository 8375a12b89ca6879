package com.flamingo.ai.clouddocs.service.rag.rerank;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.RagConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Domain vocabulary for hybrid retrieval: related terms appended to a query before it is embedded,
 * and per-service boost factors triggered by query keywords.
 *
 * <p>Keywords match whole words of the query, so {@code ai} does not fire on {@code maintain}.
 */
@Component
@Slf4j
public class QueryThesaurus {

  /** Contents of the thesaurus resource. */
  public record Entries(
      Map<String, List<String>> expansions, Map<String, Map<String, Double>> serviceBoosts) {

    public Entries {
      expansions = expansions == null ? Map.of() : Map.copyOf(expansions);
      serviceBoosts = serviceBoosts == null ? Map.of() : Map.copyOf(serviceBoosts);
    }
  }

  private final Entries entries;

  @Autowired
  public QueryThesaurus(RagConfig ragConfig, ObjectMapper objectMapper) {
    this(load(ragConfig.getRetrieval().getHybrid().getThesaurusResource(), objectMapper));
  }

  public QueryThesaurus(Entries entries) {
    this.entries = entries;
    log.debug(
        "Thesaurus has {} expansions and {} service keywords",
        entries.expansions().size(),
        entries.serviceBoosts().size());
  }

  private static Entries load(String resource, ObjectMapper objectMapper) {
    try (InputStream in = new ClassPathResource(resource).getInputStream()) {
      return objectMapper.readValue(in, Entries.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load thesaurus from " + resource, e);
    }
  }

  /** Returns the query followed by the related terms of each of its words. */
  public String expand(String query) {
    List<String> parts = new ArrayList<>();
    parts.add(query);
    for (String word : Bm25Scorer.terms(query)) {
      List<String> related = entries.expansions().get(word);
      if (related != null) {
        parts.addAll(related);
      }
    }
    return String.join(" ", parts);
  }

  /**
   * Product of the boost factors for {@code service} over every keyword found in the query; 1.0
   * when none applies.
   */
  public double serviceBoost(String query, String service) {
    if (service == null) {
      return 1.0;
    }
    String words = " " + String.join(" ", Bm25Scorer.terms(query)) + " ";
    String code = service.toLowerCase(Locale.ROOT);
    double boost = 1.0;
    for (Map.Entry<String, Map<String, Double>> keyword : entries.serviceBoosts().entrySet()) {
      Double factor = keyword.getValue().get(code);
      if (factor != null && words.contains(" " + phrase(keyword.getKey()) + " ")) {
        boost *= factor;
      }
    }
    return boost;
  }

  private static String phrase(String keyword) {
    return String.join(" ", Bm25Scorer.terms(keyword));
  }
}
