package com.flamingo.ai.clouddocs.service.rag.evaluation;

import java.util.List;

/**
 * A fixed retrieval check.
 *
 * @param id stable identifier, e.g. {@code ecs-create}
 * @param query query text
 * @param expectedServices service codes, any of which counts as relevant
 * @param description short human label
 */
public record EvaluationQuery(
    String id, String query, List<String> expectedServices, String description) {

  public EvaluationQuery {
    expectedServices = expectedServices == null ? List.of() : List.copyOf(expectedServices);
  }
}
