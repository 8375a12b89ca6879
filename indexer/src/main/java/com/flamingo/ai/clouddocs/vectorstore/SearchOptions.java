package com.flamingo.ai.clouddocs.vectorstore;

/**
 * Parameters of a similarity search.
 *
 * @param topK requested number of results
 * @param service service code to restrict results to, or null for all services
 */
public record SearchOptions(int topK, String service) {

  public static SearchOptions of(int topK) {
    return new SearchOptions(topK, null);
  }

  public SearchOptions withService(String serviceCode) {
    return new SearchOptions(topK, serviceCode);
  }

  public boolean hasServiceFilter() {
    return service != null && !service.isBlank();
  }

  /** {@code topK} bounded to [1, {@code maxTopK}]. */
  public int effectiveTopK(int maxTopK) {
    return Math.max(1, Math.min(topK, maxTopK));
  }
}
