package com.flamingo.ai.clouddocs.service.crawl.discovery;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives stable page ids from documentation URLs.
 *
 * <p>A URL is first canonicalized by dropping its fragment; the query is kept. The id is the last
 * path segment without its {@code .html} suffix, followed by {@code _} and the query when one is
 * present, lower-cased with every run of characters outside {@code [a-z0-9]} collapsed to a single
 * {@code _}. The function is idempotent.
 */
public final class PageIds {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
  private static final String FALLBACK_ID = "index";

  private PageIds() {}

  /** Returns the URL without its fragment. */
  public static String canonicalUrl(String url) {
    if (url == null) {
      return "";
    }
    int hash = url.indexOf('#');
    return (hash >= 0 ? url.substring(0, hash) : url).trim();
  }

  /**
   * Generates the page id for a URL or for an id previously produced by this method.
   *
   * @param url absolute or relative URL, or an existing id
   * @return non-empty id made of {@code [a-z0-9_]}
   */
  public static String generatePageId(String url) {
    String path = canonicalUrl(url);
    String query = "";
    int questionMark = path.indexOf('?');
    if (questionMark >= 0) {
      query = path.substring(questionMark + 1);
      path = path.substring(0, questionMark);
    }
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    String name = path.substring(path.lastIndexOf('/') + 1);
    String lowerName = name.toLowerCase(Locale.ROOT);
    if (lowerName.endsWith(".html")) {
      name = name.substring(0, name.length() - ".html".length());
    } else if (lowerName.endsWith(".htm")) {
      name = name.substring(0, name.length() - ".htm".length());
    }
    String raw = query.isEmpty() ? name : name + "_" + query;
    String slug = NON_ALPHANUMERIC.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("_");
    slug = EDGE_UNDERSCORES.matcher(slug).replaceAll("");
    return slug.isEmpty() ? FALLBACK_ID : slug;
  }

  /**
   * Returns {@code baseId}, or {@code baseId_2}, {@code baseId_3}, ... when the id is already taken
   * in {@code urlsById}, and registers the chosen id for {@code url}.
   */
  public static String uniquePageId(String baseId, String url, Map<String, String> urlsById) {
    String id = baseId;
    int suffix = 2;
    while (urlsById.containsKey(id)) {
      id = baseId + "_" + suffix++;
    }
    urlsById.put(id, url);
    return id;
  }
}
