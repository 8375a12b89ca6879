package com.flamingo.ai.clouddocs.service.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

/** Strips site chrome from a documentation page and keeps its main content markup. */
@Component
@Slf4j
public class HtmlCleaner {

  static final int MIN_CONTENT_TEXT_LENGTH = 100;

  /** Content containers in priority order. */
  private static final List<String> CONTENT_SELECTORS =
      List.of(
          ".help-doc-content",
          ".documentation-content",
          "#doc-content",
          "article.main-content",
          ".main-content",
          ".content-wrapper",
          ".help-content",
          "[class*=content] article",
          ".doc-content",
          ".article-content",
          ".help-detail-content",
          "body");

  private static final List<String> REMOVE_SELECTORS =
      List.of(
          // navigation
          "header", "nav", "aside", ".sidebar", ".navigation",
          ".left-nav", ".right-nav", ".side-nav",
          ".breadcrumb", ".breadcrumbs",
          ".menu", ".main-menu", ".side-menu",
          // page header and footer
          "footer", ".footer", "#footer",
          ".site-header", ".page-header",
          // widgets
          ".social-media", ".share-buttons",
          ".search-box", "#search", ".search-form",
          ".cookie-banner", ".gdpr", ".cookie-consent",
          ".helpful-widget", ".feedback", ".rate-this-page",
          ".advertisement", ".ads", ".promo", ".promotion",
          // non-content markup
          "script", "style", "noscript", "link[rel=stylesheet]",
          "meta", "base");

  private static final List<String> TITLE_SELECTORS =
      List.of("h1", "h2", "title", ".doc-title", ".article-title");

  /**
   * Removes boilerplate and returns the markup of the main content container.
   *
   * @param html full page markup
   * @return cleaned markup, or an empty string if nothing usable was found
   */
  public String clean(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    try {
      Document document = Jsoup.parse(html);
      document.outputSettings().prettyPrint(false);

      for (String selector : REMOVE_SELECTORS) {
        document.select(selector).remove();
      }
      removeComments(document);
      removeEmptyElements(document);

      Element content = findContent(document);
      if (content == null) {
        log.warn("No content found in HTML");
        return "";
      }
      stripScriptingAttributes(content);

      return content.html().replaceAll("\\n\\s*\\n\\s*\\n", "\n\n").trim();
    } catch (RuntimeException e) {
      log.error("Error cleaning HTML: {}", e.getMessage(), e);
      return "";
    }
  }

  /**
   * Extracts the page title from the first h1, h2, title or known title class.
   *
   * @param html page markup
   * @return the title, {@code "Untitled"} if none is found
   */
  public String extractTitle(String html) {
    if (html == null || html.isBlank()) {
      return "Untitled";
    }
    try {
      Document document = Jsoup.parse(html);
      for (String selector : TITLE_SELECTORS) {
        Element element = document.selectFirst(selector);
        if (element != null && !element.text().isBlank()) {
          return element.text().trim();
        }
      }
    } catch (RuntimeException e) {
      log.debug("Could not extract title: {}", e.getMessage());
    }
    return "Untitled";
  }

  private Element findContent(Document document) {
    for (String selector : CONTENT_SELECTORS) {
      Elements found = document.select(selector);
      if (!found.isEmpty() && found.text().trim().length() > MIN_CONTENT_TEXT_LENGTH) {
        return found.first();
      }
    }
    return document.body();
  }

  private static void removeComments(Node node) {
    List<Node> comments = new ArrayList<>();
    NodeTraversor.traverse(
        (child, depth) -> {
          if (child instanceof Comment) {
            comments.add(child);
          }
        },
        node);
    comments.forEach(Node::remove);
  }

  private static void removeEmptyElements(Document document) {
    for (Element element : document.select("div, p, span")) {
      if (element.childNodeSize() == 0) {
        element.remove();
      }
    }
  }

  private static void stripScriptingAttributes(Element root) {
    for (Element element : root.getAllElements()) {
      List<String> keys = new ArrayList<>();
      for (Attribute attribute : element.attributes()) {
        String key = attribute.getKey().toLowerCase(Locale.ROOT);
        if (key.startsWith("data-") || key.startsWith("on")) {
          keys.add(attribute.getKey());
        }
      }
      keys.forEach(element::removeAttr);
    }
  }
}
