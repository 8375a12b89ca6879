package com.flamingo.ai.clouddocs.service.crawl.discovery;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.enums.DocumentCategory;
import com.flamingo.ai.clouddocs.domain.model.DocumentPage;
import com.flamingo.ai.clouddocs.exception.FetchException;
import com.flamingo.ai.clouddocs.service.crawl.retry.ErrorClassifier;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryHandler;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryPolicy;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Resolves the documentation pages of a service from its left-menu navigation fragment. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageNavigator {

  private static final Pattern LEVEL_CLASS = Pattern.compile("level(\\d)");
  private static final Pattern LOCALE_SEGMENT =
      Pattern.compile(
          "/(?:pt-br|es-us|es-es|zh-cn|zh-tw|zh-hk|ja-jp|ko-kr|fr-fr|de-de|tr-tr|th-th|id-id"
              + "|ru-ru|ar-ae|en-us)/");

  private final WebClient docsWebClient;
  private final RetryHandler retryHandler;
  private final CrawlerConfig crawlerConfig;

  /**
   * Fetches and parses the navigation of one service.
   *
   * <p>A 404 means the service has no documentation. Other failures are retried; once retries are
   * exhausted they are logged and an empty list is returned.
   *
   * @param serviceCode service code, e.g. {@code ecs}
   * @return pages in navigation order, each with status {@code PENDING}
   */
  public List<DocumentPage> fetchServicePages(String serviceCode) {
    String url = navigationUrl(serviceCode);
    log.debug("Fetching navigation for {} from {}", serviceCode, url);
    RetryPolicy policy =
        RetryPolicy.from("navigation:" + serviceCode, crawlerConfig.getRetry())
            .withOnRetry(
                (attempt, error) -> {
                  if (ErrorClassifier.isRateLimit(error)) {
                    log.warn("Rate limit hit for {}, will back off", serviceCode);
                  } else {
                    log.debug("Retry {} for {}: {}", attempt, serviceCode, error.getMessage());
                  }
                });
    String html;
    try {
      html = retryHandler.withRetryThrow(() -> requestNavigation(url), policy).block();
    } catch (FetchException e) {
      log.error("Failed to fetch navigation for {}: {}", serviceCode, e.getMessage());
      return List.of();
    }
    if (html == null || html.isEmpty()) {
      log.warn("No documentation found for service: {} (404)", serviceCode);
      return List.of();
    }
    return parseNavigation(html, serviceCode);
  }

  private Mono<String> requestNavigation(String url) {
    return docsWebClient
        .get()
        .uri(url)
        .accept(MediaType.TEXT_HTML)
        .exchangeToMono(
            response -> {
              if (response.statusCode().is2xxSuccessful()) {
                return response.bodyToMono(String.class).defaultIfEmpty("");
              }
              int status = response.statusCode().value();
              if (status == HttpStatus.NOT_FOUND.value()) {
                return response.releaseBody().thenReturn("");
              }
              HttpStatus resolved = HttpStatus.resolve(status);
              return response
                  .releaseBody()
                  .then(
                      Mono.error(
                          FetchException.httpStatus(
                              status, resolved != null ? resolved.getReasonPhrase() : "")));
            })
        .timeout(crawlerConfig.getHttp().getTimeout());
  }

  /**
   * Parses a navigation fragment into pages.
   *
   * <p>Items with {@code javascript:} links or without any target are skipped. Duplicate URLs
   * (after locale normalization and fragment removal) keep their first occurrence. Distinct URLs
   * whose ids collide get a numeric suffix.
   *
   * @param html navigation markup
   * @param serviceCode owning service
   * @return pages in navigation order
   */
  public List<DocumentPage> parseNavigation(String html, String serviceCode) {
    Document document = Jsoup.parse(html);
    List<DocumentPage> pages = new ArrayList<>();
    Map<String, Boolean> seenUrls = new HashMap<>();
    Map<String, String> urlsById = new HashMap<>();

    for (Element item : document.select("li.nav-item")) {
      Element link = item.selectFirst("a.js-title");
      if (link == null) {
        continue;
      }
      String href = link.attr("href").trim();
      String pHref = link.attr("p-href").trim();
      if (href.toLowerCase(Locale.ROOT).startsWith("javascript:")
          || (href.isEmpty() && pHref.isEmpty())) {
        continue;
      }
      String target = href.startsWith("http") ? href : pHref;
      if (target.isEmpty() || target.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
        continue;
      }

      String url = PageIds.canonicalUrl(normalizeLocale(resolve(target, serviceCode)));
      if (seenUrls.putIfAbsent(url, Boolean.TRUE) != null) {
        continue;
      }

      String id = uniqueId(PageIds.generatePageId(url), url, urlsById, serviceCode);
      String handbookCode = link.attr("data-handbookcode");
      pages.add(
          DocumentPage.builder()
              .id(id)
              .url(url)
              .title(link.text().trim())
              .service(serviceCode)
              .category(DocumentCategory.fromHandbookCode(handbookCode))
              .handbookCode(handbookCode)
              .level(extractLevel(item.className()))
              .build());
    }

    log.debug("Found {} pages for {}", pages.size(), serviceCode);
    return pages;
  }

  private String uniqueId(
      String baseId, String url, Map<String, String> urlsById, String serviceCode) {
    String id = PageIds.uniquePageId(baseId, url, urlsById);
    if (!id.equals(baseId)) {
      log.warn(
          "Page id '{}' of {} already used by {} in {}, using '{}'",
          baseId,
          url,
          urlsById.get(baseId),
          serviceCode,
          id);
    }
    return id;
  }

  private String resolve(String target, String serviceCode) {
    if (target.startsWith("http://") || target.startsWith("https://")) {
      return target;
    }
    try {
      URI base = URI.create(navigationBase(serviceCode) + "/");
      return base.resolve(target).toString();
    } catch (IllegalArgumentException e) {
      log.debug("Keeping unresolvable link '{}' for {}: {}", target, serviceCode, e.getMessage());
      return target;
    }
  }

  private String normalizeLocale(String url) {
    String canonical = "/" + crawlerConfig.getNavigation().getCanonicalLocale() + "/";
    return LOCALE_SEGMENT.matcher(url).replaceFirst(Matcher.quoteReplacement(canonical));
  }

  private static int extractLevel(String classNames) {
    Matcher matcher = LEVEL_CLASS.matcher(classNames == null ? "" : classNames);
    return matcher.find() ? Integer.parseInt(matcher.group(1)) : 1;
  }

  private String navigationBase(String serviceCode) {
    String base = crawlerConfig.getNavigation().getDocBaseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/" + serviceCode;
  }

  String navigationUrl(String serviceCode) {
    return navigationBase(serviceCode) + "/" + crawlerConfig.getNavigation().getFragmentName();
  }
}
