package com.flamingo.ai.clouddocs.service.crawl.fetch;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentPage;
import com.flamingo.ai.clouddocs.domain.model.RawHtmlDocument;
import com.flamingo.ai.clouddocs.exception.FetchException;
import com.flamingo.ai.clouddocs.service.crawl.retry.ErrorClassifier;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryHandler;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Retrieves documentation pages. Every HTTP attempt is admitted by the shared rate controller and
 * retried by the {@link RetryHandler}, so each failed attempt also feeds rate-limit detection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentFetcher {

  private final WebClient docsWebClient;
  private final RetryHandler retryHandler;
  private final CrawlerConfig crawlerConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Fetches one page.
   *
   * @param url page URL
   * @param pageId page id
   * @param serviceCode owning service
   * @param options rate controller and timeout
   * @return a result that never errors
   */
  public Mono<FetchResult> fetchPage(
      String url, String pageId, String serviceCode, FetchOptions options) {
    String context = serviceCode + "/" + pageId;
    RetryPolicy policy =
        RetryPolicy.from("fetch:" + context, crawlerConfig.getRetry())
            .withOnRetry(
                (attempt, error) -> {
                  if (ErrorClassifier.isRateLimit(error)) {
                    log.debug("Rate limit on {}, attempt {}", url, attempt);
                  } else if (error.getKind().isNetwork()) {
                    log.debug(
                        "Network error on {}, attempt {}: {}", url, attempt, error.getMessage());
                  }
                });

    return retryHandler
        .withRetry(
            () -> {
              if (options.rateController() == null) {
                return request(url, pageId, serviceCode, options.timeout());
              }
              return options
                  .rateController()
                  .execute(() -> request(url, pageId, serviceCode, options.timeout()), context);
            },
            policy)
        .map(
            result -> {
              if (result.success()) {
                meterRegistry.counter("crawler.pages.fetched").increment();
                return FetchResult.success(
                    pageId, url, serviceCode, result.data(), result.attempts());
              }
              meterRegistry.counter("crawler.pages.failed").increment();
              return FetchResult.failure(
                  pageId, url, serviceCode, result.error(), result.attempts());
            });
  }

  /**
   * Fetches pages concurrently and emits each result as soon as it completes. Concurrency is
   * bounded only by the rate controller in {@code options}.
   *
   * @param pages pages to fetch
   * @param options shared fetch options
   * @param sink receives one event per completed page, in completion order
   * @return results in completion order
   */
  public Flux<FetchResult> streamPages(
      List<DocumentPage> pages, FetchOptions options, FetchProgressSink sink) {
    int total = pages.size();
    Object progressLock = new Object();
    int[] completed = {0};
    return Flux.fromIterable(pages)
        .flatMap(
            page ->
                fetchPage(page.getUrl(), page.getId(), page.getService(), options)
                    .doOnNext(
                        result -> {
                          synchronized (progressLock) {
                            completed[0]++;
                            sink.onProgress(
                                new FetchProgress(
                                    completed[0], total, page.getId(), result.success()));
                          }
                        }),
            Math.max(1, total));
  }

  /** Fetches pages and returns every result keyed by page id, failures included. */
  public Map<String, FetchResult> fetchPageResults(
      List<DocumentPage> pages, FetchOptions options, FetchProgressSink sink) {
    Map<String, FetchResult> results = new ConcurrentHashMap<>();
    streamPages(pages, options, sink).doOnNext(r -> results.put(r.pageId(), r)).blockLast();
    Map<String, FetchResult> ordered = new LinkedHashMap<>();
    for (DocumentPage page : pages) {
      FetchResult result = results.get(page.getId());
      if (result != null) {
        ordered.put(page.getId(), result);
      }
    }
    return ordered;
  }

  /** Fetches pages and returns only the successes, keyed by page id. */
  public Map<String, RawHtmlDocument> fetchPages(
      List<DocumentPage> pages, FetchOptions options, FetchProgressSink sink) {
    Map<String, RawHtmlDocument> documents = new LinkedHashMap<>();
    fetchPageResults(pages, options, sink)
        .forEach(
            (pageId, result) -> {
              if (result.success()) {
                documents.put(pageId, result.document());
              }
            });
    return documents;
  }

  private Mono<RawHtmlDocument> request(
      String url, String pageId, String serviceCode, Duration timeout) {
    return docsWebClient
        .get()
        .uri(url)
        .accept(MediaType.TEXT_HTML)
        .exchangeToMono(
            response -> {
              int status = response.statusCode().value();
              if (!response.statusCode().is2xxSuccessful()) {
                HttpStatus resolved = HttpStatus.resolve(status);
                return response
                    .releaseBody()
                    .then(
                        Mono.<RawHtmlDocument>error(
                            FetchException.httpStatus(
                                status, resolved != null ? resolved.getReasonPhrase() : "")));
              }
              return response
                  .bodyToMono(String.class)
                  .defaultIfEmpty("")
                  .map(html -> toDocument(response, html, url, pageId, serviceCode, status));
            })
        .timeout(timeout);
  }

  private RawHtmlDocument toDocument(
      ClientResponse response,
      String html,
      String url,
      String pageId,
      String serviceCode,
      int status) {
    Map<String, String> headers = new LinkedHashMap<>();
    response
        .headers()
        .asHttpHeaders()
        .forEach(
            (name, values) -> {
              if (!values.isEmpty()) {
                headers.put(name.toLowerCase(Locale.ROOT), values.get(0));
              }
            });
    String contentType = response.headers().contentType().map(MediaType::toString).orElse(null);
    return new RawHtmlDocument(
        new RawHtmlDocument.Metadata(
            pageId,
            url,
            serviceCode,
            status,
            headers,
            clock.instant(),
            contentType,
            html.length()),
        html);
  }
}
