package com.flamingo.ai.clouddocs.service.crawl.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentPage;
import com.flamingo.ai.clouddocs.domain.model.RawHtmlDocument;
import com.flamingo.ai.clouddocs.exception.ErrorKind;
import com.flamingo.ai.clouddocs.service.crawl.ratelimit.AdaptiveRateController;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryHandler;
import com.flamingo.ai.clouddocs.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("DocumentFetcher Tests")
class DocumentFetcherTest {

  private static final String BASE = "https://support.huaweicloud.com/intl/en-us/ecs/";

  private final MutableClock clock = MutableClock.at("2025-02-01T08:00:00Z");
  private final Map<String, AtomicInteger> callsByPath = new ConcurrentHashMap<>();
  private SimpleMeterRegistry meterRegistry;
  private CrawlerConfig crawlerConfig;
  private DocumentFetcher fetcher;
  private ScheduledExecutorService dispatcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    crawlerConfig = new CrawlerConfig();
    crawlerConfig.getRetry().setBaseDelay(Duration.ofMillis(1));
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  String path = request.url().getPath();
                  int call =
                      callsByPath.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
                  if (path.endsWith("missing.html")) {
                    return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
                  }
                  if (path.endsWith("flaky.html") && call == 1) {
                    return Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build());
                  }
                  return Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(HttpHeaders.CONTENT_TYPE, "text/html;charset=UTF-8")
                          .header("X-Request-Id", "abc")
                          .body("<html><body>" + path + "</body></html>")
                          .build());
                })
            .build();
    fetcher =
        new DocumentFetcher(webClient, new RetryHandler(), crawlerConfig, meterRegistry, clock);
  }

  @AfterEach
  void tearDown() {
    if (dispatcher != null) {
      dispatcher.shutdownNow();
    }
  }

  private static DocumentPage page(String id) {
    return DocumentPage.builder().id(id).url(BASE + id + ".html").service("ecs").build();
  }

  @Test
  @DisplayName("Should return the page with response metadata")
  void shouldFetchPageWithMetadata() {
    FetchResult result =
        fetcher
            .fetchPage(BASE + "intro.html", "intro", "ecs", FetchOptions.of(null))
            .block(Duration.ofSeconds(5));

    assertThat(result.success()).isTrue();
    assertThat(result.attempts()).isEqualTo(1);
    RawHtmlDocument.Metadata metadata = result.document().metadata();
    assertThat(metadata.id()).isEqualTo("intro");
    assertThat(metadata.service()).isEqualTo("ecs");
    assertThat(metadata.status()).isEqualTo(200);
    assertThat(metadata.fetchedAt()).isEqualTo(Instant.parse("2025-02-01T08:00:00Z"));
    assertThat(metadata.contentType()).startsWith("text/html");
    assertThat(metadata.headers()).containsEntry("x-request-id", "abc");
    assertThat(metadata.contentLength()).isEqualTo(result.document().html().length());
    assertThat(meterRegistry.counter("crawler.pages.fetched").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should report a 404 after a single attempt")
  void shouldFailFastOnNotFound() {
    FetchResult result =
        fetcher
            .fetchPage(BASE + "missing.html", "missing", "ecs", FetchOptions.of(null))
            .block(Duration.ofSeconds(5));

    assertThat(result.success()).isFalse();
    assertThat(result.attempts()).isEqualTo(1);
    assertThat(result.cause().getKind()).isEqualTo(ErrorKind.HTTP);
    assertThat(result.cause().getHttpStatus()).isEqualTo(404);
    assertThat(result.error()).startsWith("Failed after 1 attempts").contains("404");
    assertThat(meterRegistry.counter("crawler.pages.failed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should retry a transient failure")
  void shouldRetryTransientFailure() {
    FetchResult result =
        fetcher
            .fetchPage(BASE + "flaky.html", "flaky", "ecs", FetchOptions.of(null))
            .block(Duration.ofSeconds(5));

    assertThat(result.success()).isTrue();
    assertThat(result.attempts()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should emit one progress event per page")
  void shouldEmitProgress() {
    List<FetchProgress> events = Collections.synchronizedList(new ArrayList<>());
    List<DocumentPage> pages = List.of(page("a"), page("missing"), page("b"));

    Map<String, FetchResult> results =
        fetcher.fetchPageResults(pages, FetchOptions.of(null), events::add);

    assertThat(results.keySet()).containsExactly("a", "missing", "b");
    assertThat(events).hasSize(3);
    assertThat(events).extracting(FetchProgress::completed).containsExactly(1, 2, 3);
    assertThat(events).allMatch(event -> event.total() == 3);
    assertThat(events)
        .filteredOn(event -> event.pageId().equals("missing"))
        .singleElement()
        .extracting(FetchProgress::success)
        .isEqualTo(false);
  }

  @Test
  @DisplayName("Should keep only successful pages")
  void shouldKeepOnlySuccesses() {
    List<DocumentPage> pages = List.of(page("a"), page("missing"), page("b"));

    Map<String, RawHtmlDocument> documents =
        fetcher.fetchPages(pages, FetchOptions.of(null), FetchProgressSink.noop());

    assertThat(documents).containsOnlyKeys("a", "b");
  }

  @Test
  @DisplayName("Should admit every attempt through the rate controller")
  void shouldUseRateController() {
    dispatcher = Executors.newSingleThreadScheduledExecutor();
    AdaptiveRateController controller =
        new AdaptiveRateController(
            2, Duration.ZERO, Duration.ZERO, dispatcher, clock, new SimpleMeterRegistry());
    List<DocumentPage> pages = List.of(page("a"), page("flaky"), page("b"), page("c"));

    Map<String, RawHtmlDocument> documents =
        fetcher.fetchPages(pages, FetchOptions.of(controller), FetchProgressSink.noop());

    assertThat(documents).hasSize(4);
    assertThat(controller.getStats().totalRequests()).isEqualTo(5);
    assertThat(controller.getStats().totalFailures()).isEqualTo(1);
  }
}
