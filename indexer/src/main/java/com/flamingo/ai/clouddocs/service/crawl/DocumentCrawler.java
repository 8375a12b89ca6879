package com.flamingo.ai.clouddocs.service.crawl;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.CleanDocument;
import com.flamingo.ai.clouddocs.domain.model.CloudService;
import com.flamingo.ai.clouddocs.domain.model.DocumentPage;
import com.flamingo.ai.clouddocs.domain.model.FailedPageRecord;
import com.flamingo.ai.clouddocs.domain.model.RawHtmlDocument;
import com.flamingo.ai.clouddocs.domain.model.ServiceCatalog;
import com.flamingo.ai.clouddocs.service.crawl.discovery.PageIds;
import com.flamingo.ai.clouddocs.service.crawl.discovery.PageNavigator;
import com.flamingo.ai.clouddocs.service.crawl.discovery.ServiceCatalogClient;
import com.flamingo.ai.clouddocs.service.crawl.fetch.DocumentFetcher;
import com.flamingo.ai.clouddocs.service.crawl.fetch.FetchOptions;
import com.flamingo.ai.clouddocs.service.crawl.fetch.FetchResult;
import com.flamingo.ai.clouddocs.service.crawl.fetch.LoggingProgressSink;
import com.flamingo.ai.clouddocs.service.crawl.ratelimit.AdaptiveRateController;
import com.flamingo.ai.clouddocs.service.crawl.retry.ErrorClassifier;
import com.flamingo.ai.clouddocs.service.parser.ContentNormalizer;
import com.flamingo.ai.clouddocs.service.parser.NormalizedContent;
import com.flamingo.ai.clouddocs.service.storage.CleanDocumentStore;
import com.flamingo.ai.clouddocs.service.storage.FailedPageLedger;
import com.flamingo.ai.clouddocs.service.storage.RawHtmlStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the crawl pipeline: catalog, navigation, fetch, raw store, normalization, clean store.
 *
 * <p>Services are crawled one after another; pages within a service are fanned out through the
 * shared {@link AdaptiveRateController}. Page failures are recorded in the {@link
 * FailedPageLedger} and successes are removed from it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentCrawler {

  private final ServiceCatalogClient catalogClient;
  private final PageNavigator pageNavigator;
  private final DocumentFetcher documentFetcher;
  private final AdaptiveRateController rateController;
  private final ContentNormalizer contentNormalizer;
  private final RawHtmlStore rawStore;
  private final CleanDocumentStore cleanStore;
  private final FailedPageLedger failedPageLedger;
  private final CrawlerConfig crawlerConfig;
  private final Clock clock;

  /**
   * Outcome of one page after fetch and normalization. {@code retryable} marks failures worth
   * another attempt on the next {@code retry-failed} run.
   */
  record PageOutcome(
      DocumentPage page, boolean success, String error, int attempts, boolean retryable) {}

  /**
   * Crawls the selected services.
   *
   * @param options service selection and limits
   * @return per-service results and the pages that failed
   * @throws com.flamingo.ai.clouddocs.exception.CatalogUnavailableException if the catalog cannot
   *     be obtained under the configured fallback policy
   */
  public CrawlReport crawl(CrawlOptions options) {
    Instant start = clock.instant();
    log.info("Starting documentation crawl");

    ServiceCatalog catalog = catalogClient.fetchAllServices();
    List<CloudService> targets = filterServices(catalog, options.services());
    log.info("Target: {} services (catalog source: {})", targets.size(), catalog.source());

    List<ServiceCrawlResult> results = new ArrayList<>();
    List<FailedPageRecord> failed = new ArrayList<>();
    int totalPages = 0;

    for (int i = 0; i < targets.size(); i++) {
      CloudService service = targets.get(i);
      Integer remaining = options.maxPages() == null ? null : options.maxPages() - totalPages;
      log.info(
          "[{}/{}] Crawling {} ({})",
          i + 1,
          targets.size(),
          service.code().toUpperCase(Locale.ROOT),
          service.title());

      ServiceCrawlResult result = crawlService(service.code(), options, remaining, failed);
      results.add(result);
      totalPages += result.pagesScraped();

      if (options.maxPages() != null && totalPages >= options.maxPages()) {
        log.info("Reached max pages limit ({})", options.maxPages());
        break;
      }
    }

    return finish(targets.size(), totalPages, results, failed, start);
  }

  /**
   * Re-crawls the ledger's retryable pages: those flagged {@code willRetry} and those whose last
   * attempt is more than seven days old.
   */
  public CrawlReport retryFailed() {
    Instant start = clock.instant();
    List<FailedPageRecord> retryable = failedPageLedger.getRetryablePages();
    log.info(
        "Retrying {} of {} failed pages", retryable.size(), failedPageLedger.getFailedCount());

    Map<String, List<FailedPageRecord>> byService =
        retryable.stream()
            .collect(
                Collectors.groupingBy(
                    FailedPageRecord::service, LinkedHashMap::new, Collectors.toList()));

    List<ServiceCrawlResult> results = new ArrayList<>();
    List<FailedPageRecord> failed = new ArrayList<>();
    int totalPages = 0;
    for (Map.Entry<String, List<FailedPageRecord>> entry : byService.entrySet()) {
      Instant serviceStart = clock.instant();
      String service = entry.getKey();
      try {
        List<DocumentPage> pages = pagesForRetry(service, entry.getValue());
        ServiceCrawlResult result =
            processPages(service, pages, pages.size(), 0, failed, serviceStart);
        results.add(result);
        totalPages += result.pagesScraped();
      } catch (RuntimeException e) {
        log.error("Retry of {} failed: {}", service, e.getMessage(), e);
        results.add(
            ServiceCrawlResult.error(service, e.getMessage(), elapsedSince(serviceStart)));
      }
    }

    return finish(byService.size(), totalPages, results, failed, start);
  }

  private ServiceCrawlResult crawlService(
      String serviceCode, CrawlOptions options, Integer remaining, List<FailedPageRecord> failed) {
    Instant serviceStart = clock.instant();
    try {
      List<DocumentPage> pages = pageNavigator.fetchServicePages(serviceCode);
      if (pages.isEmpty()) {
        return new ServiceCrawlResult(
            serviceCode,
            0,
            0,
            0,
            0,
            ServiceCrawlResult.Status.SUCCESS,
            null,
            elapsedSince(serviceStart));
      }
      log.info("Found {} pages for {}", pages.size(), serviceCode);

      Predicate<DocumentPage> keep = page -> true;
      if (!options.force()) {
        keep = keep.and(page -> !cleanStore.exists(serviceCode, page.getId()));
      }
      if (options.skipFailed()) {
        keep = keep.and(page -> !failedPageLedger.isFailed(page.getUrl()));
      }
      List<DocumentPage> toFetch = pages.stream().filter(keep).toList();
      int skipped = pages.size() - toFetch.size();
      if (skipped > 0) {
        log.info("Skipped {} pages of {} (cached or previously failed)", skipped, serviceCode);
      }
      if (remaining != null && toFetch.size() > remaining) {
        toFetch = toFetch.subList(0, Math.max(0, remaining));
      }

      return processPages(serviceCode, toFetch, pages.size(), skipped, failed, serviceStart);
    } catch (RuntimeException e) {
      log.error("Service error for {}: {}", serviceCode, e.getMessage(), e);
      return ServiceCrawlResult.error(serviceCode, e.getMessage(), elapsedSince(serviceStart));
    }
  }

  private ServiceCrawlResult processPages(
      String serviceCode,
      List<DocumentPage> pages,
      int found,
      int skipped,
      List<FailedPageRecord> failed,
      Instant serviceStart) {
    Map<String, DocumentPage> pagesById = new HashMap<>();
    pages.forEach(
        page -> {
          page.startProcessing();
          pagesById.put(page.getId(), page);
        });

    FetchOptions fetchOptions =
        new FetchOptions(rateController, crawlerConfig.getHttp().getTimeout());
    List<PageOutcome> outcomes =
        documentFetcher
            .streamPages(pages, fetchOptions, new LoggingProgressSink(log, serviceCode, 10))
            .map(result -> processResult(pagesById.get(result.pageId()), result))
            .collectList()
            .block();

    int scraped = 0;
    int failedCount = 0;
    for (PageOutcome outcome : outcomes == null ? List.<PageOutcome>of() : outcomes) {
      if (outcome.success()) {
        scraped++;
        failedPageLedger.removeFailedPage(outcome.page().getUrl());
      } else {
        failedCount++;
        FailedPageRecord record =
            FailedPageRecord.builder()
                .service(serviceCode)
                .url(outcome.page().getUrl())
                .title(outcome.page().getTitle())
                .error(outcome.error())
                .attempts(outcome.attempts())
                .lastAttempt(clock.instant())
                .willRetry(outcome.retryable())
                .build();
        failedPageLedger.addFailedPage(record);
        synchronized (failed) {
          failed.add(record);
        }
      }
    }

    rateController.logStats();
    log.info(
        "{}: {} scraped, {} failed, {} skipped", serviceCode, scraped, failedCount, skipped);
    return new ServiceCrawlResult(
        serviceCode,
        found,
        scraped,
        failedCount,
        skipped,
        ServiceCrawlResult.statusOf(scraped, failedCount),
        null,
        elapsedSince(serviceStart));
  }

  /** Stores a fetched page. Runs off the rate controller's dispatcher thread. */
  PageOutcome processResult(DocumentPage page, FetchResult result) {
    if (!result.success()) {
      log.error("Failed to fetch {}: {}", page.getUrl(), result.error());
      page.markFailed(result.error());
      boolean retryable =
          result.cause() != null
              && ErrorClassifier.isRetryable(
                  result.cause(), Set.copyOf(crawlerConfig.getRetry().getRetryableStatuses()));
      return new PageOutcome(page, false, result.error(), result.attempts(), retryable);
    }
    try {
      RawHtmlDocument raw = result.document();
      rawStore.saveDocument(raw);

      NormalizedContent normalized = contentNormalizer.normalize(raw.html());
      CrawlerConfig.Content limits = crawlerConfig.getContent();
      if (normalized.cleanedHtml().length() < limits.getMinCleanHtmlLength()) {
        return rejected(page, "Empty or too short content after cleaning", result.attempts());
      }
      if (normalized.markdown().length() < limits.getMinMarkdownLength()) {
        return rejected(page, "Empty or too short markdown", result.attempts());
      }

      String title =
          "Untitled".equals(normalized.title()) && page.getTitle() != null
              ? page.getTitle()
              : normalized.title();
      Instant processedAt = clock.instant();
      cleanStore.saveDocument(
          new CleanDocument(
              new CleanDocument.Metadata(
                  page.getId(),
                  page.getUrl(),
                  title,
                  page.getService(),
                  page.getCategory(),
                  page.getHandbookCode(),
                  normalized.markdown().length(),
                  processedAt),
              normalized.markdown()));
      page.markScraped(normalized.markdown().length(), processedAt);
      return new PageOutcome(page, true, null, result.attempts(), false);
    } catch (RuntimeException e) {
      log.error("Processing error for {}: {}", page.getUrl(), e.getMessage(), e);
      String error = "Processing error: " + e.getMessage();
      page.markFailed(error);
      return new PageOutcome(page, false, error, result.attempts(), true);
    }
  }

  private PageOutcome rejected(DocumentPage page, String error, int attempts) {
    log.warn("Rejected {}: {}", page.getUrl(), error);
    page.markFailed(error);
    return new PageOutcome(page, false, error, attempts, false);
  }

  private List<DocumentPage> pagesForRetry(String serviceCode, List<FailedPageRecord> records) {
    Set<String> urls = records.stream().map(FailedPageRecord::url).collect(Collectors.toSet());
    Map<String, DocumentPage> navigationPages = new LinkedHashMap<>();
    Map<String, String> urlsById = new HashMap<>();
    for (DocumentPage page : pageNavigator.fetchServicePages(serviceCode)) {
      urlsById.put(page.getId(), page.getUrl());
      if (urls.contains(page.getUrl())) {
        navigationPages.put(page.getUrl(), page);
      }
    }
    List<DocumentPage> pages = new ArrayList<>();
    for (FailedPageRecord record : records) {
      DocumentPage page = navigationPages.get(record.url());
      if (page == null) {
        String baseId = PageIds.generatePageId(record.url());
        String id = PageIds.uniquePageId(baseId, record.url(), urlsById);
        log.debug(
            "{} no longer in navigation of {}, retrying by URL as '{}'",
            record.url(),
            serviceCode,
            id);
        page =
            DocumentPage.builder()
                .id(id)
                .url(record.url())
                .title(record.title())
                .service(serviceCode)
                .build();
      }
      pages.add(page);
    }
    return pages;
  }

  private List<CloudService> filterServices(ServiceCatalog catalog, List<String> codes) {
    List<CloudService> all = catalog.allServices();
    if (codes.isEmpty()) {
      return all;
    }
    Set<String> wanted =
        codes.stream()
            .map(code -> code.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    List<CloudService> selected =
        all.stream().filter(s -> wanted.contains(s.code().toLowerCase(Locale.ROOT))).toList();
    if (selected.size() < wanted.size()) {
      Set<String> known =
          selected.stream().map(s -> s.code().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
      wanted.stream()
          .filter(code -> !known.contains(code))
          .forEach(code -> log.warn("Service '{}' is not in the catalog", code));
    }
    return selected;
  }

  private CrawlReport finish(
      int totalServices,
      int totalPages,
      List<ServiceCrawlResult> results,
      List<FailedPageRecord> failed,
      Instant start) {
    cleanStore.saveSummary();
    rawStore.saveSummary();

    CrawlReport report =
        new CrawlReport(
            totalServices, totalPages, results, failed, clock.instant(), elapsedSince(start));
    log.info(
        "Crawl summary: {} services ({} success, {} partial, {} error), {} pages, {} failed, {}s",
        report.totalServices(),
        report.countWithStatus(ServiceCrawlResult.Status.SUCCESS),
        report.countWithStatus(ServiceCrawlResult.Status.PARTIAL),
        report.countWithStatus(ServiceCrawlResult.Status.ERROR),
        report.totalPages(),
        report.failedPages().size(),
        report.duration().toSeconds());
    return report;
  }

  private Duration elapsedSince(Instant start) {
    return Duration.between(start, clock.instant());
  }
}
