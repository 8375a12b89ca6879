package com.flamingo.ai.clouddocs.config;

import com.flamingo.ai.clouddocs.domain.enums.CatalogFallbackPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the documentation crawler. */
@Configuration
@ConfigurationProperties(prefix = "crawler")
@Getter
@Setter
public class CrawlerConfig {

  private Catalog catalog = new Catalog();
  private Navigation navigation = new Navigation();
  private Http http = new Http();
  private Retry retry = new Retry();
  private RateControl rateControl = new RateControl();
  private Content content = new Content();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Catalog {
    private String url =
        "https://portal.huaweicloud.com/rest/cbc/portaldocdataservice/v1/books/items?appId=INTL-EN_US";

    /** What to serve when the remote catalog cannot be fetched. */
    private CatalogFallbackPolicy fallbackPolicy = CatalogFallbackPolicy.CACHED;
  }

  @Getter
  @Setter
  public static class Navigation {
    private String docBaseUrl = "https://support.huaweicloud.com/intl/en-us";
    private String fragmentName = "v3_support_leftmenu_fragment.html";

    /** Locale segment every discovered URL is rewritten to. */
    private String canonicalLocale = "en-us";
  }

  @Getter
  @Setter
  public static class Http {
    private String userAgent = "HuaweiCloud-Scraper/1.0";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxInMemorySizeMb = 16;
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(1);
    private List<Integer> retryableStatuses =
        new ArrayList<>(List.of(408, 429, 500, 502, 503, 504));
  }

  @Getter
  @Setter
  public static class RateControl {
    private int maxConcurrent = 10;
    private Duration baseDelay = Duration.ofMillis(100);
    private Duration heartbeat = Duration.ofSeconds(1);
  }

  @Getter
  @Setter
  public static class Content {
    /** Minimum characters of cleaned HTML for a page to count as scraped. */
    private int minCleanHtmlLength = 100;

    /** Minimum characters of converted markdown for a page to count as scraped. */
    private int minMarkdownLength = 50;
  }

  @Getter
  @Setter
  public static class Storage {
    private String baseDir = "rag_cache";
    private String rawDir = "rag_cache/raw_html";
    private String cleanDir = "rag_cache/clean_docs";
    private String failedPagesFile = "rag_cache/failed_pages.json";
    private String catalogFile = "rag_cache/service-catalog.json";
  }
}
