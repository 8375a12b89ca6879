package com.flamingo.ai.clouddocs.service.crawl.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.enums.CatalogFallbackPolicy;
import com.flamingo.ai.clouddocs.domain.model.CloudService;
import com.flamingo.ai.clouddocs.domain.model.ServiceCatalog;
import com.flamingo.ai.clouddocs.domain.model.ServiceCategory;
import com.flamingo.ai.clouddocs.exception.CatalogUnavailableException;
import com.flamingo.ai.clouddocs.exception.ErrorKind;
import com.flamingo.ai.clouddocs.exception.FetchException;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryHandler;
import com.flamingo.ai.clouddocs.service.crawl.retry.RetryPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Fetches the list of documented services from the provider's catalog endpoint. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ServiceCatalogClient {

  private final WebClient docsWebClient;
  private final RetryHandler retryHandler;
  private final CrawlerConfig crawlerConfig;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Retrieves the full catalog. When the remote catalog cannot be fetched after retries, the
   * configured {@link CatalogFallbackPolicy} decides what is returned.
   *
   * @return the catalog, never null
   * @throws CatalogUnavailableException if the policy is {@link CatalogFallbackPolicy#FAIL}
   */
  public ServiceCatalog fetchAllServices() {
    String url = crawlerConfig.getCatalog().getUrl();
    log.info("Fetching service catalog from {}", url);
    RetryPolicy policy =
        RetryPolicy.from("catalog", crawlerConfig.getRetry())
            .withOnRetry(
                (attempt, error) ->
                    log.warn("Retry {} fetching service catalog: {}", attempt, error.getMessage()));
    try {
      String body = retryHandler.withRetryThrow(() -> requestCatalog(url), policy).block();
      ServiceCatalog catalog = parseCatalog(body);
      log.info(
          "Fetched {} categories with {} services",
          catalog.categories().size(),
          catalog.serviceCount());
      saveCatalog(catalog);
      return catalog;
    } catch (FetchException e) {
      log.error("Failed to fetch service catalog: {}", e.getMessage());
      return fallback(e);
    }
  }

  private Mono<String> requestCatalog(String url) {
    return docsWebClient
        .get()
        .uri(url)
        .accept(MediaType.APPLICATION_JSON)
        .exchangeToMono(
            response -> {
              if (response.statusCode().is2xxSuccessful()) {
                return response.bodyToMono(String.class).defaultIfEmpty("");
              }
              int status = response.statusCode().value();
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

  ServiceCatalog parseCatalog(String body) {
    CatalogResponse response;
    try {
      response = objectMapper.readValue(body, CatalogResponse.class);
    } catch (JsonProcessingException e) {
      throw new FetchException(
          ErrorKind.PARSE, null, "Invalid catalog response: " + e.getOriginalMessage(), e);
    }
    if (response == null || response.data() == null) {
      throw new FetchException(ErrorKind.PARSE, null, "Invalid catalog response: missing data");
    }
    List<ServiceCategory> categories =
        response.data().stream()
            .map(
                category ->
                    new ServiceCategory(
                        category.code(),
                        category.name(),
                        category.enName(),
                        category.products() == null
                            ? List.of()
                            : category.products().stream()
                                .map(
                                    product ->
                                        new CloudService(
                                            product.code(),
                                            product.title(),
                                            category.code(),
                                            product.description(),
                                            product.uri()))
                                .toList()))
            .toList();
    return new ServiceCatalog(categories, clock.instant(), ServiceCatalog.Source.REMOTE);
  }

  private ServiceCatalog fallback(FetchException cause) {
    CatalogFallbackPolicy policy = crawlerConfig.getCatalog().getFallbackPolicy();
    switch (policy) {
      case FAIL:
        throw new CatalogUnavailableException(
            "Service catalog unavailable: " + cause.getMessage(), cause);
      case CACHED:
        Optional<ServiceCatalog> cached = loadCachedCatalog();
        if (cached.isPresent()) {
          log.warn(
              "Using cached service catalog from {} ({} services)",
              cached.get().fetchedAt(),
              cached.get().serviceCount());
          return cached.get().withSource(ServiceCatalog.Source.CACHED);
        }
        log.warn("No cached service catalog available");
        return builtInCatalog();
      case BUILT_IN:
      default:
        return builtInCatalog();
    }
  }

  /** Loads the catalog persisted by the last successful fetch. */
  public Optional<ServiceCatalog> loadCachedCatalog() {
    Path path = Path.of(crawlerConfig.getStorage().getCatalogFile());
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), ServiceCatalog.class));
    } catch (IOException e) {
      log.warn("Ignoring unreadable cached catalog {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  private void saveCatalog(ServiceCatalog catalog) {
    Path path = Path.of(crawlerConfig.getStorage().getCatalogFile());
    try {
      if (path.getParent() != null) {
        Files.createDirectories(path.getParent());
      }
      objectMapper.writeValue(path.toFile(), catalog);
      log.debug("Saved service catalog to {}", path);
    } catch (IOException e) {
      log.warn("Failed to save service catalog to {}: {}", path, e.getMessage());
    }
  }

  ServiceCatalog builtInCatalog() {
    log.warn("Using built-in service catalog");
    return new ServiceCatalog(
        List.of(
            new ServiceCategory(
                "compute",
                "Compute",
                "Compute",
                List.of(
                    new CloudService(
                        "ecs",
                        "Elastic Cloud Server",
                        "compute",
                        "Elastic Cloud Server (ECS) provides scalable computing resources on"
                            + " demand.",
                        "https://support.huaweicloud.com/intl/en-us/ecs/index.html"))),
            new ServiceCategory(
                "storage",
                "Storage",
                "Storage",
                List.of(
                    new CloudService(
                        "obs",
                        "Object Storage Service",
                        "storage",
                        "Object Storage Service (OBS) provides stable, secure, and efficient cloud"
                            + " storage.",
                        "https://support.huaweicloud.com/intl/en-us/obs/index.html")))),
        clock.instant(),
        ServiceCatalog.Source.BUILT_IN);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CatalogResponse(
      List<CatalogCategory> data, Integer total, String message, Boolean status) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CatalogCategory(String code, String name, String enName, List<CatalogProduct> products) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CatalogProduct(String code, String title, String uri, String description) {}
}
