package com.flamingo.ai.clouddocs.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/** Configuration for the non-blocking HTTP client used to reach the documentation site. */
@Configuration
public class HttpClientConfig {

  @Bean
  public WebClient docsWebClient(WebClient.Builder builder, CrawlerConfig crawlerConfig) {
    int maxInMemoryBytes = crawlerConfig.getHttp().getMaxInMemorySizeMb() * 1024 * 1024;
    return builder
        .defaultHeader(HttpHeaders.USER_AGENT, crawlerConfig.getHttp().getUserAgent())
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
        .build();
  }
}
