package com.flamingo.ai.clouddocs.service.crawl.fetch;

import com.flamingo.ai.clouddocs.service.crawl.ratelimit.AdaptiveRateController;
import java.time.Duration;

/**
 * Per-call fetch settings.
 *
 * @param rateController admission control shared by all fetches of a run, may be null to bypass
 * @param timeout bound on a single HTTP attempt
 */
public record FetchOptions(AdaptiveRateController rateController, Duration timeout) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public FetchOptions {
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
  }

  public static FetchOptions of(AdaptiveRateController rateController) {
    return new FetchOptions(rateController, DEFAULT_TIMEOUT);
  }
}
