package com.flamingo.ai.clouddocs.service.crawl.ratelimit;

import java.time.Instant;

/** Point-in-time view of an {@link AdaptiveRateController}. */
public record RateControllerStats(
    int currentConcurrent,
    long currentDelayMs,
    Instant lastRateLimitTime,
    int rateLimitCount,
    int consecutiveSuccesses,
    int consecutiveFailures,
    long totalRequests,
    long totalSuccesses,
    long totalFailures,
    Instant lastAdjustmentTime,
    int queueLength,
    int running) {

  /** Returns the share of finished requests that succeeded, as a whole percentage. */
  public long successRatePercent() {
    return totalRequests > 0 ? Math.round(totalSuccesses * 100.0 / totalRequests) : 0;
  }
}
