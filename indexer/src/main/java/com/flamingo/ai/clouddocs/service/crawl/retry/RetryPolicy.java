package com.flamingo.ai.clouddocs.service.crawl.retry;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.exception.FetchException;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Parameters of a bounded retry.
 *
 * @param name label used in logs
 * @param maxRetries total number of attempts, including the first one
 * @param baseDelay delay before the second attempt; doubles for every further attempt
 * @param maxDelay upper bound for a single backoff delay
 * @param retryableStatuses HTTP statuses that are retried
 * @param onRetry invoked with the attempt number and error before each backoff, may be null
 */
public record RetryPolicy(
    String name,
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    Set<Integer> retryableStatuses,
    BiConsumer<Integer, FetchException> onRetry) {

  public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES =
      Set.of(408, 429, 500, 502, 503, 504);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  public RetryPolicy {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
    }
    baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
    maxDelay = maxDelay == null ? DEFAULT_MAX_DELAY : maxDelay;
    retryableStatuses =
        retryableStatuses == null ? DEFAULT_RETRYABLE_STATUSES : Set.copyOf(retryableStatuses);
  }

  /** Builds a policy from the crawler's retry settings. */
  public static RetryPolicy from(String name, CrawlerConfig.Retry settings) {
    return new RetryPolicy(
        name,
        settings.getMaxRetries(),
        settings.getBaseDelay(),
        null,
        Set.copyOf(settings.getRetryableStatuses()),
        null);
  }

  public static RetryPolicy of(String name, int maxRetries, Duration baseDelay) {
    return new RetryPolicy(name, maxRetries, baseDelay, null, null, null);
  }

  public RetryPolicy withRetryableStatuses(Set<Integer> statuses) {
    return new RetryPolicy(name, maxRetries, baseDelay, maxDelay, statuses, onRetry);
  }

  public RetryPolicy withOnRetry(BiConsumer<Integer, FetchException> listener) {
    return new RetryPolicy(name, maxRetries, baseDelay, maxDelay, retryableStatuses, listener);
  }

  /**
   * Backoff between attempts: {@code baseDelay * 2^(attempt-1)} milliseconds after attempt {@code
   * attempt}, capped at {@code maxDelay}.
   */
  public IntervalFunction intervalFunction() {
    return IntervalFunction.ofExponentialBackoff(baseDelay, 2.0, maxDelay);
  }
}
