package com.flamingo.ai.clouddocs.service.crawl.retry;

import com.flamingo.ai.clouddocs.exception.ErrorKind;
import com.flamingo.ai.clouddocs.exception.FetchException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Decides whether a {@link FetchException} is retryable and whether it signals rate limiting. */
public final class ErrorClassifier {

  private static final Set<Integer> RATE_LIMIT_STATUSES = Set.of(429, 403, 503);

  private static final List<String> RATE_LIMIT_PHRASES =
      List.of(
          "rate limit",
          "ratelimit",
          "too many requests",
          "too many connections",
          "throttled",
          "throttling",
          "quota exceeded",
          "limit exceeded",
          "request limit",
          "api limit",
          "slow down",
          "retry-after",
          "rate exceeded",
          "bandwidth limit",
          "concurrent request",
          "请求过于频繁",
          "访问过于频繁",
          "已达到限制",
          "频率限制");

  private ErrorClassifier() {}

  /**
   * Returns whether the error should be retried: an HTTP status from {@code retryableStatuses} or
   * a network-level failure.
   */
  public static boolean isRetryable(FetchException error, Set<Integer> retryableStatuses) {
    if (error.getKind() == ErrorKind.HTTP) {
      return error.getHttpStatus() != null && retryableStatuses.contains(error.getHttpStatus());
    }
    return error.getKind().isNetwork();
  }

  /** Returns whether the error indicates the remote side is throttling us. */
  public static boolean isRateLimit(FetchException error) {
    if (error.getKind() == ErrorKind.HTTP
        && error.getHttpStatus() != null
        && RATE_LIMIT_STATUSES.contains(error.getHttpStatus())) {
      return true;
    }
    String message = error.getMessage();
    if (message == null || message.isEmpty()) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String phrase : RATE_LIMIT_PHRASES) {
      if (lower.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
