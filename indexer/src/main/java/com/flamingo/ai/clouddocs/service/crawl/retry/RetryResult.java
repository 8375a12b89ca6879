package com.flamingo.ai.clouddocs.service.crawl.retry;

import com.flamingo.ai.clouddocs.exception.FetchException;

/**
 * Outcome of a retried operation.
 *
 * @param success whether some attempt succeeded
 * @param data the value of the successful attempt, null on failure
 * @param error the error of the last attempt, null on success
 * @param attempts number of attempts made
 * @param <T> value type
 */
public record RetryResult<T>(boolean success, T data, FetchException error, int attempts) {

  public static <T> RetryResult<T> success(T data, int attempts) {
    return new RetryResult<>(true, data, null, attempts);
  }

  public static <T> RetryResult<T> failure(FetchException error, int attempts) {
    return new RetryResult<>(false, null, error, attempts);
  }
}
