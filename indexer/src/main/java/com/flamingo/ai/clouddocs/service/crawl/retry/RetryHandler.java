package com.flamingo.ai.clouddocs.service.crawl.retry;

import com.flamingo.ai.clouddocs.exception.FetchException;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Bounded retry with exponential backoff for remote calls.
 *
 * <p>Only errors classified by {@link ErrorClassifier#isRetryable} are retried; anything else
 * fails on the first attempt.
 */
@Component
@Slf4j
public class RetryHandler {

  /**
   * Runs {@code operation} until it succeeds, fails with a non-retryable error, or the policy's
   * attempts are exhausted. The supplier is invoked once per attempt.
   *
   * @param operation produces a fresh attempt
   * @param policy retry parameters
   * @return a result that never errors; failures are reported through {@link RetryResult#error()}
   */
  public <T> Mono<RetryResult<T>> withRetry(Supplier<Mono<T>> operation, RetryPolicy policy) {
    return Mono.defer(
        () -> {
          AtomicInteger attempts = new AtomicInteger();
          Retry retry = buildRetry(policy);
          return Mono.defer(
                  () -> {
                    attempts.incrementAndGet();
                    return operation.get();
                  })
              .transformDeferred(RetryOperator.of(retry))
              .map(data -> RetryResult.success(data, attempts.get()))
              .switchIfEmpty(Mono.fromSupplier(() -> RetryResult.<T>success(null, attempts.get())))
              .onErrorResume(
                  error -> {
                    FetchException failure = FetchException.from(error);
                    log.debug(
                        "[{}] giving up after {} attempt(s): {}",
                        policy.name(),
                        attempts.get(),
                        failure.getMessage());
                    return Mono.just(RetryResult.<T>failure(failure, attempts.get()));
                  });
        });
  }

  /**
   * Same as {@link #withRetry} but signals the final {@link FetchException} as an error. Used
   * where the caller has no fallback path.
   */
  public <T> Mono<T> withRetryThrow(Supplier<Mono<T>> operation, RetryPolicy policy) {
    return withRetry(operation, policy)
        .flatMap(
            result ->
                result.success()
                    ? Mono.justOrEmpty(result.data())
                    : Mono.<T>error(result.error()));
  }

  private Retry buildRetry(RetryPolicy policy) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(policy.maxRetries())
            .intervalFunction(policy.intervalFunction())
            .retryOnException(
                error ->
                    ErrorClassifier.isRetryable(
                        FetchException.from(error), policy.retryableStatuses()))
            .build();
    Retry retry = Retry.of(policy.name(), config);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              FetchException failure = FetchException.from(event.getLastThrowable());
              log.warn(
                  "[{}] retry {}/{} after {}ms: {}",
                  policy.name(),
                  event.getNumberOfRetryAttempts(),
                  policy.maxRetries(),
                  event.getWaitInterval().toMillis(),
                  failure.getMessage());
              if (policy.onRetry() != null) {
                policy.onRetry().accept(event.getNumberOfRetryAttempts(), failure);
              }
            });
    return retry;
  }
}
