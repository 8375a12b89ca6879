package com.flamingo.ai.clouddocs.service.crawl.ratelimit;

import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.exception.FetchException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Schedulers;

/**
 * Admission control for every outbound documentation request.
 *
 * <p>Operations are queued in submission order and dispatched in batches: at most {@code
 * currentConcurrent} run at once and a {@code currentDelayMs} pause follows each batch. Both values
 * adapt to observed outcomes through {@link RateControllerState}.
 *
 * <p>The queue, the running counter and all state updates are confined to a single dispatcher
 * thread. Completions of the wrapped operations hop onto that thread before the state is updated;
 * the caller is then released on {@code boundedElastic} so that slow consumers never hold the
 * dispatcher.
 */
@Component
@Slf4j
public class AdaptiveRateController {

  private final RateControllerState state;
  private final ScheduledExecutorService dispatcher;
  private final Duration heartbeatInterval;

  // dispatcher thread only
  private final Deque<Runnable> queue = new ArrayDeque<>();
  private int running;
  private boolean batchPauseActive;

  private volatile int queueLengthView;
  private volatile int runningView;
  private ScheduledFuture<?> heartbeat;

  @Autowired
  public AdaptiveRateController(
      CrawlerConfig crawlerConfig,
      @Qualifier("rateControllerScheduler") ThreadPoolTaskScheduler rateControllerScheduler,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        crawlerConfig.getRateControl().getMaxConcurrent(),
        crawlerConfig.getRateControl().getBaseDelay(),
        crawlerConfig.getRateControl().getHeartbeat(),
        rateControllerScheduler.getScheduledExecutor(),
        clock,
        meterRegistry);
  }

  /** Constructor for testing - allows a plain executor and a controllable clock. */
  @VisibleForTesting
  public AdaptiveRateController(
      int maxConcurrent,
      Duration baseDelay,
      Duration heartbeatInterval,
      ScheduledExecutorService dispatcher,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.state = new RateControllerState(maxConcurrent, baseDelay, clock);
    this.dispatcher = dispatcher;
    this.heartbeatInterval = heartbeatInterval;
    meterRegistry.gauge("crawler.rate.concurrent", state, s -> s.getCurrentConcurrent());
    meterRegistry.gauge("crawler.rate.delay_ms", state, s -> s.getCurrentDelayMs());
    log.info(
        "Rate controller initialized: {} concurrent, {}ms delay",
        maxConcurrent,
        baseDelay.toMillis());
  }

  /** Starts the heartbeat that applies due cooldown resets while the queue is idle. */
  @PostConstruct
  public void startHeartbeat() {
    if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeat != null) {
      return;
    }
    long periodMs = heartbeatInterval.toMillis();
    heartbeat =
        dispatcher.scheduleAtFixedRate(
            () -> runGuarded(this::drain), periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  @PreDestroy
  public void stopHeartbeat() {
    if (heartbeat != null) {
      heartbeat.cancel(false);
      heartbeat = null;
    }
  }

  /**
   * Runs {@code operation} once admission allows it.
   *
   * <p>The returned {@code Mono} signals exactly the operation's own value or error; the
   * controller's state is updated before that signal is delivered.
   *
   * @param operation produces the remote call; invoked on the dispatcher thread
   * @param context short label for logs, may be null
   * @return the operation's outcome
   */
  public <T> Mono<T> execute(Supplier<Mono<T>> operation, String context) {
    return Mono.<T>create(
            sink ->
                runGuarded(
                    () -> {
                      queue.addLast(() -> start(operation, context, sink));
                      drain();
                    }))
        .publishOn(Schedulers.boundedElastic());
  }

  public RateControllerStats getStats() {
    return state.snapshot(queueLengthView, runningView);
  }

  public void logStats() {
    RateControllerStats stats = getStats();
    log.info(
        "Rate controller stats: {} concurrent | {}ms delay | {}% success | queue: {} | running: {}",
        stats.currentConcurrent(),
        stats.currentDelayMs(),
        stats.successRatePercent(),
        stats.queueLength(),
        stats.running());
  }

  @VisibleForTesting
  RateControllerState state() {
    return state;
  }

  private <T> void start(Supplier<Mono<T>> operation, String context, MonoSink<T> sink) {
    running++;
    state.recordDispatch();
    Mono<T> call;
    try {
      call = operation.get();
    } catch (RuntimeException e) {
      call = Mono.error(e);
    }
    log.trace("Dispatched {}", context);
    call.toFuture()
        .whenComplete(
            (value, error) -> runGuarded(() -> complete(value, error, context, sink)));
  }

  private <T> void complete(T value, Throwable error, String context, MonoSink<T> sink) {
    running--;
    if (error == null) {
      state.recordSuccess();
      drain();
      if (value == null) {
        sink.success();
      } else {
        sink.success(value);
      }
      return;
    }
    boolean rateLimited = state.recordFailure(FetchException.from(error));
    if (rateLimited) {
      log.debug("Rate-limited response for {}", context);
    }
    drain();
    sink.error(error);
  }

  private void drain() {
    state.tick();
    if (!batchPauseActive) {
      int capacity = state.getCurrentConcurrent() - running;
      int batchSize = Math.min(capacity, queue.size());
      for (int i = 0; i < batchSize; i++) {
        queue.pollFirst().run();
      }
      long delayMs = state.getCurrentDelayMs();
      if (batchSize > 0 && delayMs > 0) {
        batchPauseActive = true;
        dispatcher.schedule(
            () ->
                runGuarded(
                    () -> {
                      batchPauseActive = false;
                      drain();
                    }),
            delayMs,
            TimeUnit.MILLISECONDS);
      }
    }
    queueLengthView = queue.size();
    runningView = running;
  }

  private void runGuarded(Runnable task) {
    dispatcher.execute(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            log.error("Rate controller dispatcher task failed: {}", e.getMessage(), e);
          }
        });
  }
}
