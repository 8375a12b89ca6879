package com.flamingo.ai.clouddocs.service.crawl.ratelimit;

import com.flamingo.ai.clouddocs.exception.FetchException;
import com.flamingo.ai.clouddocs.service.crawl.retry.ErrorClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Self-tuning concurrency and pacing state of the {@link AdaptiveRateController}.
 *
 * <p>The state reacts to reported outcomes:
 *
 * <ul>
 *   <li>50 consecutive successes, at most once per 10s: concurrency +2 (up to the maximum) and
 *       delay x0.9 (down to 50ms).
 *   <li>A rate-limit failure, at most once per second: concurrency halved (at least 2) and delay
 *       doubled within [500ms, 5000ms]. A reset to the configured maximum and base delay becomes
 *       due once 30s pass without another rate-limit failure.
 *   <li>5 consecutive other failures: delay x1.5, capped at 1000ms.
 * </ul>
 *
 * <p>The due reset is applied by {@link #tick()}, so time only advances through the injected
 * {@link Clock}.
 */
@Slf4j
public class RateControllerState {

  static final int SPEED_UP_SUCCESS_THRESHOLD = 50;
  static final int SLOW_DOWN_FAILURE_THRESHOLD = 5;
  static final Duration SPEED_UP_INTERVAL = Duration.ofSeconds(10);
  static final Duration SLOW_DOWN_INTERVAL = Duration.ofSeconds(1);
  static final Duration RESET_QUIET_PERIOD = Duration.ofSeconds(30);
  static final int MIN_CONCURRENT = 2;
  static final double MIN_DELAY_MS = 50;
  static final double RATE_LIMIT_MIN_DELAY_MS = 500;
  static final double RATE_LIMIT_MAX_DELAY_MS = 5000;
  static final double FAILURE_MAX_DELAY_MS = 1000;

  private final int maxConcurrent;
  private final double baseDelayMs;
  private final Clock clock;

  private int currentConcurrent;
  private double currentDelayMs;
  private Instant lastRateLimitTime;
  private int rateLimitCount;
  private int consecutiveSuccesses;
  private int consecutiveFailures;
  private long totalRequests;
  private long totalSuccesses;
  private long totalFailures;
  private Instant lastAdjustmentTime;
  private Instant resetDueAt;

  public RateControllerState(int maxConcurrent, Duration baseDelay, Clock clock) {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be positive, got " + maxConcurrent);
    }
    this.maxConcurrent = maxConcurrent;
    this.baseDelayMs = baseDelay.toMillis();
    this.clock = clock;
    this.currentConcurrent = maxConcurrent;
    this.currentDelayMs = baseDelayMs;
    this.lastAdjustmentTime = clock.instant();
  }

  /** Counts an operation handed to the remote side. */
  public synchronized void recordDispatch() {
    totalRequests++;
  }

  /** Records a successful operation and speeds up when the success streak is long enough. */
  public synchronized void recordSuccess() {
    consecutiveSuccesses++;
    consecutiveFailures = 0;
    totalSuccesses++;
    if (consecutiveSuccesses >= SPEED_UP_SUCCESS_THRESHOLD) {
      increaseSpeed();
      consecutiveSuccesses = 0;
    }
  }

  /**
   * Records a failed operation.
   *
   * @param error the classified failure
   * @return true if the failure was classified as rate limiting
   */
  public synchronized boolean recordFailure(FetchException error) {
    consecutiveFailures++;
    consecutiveSuccesses = 0;
    totalFailures++;

    if (ErrorClassifier.isRateLimit(error)) {
      rateLimitCount++;
      lastRateLimitTime = clock.instant();
      decreaseSpeed(error);
      return true;
    }
    if (consecutiveFailures >= SLOW_DOWN_FAILURE_THRESHOLD) {
      double slowed = Math.min(FAILURE_MAX_DELAY_MS, currentDelayMs * 1.5);
      log.warn(
          "{} consecutive failures, reducing speed slightly: {}ms -> {}ms delay",
          consecutiveFailures,
          Math.round(currentDelayMs),
          Math.round(Math.max(currentDelayMs, slowed)));
      currentDelayMs = Math.max(currentDelayMs, slowed);
      consecutiveFailures = 0;
    }
    return false;
  }

  /**
   * Applies the pending reset if 30s have passed since the last rate-limit failure. If another
   * rate-limit failure arrived in the meantime the reset is pushed back instead.
   *
   * @return true if the state was reset
   */
  public synchronized boolean tick() {
    if (resetDueAt == null) {
      return false;
    }
    Instant now = clock.instant();
    if (now.isBefore(resetDueAt)) {
      return false;
    }
    Instant quietSince = lastRateLimitTime != null ? lastRateLimitTime : resetDueAt;
    Instant quietUntil = quietSince.plus(RESET_QUIET_PERIOD);
    if (now.isBefore(quietUntil)) {
      resetDueAt = quietUntil;
      return false;
    }
    currentConcurrent = maxConcurrent;
    currentDelayMs = baseDelayMs;
    rateLimitCount = 0;
    resetDueAt = null;
    log.info(
        "Rate controller reset after cooldown: {} concurrent, {}ms delay",
        currentConcurrent,
        Math.round(currentDelayMs));
    return true;
  }

  private void increaseSpeed() {
    Instant now = clock.instant();
    if (Duration.between(lastAdjustmentTime, now).compareTo(SPEED_UP_INTERVAL) < 0) {
      return;
    }
    int oldConcurrent = currentConcurrent;
    double oldDelay = currentDelayMs;
    if (currentConcurrent < maxConcurrent) {
      currentConcurrent = Math.min(maxConcurrent, currentConcurrent + 2);
    }
    if (currentDelayMs > MIN_DELAY_MS) {
      currentDelayMs = Math.max(MIN_DELAY_MS, currentDelayMs * 0.9);
    }
    lastAdjustmentTime = now;
    if (oldConcurrent != currentConcurrent || oldDelay != currentDelayMs) {
      log.info(
          "Speed increased: {} -> {} concurrent, {}ms -> {}ms delay",
          oldConcurrent,
          currentConcurrent,
          Math.round(oldDelay),
          Math.round(currentDelayMs));
    }
  }

  private void decreaseSpeed(FetchException error) {
    Instant now = clock.instant();
    if (Duration.between(lastAdjustmentTime, now).compareTo(SLOW_DOWN_INTERVAL) < 0) {
      return;
    }
    int oldConcurrent = currentConcurrent;
    double oldDelay = currentDelayMs;
    currentConcurrent = Math.max(MIN_CONCURRENT, currentConcurrent / 2);
    currentDelayMs =
        Math.min(RATE_LIMIT_MAX_DELAY_MS, Math.max(RATE_LIMIT_MIN_DELAY_MS, currentDelayMs * 2));
    lastAdjustmentTime = now;
    resetDueAt = now.plus(RESET_QUIET_PERIOD);
    log.warn("Rate limit detected: {}", error.getMessage());
    log.warn(
        "Speed reduced: {} -> {} concurrent, {}ms -> {}ms delay",
        oldConcurrent,
        currentConcurrent,
        Math.round(oldDelay),
        Math.round(currentDelayMs));
  }

  public synchronized int getCurrentConcurrent() {
    return currentConcurrent;
  }

  public synchronized long getCurrentDelayMs() {
    return Math.round(currentDelayMs);
  }

  public int getMaxConcurrent() {
    return maxConcurrent;
  }

  /** Returns when the pending cooldown reset is due, null if none is pending. */
  public synchronized Instant getResetDueAt() {
    return resetDueAt;
  }

  /** Snapshot of the state together with dispatcher counters supplied by the caller. */
  public synchronized RateControllerStats snapshot(int queueLength, int running) {
    return new RateControllerStats(
        currentConcurrent,
        Math.round(currentDelayMs),
        lastRateLimitTime,
        rateLimitCount,
        consecutiveSuccesses,
        consecutiveFailures,
        totalRequests,
        totalSuccesses,
        totalFailures,
        lastAdjustmentTime,
        queueLength,
        running);
  }
}
