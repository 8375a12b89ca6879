package com.flamingo.ai.clouddocs.service.crawl.fetch;

import java.util.Objects;
import org.slf4j.Logger;

/**
 * Progress sink that writes to the given logger: every event at DEBUG, and at INFO whenever
 * another {@code stepPercent} of the work has completed.
 */
public class LoggingProgressSink implements FetchProgressSink {

  private final Logger log;
  private final String label;
  private final int stepPercent;
  private int lastLoggedPercent = -1;

  public LoggingProgressSink(Logger logger, String label, int stepPercent) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.label = label;
    this.stepPercent = Math.max(1, stepPercent);
  }

  @Override
  public void onProgress(FetchProgress progress) {
    log.debug(
        "[{}] {}/{} {} ({})",
        label,
        progress.completed(),
        progress.total(),
        progress.pageId(),
        progress.success() ? "ok" : "failed");
    int percent = progress.percent();
    if (progress.completed() == progress.total()
        || percent / stepPercent > lastLoggedPercent / stepPercent) {
      lastLoggedPercent = percent;
      log.info("[{}] {}/{} pages ({}%)", label, progress.completed(), progress.total(), percent);
    }
  }
}
