package com.flamingo.ai.clouddocs.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.FailedPageRecord;
import com.flamingo.ai.clouddocs.exception.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Durable list of pages that failed to fetch or normalize, keyed by URL.
 *
 * <p>The whole ledger is a single JSON file {@code {timestamp, totalFailed, pages[]}} that is
 * re-read and rewritten on every mutation. All operations are serialized on this instance.
 */
@Component
@Slf4j
public class FailedPageLedger {

  static final Duration STALE_AFTER = Duration.ofDays(7);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public FailedPageLedger(CrawlerConfig crawlerConfig, ObjectMapper objectMapper, Clock clock) {
    this(Path.of(crawlerConfig.getStorage().getFailedPagesFile()), objectMapper, clock);
  }

  public FailedPageLedger(Path file, ObjectMapper objectMapper, Clock clock) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Persisted form of the ledger. */
  public record LedgerFile(Instant timestamp, int totalFailed, List<FailedPageRecord> pages) {

    public LedgerFile {
      pages = pages == null ? List.of() : List.copyOf(pages);
    }
  }

  /**
   * Inserts the record or replaces the one with the same URL. A missing {@code lastAttempt} is
   * set to now.
   */
  public synchronized void addFailedPage(FailedPageRecord record) {
    FailedPageRecord stamped =
        record.lastAttempt() == null
            ? record.toBuilder().lastAttempt(clock.instant()).build()
            : record;
    List<FailedPageRecord> pages = new ArrayList<>(load().pages());
    int existing = indexOf(pages, stamped.url());
    if (existing >= 0) {
      pages.set(existing, stamped);
    } else {
      pages.add(stamped);
    }
    save(pages);
    log.debug("Logged failed page: {}", stamped.url());
  }

  /** Removes the record for {@code url}; does nothing when it is not in the ledger. */
  public synchronized void removeFailedPage(String url) {
    List<FailedPageRecord> pages = new ArrayList<>(load().pages());
    int existing = indexOf(pages, url);
    if (existing < 0) {
      return;
    }
    pages.remove(existing);
    save(pages);
    log.debug("Removed from failed list: {}", url);
  }

  public synchronized List<FailedPageRecord> getFailedPages() {
    return load().pages();
  }

  public synchronized List<FailedPageRecord> getFailedPagesForService(String serviceCode) {
    return load().pages().stream().filter(p -> serviceCode.equals(p.service())).toList();
  }

  public synchronized Optional<FailedPageRecord> getFailedPage(String url) {
    return load().pages().stream().filter(p -> p.url().equals(url)).findFirst();
  }

  public synchronized boolean isFailed(String url) {
    return load().pages().stream().anyMatch(p -> p.url().equals(url));
  }

  public synchronized int getFailedCount() {
    return load().pages().size();
  }

  public synchronized void clear() {
    save(List.of());
    log.info("Cleared failed pages log");
  }

  /** Records flagged {@code willRetry}, or whose last attempt is more than seven days old. */
  public synchronized List<FailedPageRecord> getRetryablePages() {
    Instant cutoff = clock.instant().minus(STALE_AFTER);
    return load().pages().stream()
        .filter(
            p ->
                p.isMarkedForRetry()
                    || (p.lastAttempt() != null && p.lastAttempt().isBefore(cutoff)))
        .toList();
  }

  private LedgerFile load() {
    if (!Files.isRegularFile(file)) {
      return new LedgerFile(clock.instant(), 0, List.of());
    }
    try {
      return objectMapper.readValue(file.toFile(), LedgerFile.class);
    } catch (IOException e) {
      log.error("Error loading failed pages log {}: {}", file, e.getMessage());
      return new LedgerFile(clock.instant(), 0, List.of());
    }
  }

  private void save(List<FailedPageRecord> pages) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writeValue(file.toFile(), new LedgerFile(clock.instant(), pages.size(), pages));
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Failed to save failed pages log", e);
    }
  }

  private static int indexOf(List<FailedPageRecord> pages, String url) {
    for (int i = 0; i < pages.size(); i++) {
      if (pages.get(i).url().equals(url)) {
        return i;
      }
    }
    return -1;
  }
}
