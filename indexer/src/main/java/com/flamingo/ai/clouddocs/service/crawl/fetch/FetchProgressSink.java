package com.flamingo.ai.clouddocs.service.crawl.fetch;

/**
 * Receives fetch progress events. Calls are serialized and arrive in completion order.
 * Implementations must not block for long; they run on the fetch completion path.
 */
@FunctionalInterface
public interface FetchProgressSink {

  void onProgress(FetchProgress progress);

  /** Sink that drops every event. */
  static FetchProgressSink noop() {
    return progress -> {};
  }
}
