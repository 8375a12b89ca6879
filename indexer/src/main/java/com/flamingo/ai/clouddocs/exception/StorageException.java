package com.flamingo.ai.clouddocs.exception;

/** Exception thrown when a document store or the failed-page ledger cannot be read or written. */
public class StorageException extends RuntimeException {

  private final String path;
  private final String userMessage;

  public StorageException(String path, String message) {
    this(path, message, null);
  }

  public StorageException(String path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.userMessage = "Failed to persist crawl data";
  }

  public String getPath() {
    return path;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
