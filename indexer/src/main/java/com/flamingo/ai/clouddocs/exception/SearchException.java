package com.flamingo.ai.clouddocs.exception;

/** Exception thrown when a vector index cannot be opened, written or queried. */
public class SearchException extends RuntimeException {

  private final String collection;
  private final String userMessage;

  public SearchException(String collection, String message) {
    super(message);
    this.collection = collection;
    this.userMessage = "Vector index '" + collection + "' is unavailable";
  }

  public SearchException(String collection, String message, Throwable cause) {
    super(message, cause);
    this.collection = collection;
    this.userMessage = "Vector index '" + collection + "' is unavailable";
  }

  public String getCollection() {
    return collection;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
