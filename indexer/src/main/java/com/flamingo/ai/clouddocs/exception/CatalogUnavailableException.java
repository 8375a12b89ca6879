package com.flamingo.ai.clouddocs.exception;

/** Exception thrown when the service catalog cannot be obtained and no fallback is allowed. */
public class CatalogUnavailableException extends RuntimeException {

  private final String userMessage;

  public CatalogUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Service catalog is unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
