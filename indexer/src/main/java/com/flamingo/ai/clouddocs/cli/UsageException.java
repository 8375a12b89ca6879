package com.flamingo.ai.clouddocs.cli;

/** Exception thrown for an unknown command or a malformed option. */
public class UsageException extends RuntimeException {

  public UsageException(String message) {
    super(message);
  }

  public UsageException(String message, Throwable cause) {
    super(message, cause);
  }
}
