package com.flamingo.ai.clouddocs.exception;

/** Exception thrown when embeddings cannot be generated or have an unexpected shape. */
public class EmbeddingException extends RuntimeException {

  private final String userMessage;

  public EmbeddingException(String message) {
    super(message);
    this.userMessage = "Embedding generation failed";
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding generation failed";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
