package com.flamingo.ai.clouddocs.exception;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Failure of a remote documentation call, tagged with its {@link ErrorKind} and, for HTTP errors,
 * the response status.
 */
public class FetchException extends RuntimeException {

  private final ErrorKind kind;
  private final Integer httpStatus;
  private final String userMessage;

  public FetchException(ErrorKind kind, Integer httpStatus, String message) {
    super(message);
    this.kind = kind;
    this.httpStatus = httpStatus;
    this.userMessage = "Failed to fetch documentation page";
  }

  public FetchException(ErrorKind kind, Integer httpStatus, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.httpStatus = httpStatus;
    this.userMessage = "Failed to fetch documentation page";
  }

  /** Creates an HTTP failure for a non-2xx response. */
  public static FetchException httpStatus(int status, String reason) {
    return new FetchException(ErrorKind.HTTP, status, "HTTP " + status + ": " + reason);
  }

  /**
   * Converts any throwable raised by a remote call into a tagged failure. The cause chain is
   * inspected so that wrapped transport errors keep their network classification.
   *
   * @param error the raised error
   * @return the same instance if it is already a {@code FetchException}, otherwise a new one
   */
  public static FetchException from(Throwable error) {
    if (error instanceof FetchException fetchException) {
      return fetchException;
    }
    Throwable current = error;
    while (current != null) {
      if (current instanceof FetchException fetchException) {
        return fetchException;
      }
      if (current instanceof WebClientResponseException responseException) {
        return new FetchException(
            ErrorKind.HTTP,
            responseException.getStatusCode().value(),
            "HTTP "
                + responseException.getStatusCode().value()
                + ": "
                + responseException.getStatusText(),
            error);
      }
      ErrorKind kind = classifyTransport(current);
      if (kind != null) {
        return new FetchException(kind, null, describe(error), error);
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return new FetchException(ErrorKind.UNKNOWN, null, describe(error), error);
  }

  private static ErrorKind classifyTransport(Throwable error) {
    if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
      return ErrorKind.TIMEOUT;
    }
    if (error instanceof UnknownHostException) {
      return ErrorKind.DNS_FAILURE;
    }
    if (error instanceof ConnectException) {
      return ErrorKind.CONNECTION_REFUSED;
    }
    String name = error.getClass().getSimpleName();
    if (name.contains("Timeout")) {
      return ErrorKind.TIMEOUT;
    }
    if (name.equals("PrematureCloseException")) {
      return ErrorKind.CONNECTION_RESET;
    }
    String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    if (error instanceof IOException && message.contains("connection reset")) {
      return ErrorKind.CONNECTION_RESET;
    }
    if (message.contains("econnreset")) {
      return ErrorKind.CONNECTION_RESET;
    }
    if (message.contains("etimedout")) {
      return ErrorKind.TIMEOUT;
    }
    if (message.contains("enotfound")) {
      return ErrorKind.DNS_FAILURE;
    }
    if (message.contains("econnrefused")) {
      return ErrorKind.CONNECTION_REFUSED;
    }
    return null;
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Returns the HTTP status for {@link ErrorKind#HTTP} failures, null otherwise. */
  public Integer getHttpStatus() {
    return httpStatus;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
