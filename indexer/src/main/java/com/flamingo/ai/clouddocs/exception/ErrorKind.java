package com.flamingo.ai.clouddocs.exception;

/** Classification of a failed remote call. */
public enum ErrorKind {
  /** The server answered with a non-2xx status. */
  HTTP,

  /** The request did not complete within its timeout. */
  TIMEOUT,

  /** The connection was reset or closed prematurely. */
  CONNECTION_RESET,

  /** The connection was refused. */
  CONNECTION_REFUSED,

  /** The host name could not be resolved. */
  DNS_FAILURE,

  /** The response arrived but could not be parsed. */
  PARSE,

  /** Anything else. */
  UNKNOWN;

  /** Returns whether this kind is a network-level failure that is worth retrying. */
  public boolean isNetwork() {
    return this == TIMEOUT
        || this == CONNECTION_RESET
        || this == CONNECTION_REFUSED
        || this == DNS_FAILURE;
  }
}
