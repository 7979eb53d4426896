package com.newsletter.subscription;

/** The listener could not be bound: port in use, unresolvable host or insufficient permission. */
public class ServerBindException extends RuntimeException {

  public ServerBindException(String message, Throwable cause) {
    super(message, cause);
  }
}
