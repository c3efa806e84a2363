package com.acme.crm.core;

/** Non-retryable failure: invalid recipient, revoked credentials, constraint violations. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
