package com.acme.crm.core;

/** Retryable failure: provider timeouts, throttling, lost database connections. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
