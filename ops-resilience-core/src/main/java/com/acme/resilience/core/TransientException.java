package com.acme.resilience.core;

/** A dependency failure expected to clear on its own; the kind worth retrying. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
