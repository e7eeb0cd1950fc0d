package com.acme.resilience.core;

/** An envelope could not be published: the broker did not acknowledge it or no producer was running. */
public class PublishException extends TransientException {
  public PublishException(String message, Throwable e) {
    super(message, e);
  }
}
