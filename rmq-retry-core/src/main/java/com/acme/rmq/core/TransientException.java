package com.acme.rmq.core;

/** A per-message processing failure. The message is recycled through the retry queue. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
