package com.acme.rmq.core;

/**
 * The broker connection or channel is unusable. Raised at startup when the connection cannot be
 * opened and at runtime when a publish cannot be confirmed. Never retried locally: the process is
 * expected to stop and be restarted by its supervisor.
 */
public class ConnectivityException extends RuntimeException {
  public ConnectivityException(String message) {
    super(message);
  }

  public ConnectivityException(String message, Throwable e) {
    super(message, e);
  }
}
