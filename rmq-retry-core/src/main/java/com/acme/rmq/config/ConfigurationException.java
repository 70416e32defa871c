package com.acme.rmq.config;

import com.acme.rmq.core.PermanentException;

/** Settings are missing or invalid. Fatal at startup. */
public class ConfigurationException extends PermanentException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable e) {
    super(message, e);
  }
}
