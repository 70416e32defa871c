package com.acme.rmq.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable configuration of one consumer: how to reach the broker and where messages are routed.
 * Use {@link #fromMap(Map)} to build validated settings from raw string options; the builder is
 * meant for code that already holds typed values.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class Settings {

  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String VHOST = "vhost";
  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String EXCHANGE = "exchange";
  public static final String QUEUE_CONSUME = "queue_consume";
  public static final String QUEUE_RETRY = "queue_retry";
  public static final String QUEUE_DEAD_LETTER = "queue_dead_letter";
  public static final String RETRY_COUNT = "retry_count";
  public static final String CONFIRM_TIMEOUT_MS = "confirm_timeout_ms";
  public static final String CONNECTION_NAME = "connection_name";

  /** Options without a default. */
  public static final List<String> REQUIRED_KEYS =
      List.of(
          HOST,
          PORT,
          VHOST,
          USER,
          PASSWORD,
          EXCHANGE,
          QUEUE_CONSUME,
          QUEUE_RETRY,
          QUEUE_DEAD_LETTER,
          RETRY_COUNT);

  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofMillis(5000);
  public static final String DEFAULT_CONNECTION_NAME = "rmq-retry-worker";

  private final String host;
  private final int port;
  private final String vhost;
  private final String user;

  @ToString.Exclude private final String password;

  private final String exchange;
  private final String queueConsume;
  private final String queueRetry;
  private final String queueDeadLetter;

  /** Redeliveries tolerated before a message is dead-lettered. */
  private final int retryCount;

  @Builder.Default private final Duration confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;
  @Builder.Default private final String connectionName = DEFAULT_CONNECTION_NAME;

  /**
   * Build settings from raw options keyed by the lowercase option names ({@code host},
   * {@code queue_retry}, ...).
   *
   * @throws ConfigurationException listing every missing key, or naming the first invalid value
   */
  public static Settings fromMap(Map<String, String> values) {
    List<String> missing = new ArrayList<>();
    for (String key : REQUIRED_KEYS) {
      String value = values.get(key);
      if (value == null || value.isBlank()) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException("Missing required settings: " + String.join(", ", missing));
    }

    int port = parseInt(values, PORT);
    if (port < 1 || port > 65535) {
      throw new ConfigurationException("Setting 'port' must be between 1 and 65535: " + port);
    }
    int retryCount = parseInt(values, RETRY_COUNT);
    if (retryCount < 0) {
      throw new ConfigurationException("Setting 'retry_count' must not be negative: " + retryCount);
    }

    SettingsBuilder builder =
        Settings.builder()
            .host(values.get(HOST).trim())
            .port(port)
            .vhost(values.get(VHOST).trim())
            .user(values.get(USER))
            .password(values.get(PASSWORD))
            .exchange(values.get(EXCHANGE).trim())
            .queueConsume(values.get(QUEUE_CONSUME).trim())
            .queueRetry(values.get(QUEUE_RETRY).trim())
            .queueDeadLetter(values.get(QUEUE_DEAD_LETTER).trim())
            .retryCount(retryCount);

    String confirmTimeout = values.get(CONFIRM_TIMEOUT_MS);
    if (confirmTimeout != null && !confirmTimeout.isBlank()) {
      int millis = parseInt(values, CONFIRM_TIMEOUT_MS);
      if (millis <= 0) {
        throw new ConfigurationException(
            "Setting 'confirm_timeout_ms' must be positive: " + millis);
      }
      builder.confirmTimeout(Duration.ofMillis(millis));
    }
    String connectionName = values.get(CONNECTION_NAME);
    if (connectionName != null && !connectionName.isBlank()) {
      builder.connectionName(connectionName.trim());
    }
    return builder.build();
  }

  private static int parseInt(Map<String, String> values, String key) {
    String raw = values.get(key).trim();
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Setting '" + key + "' must be an integer but was '" + raw + "'", e);
    }
  }
}
