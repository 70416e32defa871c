package com.acme.rmq.spi;

import com.acme.rmq.core.ConnectivityException;
import com.acme.rmq.core.Jsons;
import java.util.Map;

/**
 * Publish/consume primitives over one open broker channel. An instance owns its channel and must
 * not be shared between dispatchers or threads.
 */
public interface MessageTransport extends AutoCloseable {

  /** Routes straight to the queue named by the routing key. */
  String DEFAULT_EXCHANGE = "";

  /**
   * Publish bytes as-is, without a content type, and wait for the broker to confirm.
   *
   * @param exchange target exchange, {@code null} or empty for the default exchange
   * @param headers message headers, {@code null} for none
   * @throws ConnectivityException if the channel is unusable or the publish is not confirmed
   */
  void publishRaw(String exchange, String routingKey, byte[] body, Map<String, Object> headers);

  /**
   * Serialize {@code message} to JSON with {@link Jsons#toBytes} and publish it as {@code
   * application/json}, waiting for the broker to confirm.
   *
   * @throws ConnectivityException if the channel is unusable or the publish is not confirmed
   */
  void publish(Object message, String exchange, String routingKey, Map<String, Object> headers);

  /**
   * Register {@code handler} for {@code queue} with automatic acknowledgment and block until the
   * consumer stops.
   *
   * @throws ConnectivityException if the channel shuts down or the broker cancels the consumer
   */
  void consume(String queue, DeliveryHandler handler);

  /** Stop a running {@link #consume} call. It returns normally. */
  void stop();

  @Override
  void close();
}
