package com.acme.rmq.rabbit;

import com.acme.rmq.config.Settings;
import com.acme.rmq.core.ConnectivityException;
import com.acme.rmq.core.Jsons;
import com.acme.rmq.spi.DeliveryHandler;
import com.acme.rmq.spi.MessageTransport;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ConsumerShutdownSignalCallback;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageTransport} over one RabbitMQ connection and one channel in confirm mode.
 *
 * <p>Every publish waits for the broker confirm. Deliveries are acknowledged automatically on
 * receipt and handed to the handler one at a time by the client's dispatch thread for this
 * channel, so a crash mid-handler loses the message; only the explicit retry republish protects
 * it.
 */
public class RabbitMqTransport implements MessageTransport {
  private static final Logger log = LoggerFactory.getLogger(RabbitMqTransport.class);

  static final String CONTENT_TYPE = "application/json";

  private final Connection connection;
  private final Channel channel;
  private final Duration confirmTimeout;

  private volatile CountDownLatch consuming;
  private volatile String consumerTag;
  private volatile boolean stopRequested;

  /**
   * Use an already open connection and channel. The channel is switched to confirm mode and both
   * are closed by {@link #close()}.
   */
  public RabbitMqTransport(Connection connection, Channel channel, Duration confirmTimeout) {
    this.connection = connection;
    this.channel = channel;
    this.confirmTimeout = confirmTimeout;
    try {
      channel.confirmSelect();
    } catch (IOException | ShutdownSignalException e) {
      throw new ConnectivityException("Failed to enable publisher confirms", e);
    }
  }

  /**
   * Open a connection and a channel as described by {@code settings}.
   *
   * @throws ConnectivityException if the broker cannot be reached or refuses the credentials
   */
  public static RabbitMqTransport open(Settings settings) {
    return open(settings, new ConnectionFactory());
  }

  static RabbitMqTransport open(Settings settings, ConnectionFactory factory) {
    factory.setHost(settings.getHost());
    factory.setPort(settings.getPort());
    factory.setVirtualHost(settings.getVhost());
    factory.setUsername(settings.getUser());
    factory.setPassword(settings.getPassword());
    String target = settings.getHost() + ":" + settings.getPort() + settings.getVhost();

    Connection connection = null;
    try {
      connection = factory.newConnection(settings.getConnectionName());
      Channel channel = connection.createChannel();
      if (channel == null) {
        throw new ConnectivityException("No channel available on connection to " + target);
      }
      RabbitMqTransport transport =
          new RabbitMqTransport(connection, channel, settings.getConfirmTimeout());
      log.info("Connected to RabbitMQ at {} as {}", target, settings.getUser());
      return transport;
    } catch (IOException | TimeoutException e) {
      closeConnection(connection);
      throw new ConnectivityException("Failed to connect to RabbitMQ at " + target, e);
    } catch (RuntimeException e) {
      closeConnection(connection);
      throw e;
    }
  }

  @Override
  public void publish(
      Object message, String exchange, String routingKey, Map<String, Object> headers) {
    send(exchange, routingKey, Jsons.toBytes(message), headers, CONTENT_TYPE);
  }

  /** Pass-through bodies may not be JSON, so no content type is claimed for them. */
  @Override
  public void publishRaw(
      String exchange, String routingKey, byte[] body, Map<String, Object> headers) {
    send(exchange, routingKey, body, headers, null);
  }

  private void send(
      String exchange,
      String routingKey,
      byte[] body,
      Map<String, Object> headers,
      String contentType) {
    String target = exchange == null ? DEFAULT_EXCHANGE : exchange;
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .contentType(contentType)
            .headers(headers == null ? Map.of() : headers)
            .build();
    try {
      channel.basicPublish(target, routingKey, properties, body);
      channel.waitForConfirmsOrDie(confirmTimeout.toMillis());
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      throw new ConnectivityException(
          "Publish to exchange '" + target + "' with routing key '" + routingKey + "' failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectivityException("Interrupted while waiting for publish confirm", e);
    }
  }

  @Override
  public void consume(String queue, DeliveryHandler handler) {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<ConnectivityException> failure = new AtomicReference<>();
    consuming = latch;
    stopRequested = false;

    DeliverCallback onDeliver =
        (tag, delivery) -> {
          log.debug("Received message from {}: {}", queue, RabbitDeliveries.describe(delivery));
          try {
            handler.handle(RabbitDeliveries.toEnvelope(delivery));
          } catch (RuntimeException e) {
            // the client's exception handler closes the channel after this rethrow
            failure.compareAndSet(
                null, new ConnectivityException("Message handler failed on queue " + queue, e));
            latch.countDown();
            throw e;
          }
        };
    CancelCallback onCancel =
        tag -> {
          failure.compareAndSet(
              null, new ConnectivityException("Consumer on queue " + queue + " was cancelled"));
          latch.countDown();
        };
    ConsumerShutdownSignalCallback onShutdown =
        (tag, signal) -> {
          if (!stopRequested) {
            failure.compareAndSet(
                null,
                new ConnectivityException("Channel shut down while consuming " + queue, signal));
          }
          latch.countDown();
        };

    try {
      consumerTag = channel.basicConsume(queue, true, onDeliver, onCancel, onShutdown);
    } catch (IOException | ShutdownSignalException e) {
      consuming = null;
      throw new ConnectivityException("Failed to start consuming from queue " + queue, e);
    }
    log.info("Consuming from queue {}", queue);

    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Interrupted, stopping consumer on queue {}", queue);
      stop();
    }

    ConnectivityException error = failure.get();
    if (error != null) {
      log.error("Stopped consuming from queue {}", queue, error);
      throw error;
    }
    log.info("Stopped consuming from queue {}", queue);
  }

  @Override
  public void stop() {
    stopRequested = true;
    String tag = consumerTag;
    if (tag != null && channel.isOpen()) {
      try {
        channel.basicCancel(tag);
      } catch (IOException | ShutdownSignalException e) {
        log.warn("Failed to cancel consumer {}", tag, e);
      }
    }
    consumerTag = null;
    CountDownLatch latch = consuming;
    if (latch != null) {
      latch.countDown();
    }
  }

  @Override
  public void close() {
    stop();
    if (channel.isOpen()) {
      try {
        channel.close();
      } catch (IOException | TimeoutException | ShutdownSignalException e) {
        log.error("Error closing RabbitMQ channel", e);
      }
    }
    closeConnection(connection);
  }

  private static void closeConnection(Connection connection) {
    if (connection != null && connection.isOpen()) {
      try {
        connection.close();
        log.info("RabbitMQ connection closed");
      } catch (IOException | ShutdownSignalException e) {
        log.error("Error closing RabbitMQ connection", e);
      }
    }
  }
}
