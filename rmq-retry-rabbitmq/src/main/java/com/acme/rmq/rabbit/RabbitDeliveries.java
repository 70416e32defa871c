package com.acme.rmq.rabbit;

import com.acme.rmq.domain.DeliveryEnvelope;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import java.util.Map;

/** Helper class to map AMQP deliveries to {@link DeliveryEnvelope}. */
public final class RabbitDeliveries {

  private RabbitDeliveries() {}

  /**
   * Body and headers are passed through untouched, including AMQP long-string values, so that a
   * republished message carries exactly the headers it arrived with.
   */
  public static DeliveryEnvelope toEnvelope(Delivery delivery) {
    AMQP.BasicProperties properties = delivery.getProperties();
    Map<String, Object> headers = properties != null ? properties.getHeaders() : null;
    return new DeliveryEnvelope(delivery.getBody(), headers);
  }

  /** Short description for log lines, without the body. */
  public static String describe(Delivery delivery) {
    var envelope = delivery.getEnvelope();
    if (envelope == null) {
      return "delivery";
    }
    return "deliveryTag="
        + envelope.getDeliveryTag()
        + ", exchange="
        + envelope.getExchange()
        + ", routingKey="
        + envelope.getRoutingKey()
        + ", redelivered="
        + envelope.isRedeliver();
  }
}
