package com.acme.rmq.domain;

import java.util.Objects;

/** A message produced by business logic, to be published to the output exchange. */
public record EmissionItem(Object message, String routingKey) {

  public EmissionItem {
    Objects.requireNonNull(routingKey, "routingKey");
  }

  public static EmissionItem of(Object message, String routingKey) {
    return new EmissionItem(message, routingKey);
  }
}
