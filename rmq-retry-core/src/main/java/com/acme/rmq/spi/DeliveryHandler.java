package com.acme.rmq.spi;

import com.acme.rmq.domain.DeliveryEnvelope;

/** Per-message callback registered with {@link MessageTransport#consume}. */
@FunctionalInterface
public interface DeliveryHandler {
  void handle(DeliveryEnvelope envelope);
}
