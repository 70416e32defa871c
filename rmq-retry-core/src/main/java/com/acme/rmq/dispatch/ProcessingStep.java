package com.acme.rmq.dispatch;

import com.acme.rmq.domain.DeliveryEnvelope;

/** The part of message handling that may fail and be retried. */
@FunctionalInterface
public interface ProcessingStep {
  void process(DeliveryEnvelope envelope) throws Exception;
}
