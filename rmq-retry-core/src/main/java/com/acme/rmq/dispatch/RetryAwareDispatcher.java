package com.acme.rmq.dispatch;

import com.acme.rmq.config.Settings;
import com.acme.rmq.domain.DeliveryEnvelope;
import com.acme.rmq.domain.Disposition;
import com.acme.rmq.spi.BusinessLogic;
import com.acme.rmq.spi.DeliveryHandler;
import com.acme.rmq.spi.MessageTransport;

/**
 * Consumer-side entry point: business logic forwarding guarded by retry and dead-letter routing.
 * One dispatcher per transport; deliveries are handled one at a time on the consuming thread.
 */
public class RetryAwareDispatcher implements DeliveryHandler {

  private final Settings settings;
  private final MessageTransport transport;
  private final RetryGuard guard;
  private final ProcessingStep forwarding;
  private final DeliveryHandler handler;

  public RetryAwareDispatcher(
      Settings settings, MessageTransport transport, BusinessLogic businessLogic) {
    this.settings = settings;
    this.transport = transport;
    this.guard = new RetryGuard(settings, transport);
    this.forwarding = new ForwardingStep(settings, transport, businessLogic);
    this.handler = guard.wrap(forwarding);
  }

  @Override
  public void handle(DeliveryEnvelope envelope) {
    handler.handle(envelope);
  }

  /** Same routing as {@link #handle}, reporting which way the delivery went. */
  public Disposition dispatch(DeliveryEnvelope envelope) {
    return guard.dispatch(envelope, forwarding);
  }

  /** Consume {@link Settings#getQueueConsume()} until the transport stops. */
  public void run() {
    transport.consume(settings.getQueueConsume(), this);
  }
}
