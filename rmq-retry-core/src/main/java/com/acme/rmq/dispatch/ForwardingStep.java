package com.acme.rmq.dispatch;

import com.acme.rmq.config.Settings;
import com.acme.rmq.core.Jsons;
import com.acme.rmq.core.TransientException;
import com.acme.rmq.domain.DeliveryEnvelope;
import com.acme.rmq.domain.EmissionItem;
import com.acme.rmq.spi.BusinessLogic;
import com.acme.rmq.spi.MessageTransport;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the body, runs the business logic and publishes every emission item to the output
 * exchange in order. Items already published stay published if a later one fails.
 */
public class ForwardingStep implements ProcessingStep {
  private static final Logger log = LoggerFactory.getLogger(ForwardingStep.class);

  private final Settings settings;
  private final MessageTransport transport;
  private final BusinessLogic businessLogic;

  public ForwardingStep(
      Settings settings, MessageTransport transport, BusinessLogic businessLogic) {
    this.settings = settings;
    this.transport = transport;
    this.businessLogic = businessLogic;
  }

  @Override
  public void process(DeliveryEnvelope envelope) throws Exception {
    Map<String, Object> messageBody = Jsons.toMap(envelope.body());

    List<EmissionItem> items = businessLogic.process(messageBody);
    if (items == null) {
      throw new TransientException("Business logic returned null instead of a list of items");
    }

    int published = 0;
    for (EmissionItem item : items) {
      if (item == null) {
        throw new TransientException(
            "Business logic returned a null emission item at index " + published);
      }
      transport.publish(item.message(), settings.getExchange(), item.routingKey(), null);
      published++;
    }
    log.debug("Forwarded {} message(s) to exchange {}", published, settings.getExchange());
  }
}
