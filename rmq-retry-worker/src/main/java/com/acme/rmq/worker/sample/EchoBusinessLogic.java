package com.acme.rmq.worker.sample;

import com.acme.rmq.domain.EmissionItem;
import com.acme.rmq.spi.BusinessLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** Sample logic: re-emits every message unchanged under routing key {@value #ROUTING_KEY}. */
public class EchoBusinessLogic implements BusinessLogic {
    private static final Logger log = LoggerFactory.getLogger(EchoBusinessLogic.class);

    public static final String ROUTING_KEY = "echo";

    @Override
    public List<EmissionItem> process(Map<String, Object> messageBody) {
        log.debug("Echoing message with {} field(s)", messageBody.size());
        return List.of(EmissionItem.of(messageBody, ROUTING_KEY));
    }
}
