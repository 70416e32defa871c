package com.acme.rmq.spi;

import com.acme.rmq.domain.EmissionItem;
import java.util.List;
import java.util.Map;

/**
 * User-supplied processing of one message. Returns the messages to emit, possibly none. Any
 * exception marks the delivery as failed and sends it through the retry queue.
 */
@FunctionalInterface
public interface BusinessLogic {
  List<EmissionItem> process(Map<String, Object> messageBody) throws Exception;
}
