package com.acme.rmq.dispatch;

import com.acme.rmq.config.Settings;
import com.acme.rmq.core.ConnectivityException;
import com.acme.rmq.domain.DeliveryEnvelope;
import com.acme.rmq.domain.Disposition;
import com.acme.rmq.spi.DeliveryHandler;
import com.acme.rmq.spi.MessageTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link ProcessingStep} with retry accounting.
 *
 * <p>Before the step runs, the count of the first {@code x-death} record is compared with {@link
 * Settings#getRetryCount()}. Once the count reaches the limit the raw body is published to the
 * dead-letter queue and the step is skipped. A message without death records is always processed.
 * Otherwise the step runs, and any exception it throws sends the original body and headers to the
 * retry queue. The retry queue expires messages back to the consume queue, which is how the broker
 * increments the death count; no timer is involved here.
 *
 * <p>Publishing to the retry or dead-letter queue is the last resort for a message, so a failure
 * there is not swallowed: it surfaces as {@link ConnectivityException} and ends the consume loop.
 */
public class RetryGuard {
  private static final Logger log = LoggerFactory.getLogger(RetryGuard.class);

  private final Settings settings;
  private final MessageTransport transport;

  public RetryGuard(Settings settings, MessageTransport transport) {
    this.settings = settings;
    this.transport = transport;
  }

  /** Returns a handler that runs {@code step} under this guard. */
  public DeliveryHandler wrap(ProcessingStep step) {
    return envelope -> dispatch(envelope, step);
  }

  public Disposition dispatch(DeliveryEnvelope envelope, ProcessingStep step) {
    long deathCount = envelope.deathCount();
    if (envelope.hasDeaths() && isExhausted(deathCount)) {
      deadLetter(envelope, deathCount);
      return Disposition.DEAD_LETTERED;
    }

    try {
      step.process(envelope);
      return Disposition.FORWARDED;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn(
          "Processing failed, sending message to retry queue {} (death count {}, limit {})",
          settings.getQueueRetry(),
          deathCount,
          settings.getRetryCount(),
          e);
      retry(envelope);
      return Disposition.RETRIED;
    }
  }

  boolean isExhausted(long deathCount) {
    return deathCount >= settings.getRetryCount();
  }

  private void deadLetter(DeliveryEnvelope envelope, long deathCount) {
    log.warn(
        "Retries exhausted (death count {} >= {}), sending message to dead-letter queue {}",
        deathCount,
        settings.getRetryCount(),
        settings.getQueueDeadLetter());
    publishLastResort(settings.getQueueDeadLetter(), envelope, false);
  }

  private void retry(DeliveryEnvelope envelope) {
    publishLastResort(settings.getQueueRetry(), envelope, true);
  }

  private void publishLastResort(String queue, DeliveryEnvelope envelope, boolean withHeaders) {
    try {
      transport.publishRaw(
          MessageTransport.DEFAULT_EXCHANGE,
          queue,
          envelope.body(),
          withHeaders ? envelope.headers() : null);
    } catch (ConnectivityException e) {
      log.error("Failed to publish message to queue {}", queue, e);
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to publish message to queue {}", queue, e);
      throw new ConnectivityException("Failed to publish message to queue " + queue, e);
    }
  }
}
