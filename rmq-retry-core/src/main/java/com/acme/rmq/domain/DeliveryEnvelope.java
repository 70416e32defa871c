package com.acme.rmq.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One delivery as handed over by the transport: the raw body exactly as received and the message
 * headers. Absent headers are represented by an empty map.
 *
 * <p>The body array and the header map are copied on construction, so later changes by the caller
 * do not reach the envelope that gets republished. {@link #body()} returns the envelope's own array
 * and must not be modified.
 */
public record DeliveryEnvelope(byte[] body, Map<String, Object> headers) {

  public DeliveryEnvelope {
    body = body == null ? new byte[0] : body.clone();
    headers =
        headers == null || headers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public static DeliveryEnvelope of(String body) {
    return new DeliveryEnvelope(body.getBytes(StandardCharsets.UTF_8), null);
  }

  public static DeliveryEnvelope of(String body, Map<String, Object> headers) {
    return new DeliveryEnvelope(body.getBytes(StandardCharsets.UTF_8), headers);
  }

  public List<DeathRecord> deaths() {
    return DeathRecord.fromHeaders(headers);
  }

  /** True once the broker has dead-lettered this message at least once. */
  public boolean hasDeaths() {
    return !deaths().isEmpty();
  }

  /** Count of the first death record, zero when the message has never been dead-lettered. */
  public long deathCount() {
    List<DeathRecord> deaths = deaths();
    return deaths.isEmpty() ? 0L : deaths.get(0).count();
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DeliveryEnvelope)) {
      return false;
    }
    DeliveryEnvelope other = (DeliveryEnvelope) o;
    return Arrays.equals(body, other.body) && headers.equals(other.headers);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(body) + headers.hashCode();
  }

  @Override
  public String toString() {
    return "DeliveryEnvelope{bodyBytes=" + body.length + ", headers=" + headers.keySet() + "}";
  }
}
