package com.acme.rmq.domain;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DeliveryEnvelope")
class DeliveryEnvelopeTest {

  @Test
  @DisplayName("should represent absent headers and body as empty")
  void testNulls() {
    DeliveryEnvelope envelope = new DeliveryEnvelope(null, null);

    assertThat(envelope.body()).isEmpty();
    assertThat(envelope.headers()).isEmpty();
    assertThat(envelope.deathCount()).isZero();
  }

  @Test
  @DisplayName("deathCount - should use the first record only")
  void testFirstRecordCount() {
    DeliveryEnvelope envelope =
        DeliveryEnvelope.of(
            "{}", Map.of("x-death", List.of(Map.of("count", 1L), Map.of("count", 9L))));

    assertThat(envelope.deathCount()).isEqualTo(1L);
    assertThat(envelope.deaths()).hasSize(2);
  }

  @Test
  @DisplayName("deathCount - should be zero for an empty x-death list")
  void testEmptyDeaths() {
    DeliveryEnvelope envelope = DeliveryEnvelope.of("{}", Map.of("x-death", List.of()));

    assertThat(envelope.deathCount()).isZero();
  }

  @Test
  @DisplayName("headers - should be read-only")
  void testHeadersReadOnly() {
    DeliveryEnvelope envelope = DeliveryEnvelope.of("{}", new HashMap<>(Map.of("k", "v")));

    assertThatThrownBy(() -> envelope.headers().put("other", "x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("bodyAsString - should decode UTF-8")
  void testBodyAsString() {
    assertThat(DeliveryEnvelope.of("{\"city\":\"Zürich\"}").bodyAsString())
        .isEqualTo("{\"city\":\"Zürich\"}");
  }

  @Test
  @DisplayName("hasDeaths - should be true only when x-death carries records")
  void testHasDeaths() {
    assertThat(DeliveryEnvelope.of("{}").hasDeaths()).isFalse();
    assertThat(DeliveryEnvelope.of("{}", Map.of("x-death", List.of())).hasDeaths()).isFalse();
    assertThat(
            DeliveryEnvelope.of("{}", Map.of("x-death", List.of(Map.of("count", 0L))))
                .hasDeaths())
        .isTrue();
  }

  @Test
  @DisplayName("should not see later changes to the caller's body array or header map")
  void testDefensiveCopies() {
    byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
    Map<String, Object> headers = new HashMap<>(Map.of("trace-id", "abc"));
    DeliveryEnvelope envelope = new DeliveryEnvelope(body, headers);

    body[0] = 'X';
    headers.put("trace-id", "changed");
    headers.put("extra", 1);

    assertThat(envelope.bodyAsString()).isEqualTo("{\"a\":1}");
    assertThat(envelope.headers()).containsExactly(entry("trace-id", "abc"));
  }

  @Test
  @DisplayName("equals/hashCode - should compare body content, not array identity")
  void testValueEquality() {
    DeliveryEnvelope first = DeliveryEnvelope.of("{}", Map.of("k", "v"));
    DeliveryEnvelope second = DeliveryEnvelope.of("{}", Map.of("k", "v"));

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(first).isNotEqualTo(DeliveryEnvelope.of("{ }", Map.of("k", "v")));
    assertThat(first.toString()).contains("bodyBytes=2").doesNotContain("[B@");
  }
}
