package com.acme.rmq.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One entry of the broker-managed {@code x-death} header: how many times the message was
 * dead-lettered out of {@code queue} for {@code reason}.
 *
 * <p>The header is untrusted input. Anything that is not a list of tables yields no records, and
 * an entry without a usable {@code count} counts as zero.
 */
public record DeathRecord(long count, String queue, String reason, String exchange) {

  public static final String HEADER = "x-death";

  public static DeathRecord zero() {
    return new DeathRecord(0L, null, null, null);
  }

  /** Read the ordered death records from message headers. Never null. */
  public static List<DeathRecord> fromHeaders(Map<String, Object> headers) {
    if (headers == null) {
      return List.of();
    }
    Object raw = headers.get(HEADER);
    if (!(raw instanceof List<?> entries) || entries.isEmpty()) {
      return List.of();
    }
    List<DeathRecord> records = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      records.add(fromEntry(entry));
    }
    return Collections.unmodifiableList(records);
  }

  static DeathRecord fromEntry(Object entry) {
    if (!(entry instanceof Map<?, ?> table)) {
      return zero();
    }
    return new DeathRecord(
        toCount(table.get("count")),
        toText(table.get("queue")),
        toText(table.get("reason")),
        toText(table.get("exchange")));
  }

  private static long toCount(Object value) {
    if (value instanceof Number number) {
      return Math.max(0L, number.longValue());
    }
    if (value != null) {
      // AMQP long strings and JSON-sourced headers both end up here
      try {
        return Math.max(0L, Long.parseLong(value.toString().trim()));
      } catch (NumberFormatException ignored) {
        return 0L;
      }
    }
    return 0L;
  }

  private static String toText(Object value) {
    return value == null ? null : value.toString();
  }
}
