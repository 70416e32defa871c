package com.acme.rmq.domain;

/** Outcome of one delivery attempt. Exactly one applies per delivery. */
public enum Disposition {
  /** Business logic succeeded and every emission item was published. */
  FORWARDED,
  /** Processing failed; the original message went to the retry queue. */
  RETRIED,
  /** The retry budget is exhausted; the original body went to the dead-letter queue. */
  DEAD_LETTERED
}
