package com.acme.crm.dedupe;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Granularity an instant is truncated to before it becomes part of a dedupe key. */
public enum TimeBucket {
  /** UTC calendar day, e.g. 2024-05-01 */
  DAY(DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC)),

  /** UTC hour, e.g. 2024-05-01T13 */
  HOUR(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC)),

  /** No time component: one key per intent for the life of the conversation */
  NONE(null);

  private final DateTimeFormatter format;

  TimeBucket(DateTimeFormatter format) {
    this.format = format;
  }

  public String label(Instant at) {
    if (format == null) {
      return "-";
    }
    if (at == null) {
      throw new IllegalArgumentException(name() + " bucket requires an instant");
    }
    return format.format(at);
  }
}
