package com.trakbridge.queue.event;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Timestamp parsing shared by the event parsers.
 */
public final class EventTimes {
  private static final long EPOCH_MILLIS_THRESHOLD = 10_000_000_000L;

  private EventTimes() {}

  /**
   * Parses an ISO-8601 timestamp or a numeric epoch value.
   *
   * <p>Accepted forms: {@code 2025-01-01T10:00:00Z}, offsets such as {@code +02:00}, zone-less
   * local date-times (read as UTC), epoch seconds and epoch milliseconds.
   *
   * @param raw timestamp text
   * @return parsed instant, empty when absent or unparseable
   */
  public static Optional<Instant> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (isEpochNumber(value)) {
      try {
        return fromEpoch(Long.parseLong(value));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    try {
      return Optional.of(OffsetDateTime.parse(value).toInstant());
    } catch (DateTimeException ignored) {
      // fall through to zone-less form
    }
    try {
      return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  /**
   * Converts epoch seconds or epoch milliseconds into an instant.
   *
   * @param epoch seconds, or milliseconds when larger than ten billion
   * @return instant, empty when the value lies outside the {@link Instant} range
   */
  public static Optional<Instant> fromEpoch(long epoch) {
    try {
      return Optional.of(
          epoch > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch));
    } catch (DateTimeException | ArithmeticException ex) {
      return Optional.empty();
    }
  }

  private static boolean isEpochNumber(String value) {
    int start = value.startsWith("-") ? 1 : 0;
    if (start == value.length()) {
      return false;
    }
    for (int i = start; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
