package com.trakbridge.queue.event;

import java.util.Optional;

/**
 * Outcome of parsing one raw payload: either an {@link Event} or the reason it was rejected.
 */
public final class ParseResult {
  private final Event event;
  private final String reason;

  private ParseResult(Event event, String reason) {
    this.event = event;
    this.reason = reason;
  }

  public static ParseResult parsed(Event event) {
    if (event == null) {
      throw new IllegalArgumentException("event must not be null");
    }
    return new ParseResult(event, null);
  }

  public static ParseResult malformed(String reason) {
    return new ParseResult(null, reason == null ? "malformed" : reason);
  }

  public boolean isMalformed() {
    return event == null;
  }

  public Optional<Event> event() {
    return Optional.ofNullable(event);
  }

  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    return isMalformed() ? "ParseResult[malformed: " + reason + "]" : "ParseResult[" + event + "]";
  }
}
