package com.trakbridge.queue.event;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One position report as seen by a destination queue.
 *
 * <p>The queue only interprets {@code deviceId} and {@code eventTime}; {@code body} is the raw
 * payload forwarded unchanged to the destination.
 *
 * @param deviceId stable device identity extracted from the payload
 * @param eventTime source-reported timestamp, or the receipt time when it could not be parsed
 * @param enqueueTime local receipt time
 * @param body opaque payload bytes
 * @param timeDegraded {@code true} when {@code eventTime} was substituted by the receipt time
 */
public record Event(
    String deviceId,
    Instant eventTime,
    Instant enqueueTime,
    byte[] body,
    boolean timeDegraded) {

  public Event {
    if (deviceId == null || deviceId.isBlank()) {
      throw new IllegalArgumentException("deviceId must not be blank");
    }
    Objects.requireNonNull(eventTime, "eventTime");
    Objects.requireNonNull(enqueueTime, "enqueueTime");
    body = body == null ? new byte[0] : body.clone();
  }

  public Event(String deviceId, Instant eventTime, Instant enqueueTime, byte[] body) {
    this(deviceId, eventTime, enqueueTime, body, false);
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public int bodyLength() {
    return body.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Event event)) {
      return false;
    }
    return timeDegraded == event.timeDegraded
        && deviceId.equals(event.deviceId)
        && eventTime.equals(event.eventTime)
        && enqueueTime.equals(event.enqueueTime)
        && Arrays.equals(body, event.body);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(deviceId, eventTime, enqueueTime, timeDegraded);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Event[deviceId=" + deviceId
        + ", eventTime=" + eventTime
        + ", enqueueTime=" + enqueueTime
        + ", bodyLength=" + body.length
        + ", timeDegraded=" + timeDegraded + "]";
  }
}
