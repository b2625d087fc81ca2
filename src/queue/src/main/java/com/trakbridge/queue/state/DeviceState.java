package com.trakbridge.queue.state;

import java.time.Instant;

/**
 * Latest admitted state of one device on one destination queue.
 *
 * @param <T> type of the queue handle used to locate the queued event
 */
public final class DeviceState<T> {
  private final String deviceId;
  private Instant latestEventTime;
  private Instant lastSeen;
  private T positionToken;

  DeviceState(String deviceId, Instant latestEventTime, Instant lastSeen, T positionToken) {
    this.deviceId = deviceId;
    this.latestEventTime = latestEventTime;
    this.lastSeen = lastSeen;
    this.positionToken = positionToken;
  }

  public String deviceId() {
    return deviceId;
  }

  public Instant latestEventTime() {
    return latestEventTime;
  }

  public Instant lastSeen() {
    return lastSeen;
  }

  /** Handle of the currently queued event, or {@code null} when nothing is queued. */
  public T positionToken() {
    return positionToken;
  }

  public boolean isQueued() {
    return positionToken != null;
  }

  void update(Instant eventTime, Instant seenAt, T token) {
    this.latestEventTime = eventTime;
    this.lastSeen = seenAt;
    this.positionToken = token;
  }

  void clearToken() {
    this.positionToken = null;
  }

  @Override
  public String toString() {
    return "DeviceState[deviceId=" + deviceId
        + ", latestEventTime=" + latestEventTime
        + ", lastSeen=" + lastSeen
        + ", queued=" + isQueued() + "]";
  }
}
