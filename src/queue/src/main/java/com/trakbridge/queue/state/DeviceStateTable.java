package com.trakbridge.queue.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record of the newest event time admitted per device, plus the handle of its queued event.
 *
 * <p>Not thread-safe: every call must happen under the lock of the queue that owns the table.
 *
 * @param <T> type of the queue handle stored per device
 */
public class DeviceStateTable<T> {
  private final Map<String, DeviceState<T>> states = new HashMap<>();

  /**
   * Returns the state recorded for a device.
   *
   * @param deviceId device identity
   * @return recorded state, empty for a device never seen (or swept as stale)
   */
  public Optional<DeviceState<T>> lookup(String deviceId) {
    return Optional.ofNullable(states.get(deviceId));
  }

  /**
   * Overwrites the state of a device unconditionally.
   *
   * @param deviceId device identity
   * @param eventTime event time of the admitted event
   * @param seenAt local receipt time of the admitted event
   * @param token handle of the queued event, {@code null} when not queued
   */
  public void record(String deviceId, Instant eventTime, Instant seenAt, T token) {
    DeviceState<T> state = states.get(deviceId);
    if (state == null) {
      states.put(deviceId, new DeviceState<>(deviceId, eventTime, seenAt, token));
    } else {
      state.update(eventTime, seenAt, token);
    }
  }

  /**
   * Marks a device as no longer queued, keeping its latest event time.
   *
   * @param deviceId device identity
   */
  public void clearToken(String deviceId) {
    DeviceState<T> state = states.get(deviceId);
    if (state != null) {
      state.clearToken();
    }
  }

  /** Marks every device as no longer queued. */
  public void clearAllTokens() {
    states.values().forEach(DeviceState::clearToken);
  }

  /**
   * Removes devices not seen for longer than {@code olderThan}.
   *
   * <p>Devices that still have a queued event are kept so their handle stays valid.
   *
   * @param olderThan staleness window
   * @param now reference time
   * @return ids of the removed devices
   */
  public List<String> evictStale(Duration olderThan, Instant now) {
    Instant cutoff = now.minus(olderThan);
    List<String> evicted = new ArrayList<>();
    Iterator<DeviceState<T>> it = states.values().iterator();
    while (it.hasNext()) {
      DeviceState<T> state = it.next();
      if (!state.isQueued() && state.lastSeen().isBefore(cutoff)) {
        evicted.add(state.deviceId());
        it.remove();
      }
    }
    return evicted;
  }

  public int size() {
    return states.size();
  }

  public void clear() {
    states.clear();
  }
}
