package com.trakbridge.queue;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of one destination queue.
 *
 * @param maxDevices maximum number of distinct devices queued at once
 * @param warningThreshold queue size at which a warning is logged
 * @param staleAfter idle time after which an unqueued device state may be swept
 */
public record QueueSettings(int maxDevices, int warningThreshold, Duration staleAfter) {
  private static final Logger log = LoggerFactory.getLogger(QueueSettings.class);

  public static final int DEFAULT_MAX_DEVICES = 500;
  public static final int DEFAULT_WARNING_THRESHOLD = 400;
  public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(15);

  public static QueueSettings defaults() {
    return new QueueSettings(DEFAULT_MAX_DEVICES, DEFAULT_WARNING_THRESHOLD, DEFAULT_STALE_AFTER);
  }

  public static QueueSettings withMaxDevices(int maxDevices) {
    return new QueueSettings(maxDevices, maxDevices, DEFAULT_STALE_AFTER);
  }

  /**
   * Replaces invalid values with defaults, logging each correction.
   *
   * @return settings safe to build a queue from
   */
  public QueueSettings sanitized() {
    int max = maxDevices;
    if (max <= 0) {
      log.warn("Invalid max devices {}, using default {}", maxDevices, DEFAULT_MAX_DEVICES);
      max = DEFAULT_MAX_DEVICES;
    }
    int threshold = warningThreshold;
    if (threshold <= 0 || threshold > max) {
      int fallback = Math.min(DEFAULT_WARNING_THRESHOLD, max);
      log.warn("Invalid warning threshold {}, using {}", warningThreshold, fallback);
      threshold = fallback;
    }
    Duration stale = staleAfter;
    if (stale == null || stale.isNegative() || stale.isZero()) {
      log.warn("Invalid stale-after {}, using default {}", staleAfter, DEFAULT_STALE_AFTER);
      stale = DEFAULT_STALE_AFTER;
    }
    return new QueueSettings(max, threshold, stale);
  }
}
