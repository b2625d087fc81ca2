package com.trakbridge.queue;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call tally of what happened to each submitted event.
 *
 * <p>Every submitted event lands in exactly one of {@code accepted}, {@code replaced},
 * {@code rejectedStale}, {@code rejectedMalformed} or {@code rejectedClosed}. Capacity drops are
 * counted separately: they describe previously queued events evicted to make room, and the ids
 * of those devices are listed in {@code evictedDeviceIds}.
 *
 * @param accepted events queued for a device that had nothing queued
 * @param replaced events that replaced a queued event of the same device
 * @param rejectedStale events older than the newest admitted event of their device
 * @param rejectedMalformed events without a usable device identity
 * @param droppedCapacity queued events evicted because the queue was full
 * @param rejectedClosed events submitted to a torn-down or unknown destination
 * @param evictedDeviceIds devices whose queued event was evicted for capacity
 */
public record AdmissionReport(
    int accepted,
    int replaced,
    int rejectedStale,
    int rejectedMalformed,
    int droppedCapacity,
    int rejectedClosed,
    List<String> evictedDeviceIds) {

  public AdmissionReport {
    evictedDeviceIds = evictedDeviceIds == null ? List.of() : List.copyOf(evictedDeviceIds);
  }

  public static AdmissionReport empty() {
    return new AdmissionReport(0, 0, 0, 0, 0, 0, List.of());
  }

  /** Report for a batch that could not be admitted because the destination is closed. */
  public static AdmissionReport closed(int submitted) {
    return new AdmissionReport(0, 0, 0, 0, 0, submitted, List.of());
  }

  /** Number of submitted events now sitting in the queue. */
  public int admitted() {
    return accepted + replaced;
  }

  /** Number of submitted events covered by this report. */
  public int submitted() {
    return accepted + replaced + rejectedStale + rejectedMalformed + rejectedClosed;
  }

  public AdmissionReport merge(AdmissionReport other) {
    List<String> evicted = new ArrayList<>(evictedDeviceIds);
    evicted.addAll(other.evictedDeviceIds);
    return new AdmissionReport(
        accepted + other.accepted,
        replaced + other.replaced,
        rejectedStale + other.rejectedStale,
        rejectedMalformed + other.rejectedMalformed,
        droppedCapacity + other.droppedCapacity,
        rejectedClosed + other.rejectedClosed,
        evicted);
  }

  /** Mutable counterpart filled while a batch is processed under the queue lock. */
  static final class Tally {
    int accepted;
    int replaced;
    int rejectedStale;
    int rejectedMalformed;
    int droppedCapacity;
    int rejectedClosed;
    final List<String> evictedDeviceIds = new ArrayList<>();

    AdmissionReport toReport() {
      return new AdmissionReport(
          accepted,
          replaced,
          rejectedStale,
          rejectedMalformed,
          droppedCapacity,
          rejectedClosed,
          evictedDeviceIds);
    }
  }
}
