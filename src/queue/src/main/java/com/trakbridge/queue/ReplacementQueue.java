package com.trakbridge.queue;

import com.trakbridge.queue.event.Event;
import com.trakbridge.queue.event.ParseResult;
import com.trakbridge.queue.state.DeviceState;
import com.trakbridge.queue.state.DeviceStateTable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outbound queue of one destination holding at most one event per device.
 *
 * <p>Events drain in the order they reached the tail. Admitting an event for a device that is
 * already queued unlinks the old event in O(1) through the handle kept in the
 * {@link DeviceStateTable} and appends the new one at the tail; an event older than the newest
 * admitted one for its device is rejected as stale.
 *
 * <p>All operations take a single per-queue lock. Batches are admitted under one acquisition so
 * two producers never interleave inside each other's batch.
 */
public class ReplacementQueue {
  private static final Logger log = LoggerFactory.getLogger(ReplacementQueue.class);

  private final String destinationId;
  private final QueueSettings settings;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final DeviceStateTable<Node> states = new DeviceStateTable<>();

  private Node head;
  private Node tail;
  private int size;
  private boolean closed;
  private boolean aboveWarningThreshold;
  private int maxSizeReached;

  private long accepted;
  private long replaced;
  private long rejectedStale;
  private long rejectedMalformed;
  private long droppedCapacity;
  private long rejectedClosed;
  private long drained;
  private long flushed;
  private long staleEvicted;

  public ReplacementQueue(String destinationId, QueueSettings settings) {
    this(destinationId, settings, Clock.systemUTC());
  }

  public ReplacementQueue(String destinationId, QueueSettings settings, Clock clock) {
    this.destinationId = destinationId;
    this.settings = settings.sanitized();
    this.clock = clock;
  }

  public String destinationId() {
    return destinationId;
  }

  public QueueSettings settings() {
    return settings;
  }

  public AdmissionReport admit(Event event) {
    return admitAll(List.of(event));
  }

  /**
   * Admits events in input order as one critical section.
   *
   * @param events parsed events
   * @return tally of the batch
   */
  public AdmissionReport admitAll(List<Event> events) {
    List<ParseResult> results = new ArrayList<>(events.size());
    for (Event event : events) {
      results.add(ParseResult.parsed(event));
    }
    return admitParsed(results);
  }

  /**
   * Admits parser output in input order as one critical section.
   *
   * <p>Malformed entries are counted and skipped; they never affect their siblings.
   * On a closed queue the whole batch is counted as rejected-closed, not as malformed.
   *
   * @param results parser output, one entry per raw payload
   * @return tally of the batch
   */
  public AdmissionReport admitParsed(List<ParseResult> results) {
    AdmissionReport.Tally tally = new AdmissionReport.Tally();
    lock.lock();
    try {
      if (closed) {
        rejectedClosed += results.size();
        log.debug("Queue {} closed, rejecting {} events", destinationId, results.size());
        return AdmissionReport.closed(results.size());
      }
      for (ParseResult result : results) {
        Optional<Event> event = result.event();
        if (event.isEmpty()) {
          tally.rejectedMalformed++;
          rejectedMalformed++;
          continue;
        }
        admitLocked(event.get(), tally);
      }
      afterAdmission(tally);
    } finally {
      lock.unlock();
    }
    return tally.toReport();
  }

  private void admitLocked(Event event, AdmissionReport.Tally tally) {
    String deviceId = event.deviceId();
    Optional<DeviceState<Node>> existing = states.lookup(deviceId);
    if (existing.isPresent()) {
      DeviceState<Node> state = existing.get();
      if (state.latestEventTime().isAfter(event.eventTime())) {
        tally.rejectedStale++;
        rejectedStale++;
        log.debug(
            "Queue {}: dropping stale event for {} ({} < {})",
            destinationId,
            deviceId,
            event.eventTime(),
            state.latestEventTime());
        return;
      }
      if (state.isQueued()) {
        unlink(state.positionToken());
        Node node = append(event);
        states.record(deviceId, event.eventTime(), event.enqueueTime(), node);
        tally.replaced++;
        replaced++;
        return;
      }
    }

    if (size >= settings.maxDevices()) {
      evictHead(tally);
    }
    Node node = append(event);
    states.record(deviceId, event.eventTime(), event.enqueueTime(), node);
    tally.accepted++;
    accepted++;
  }

  private void evictHead(AdmissionReport.Tally tally) {
    Node evicted = head;
    unlink(evicted);
    String deviceId = evicted.event.deviceId();
    states.clearToken(deviceId);
    tally.droppedCapacity++;
    tally.evictedDeviceIds.add(deviceId);
    droppedCapacity++;
  }

  private void afterAdmission(AdmissionReport.Tally tally) {
    if (size > maxSizeReached) {
      maxSizeReached = size;
    }
    if (tally.droppedCapacity > 0) {
      log.warn(
          "Queue {} at capacity ({}): evicted {} oldest events {}",
          destinationId,
          settings.maxDevices(),
          tally.droppedCapacity,
          tally.evictedDeviceIds);
    }
    if (size >= settings.warningThreshold()) {
      if (!aboveWarningThreshold) {
        aboveWarningThreshold = true;
        log.warn(
            "Queue {} size ({}) reached warning threshold ({})",
            destinationId,
            size,
            settings.warningThreshold());
      }
    } else {
      aboveWarningThreshold = false;
    }
    if (tally.accepted + tally.replaced > 0) {
      notEmpty.signalAll();
    }
  }

  /**
   * Removes the oldest queued event.
   *
   * @return head of the drain order, empty when the queue is empty
   */
  public Optional<Event> drain() {
    lock.lock();
    try {
      if (head == null) {
        return Optional.empty();
      }
      return Optional.of(removeHead());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes up to {@code maxEvents} events from the head of the drain order.
   *
   * @param maxEvents upper bound on the returned batch
   * @return drained events, oldest first
   */
  public List<Event> drainBatch(int maxEvents) {
    lock.lock();
    try {
      return drainLocked(maxEvents);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until events are queued, then drains up to {@code maxEvents} of them.
   *
   * @param maxEvents upper bound on the returned batch
   * @param timeout maximum time to wait for the first event
   * @return drained events, empty when the timeout elapsed or the queue was closed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public List<Event> pollBatch(int maxEvents, Duration timeout) throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (size == 0 && !closed) {
        if (nanos <= 0L) {
          return List.of();
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return drainLocked(maxEvents);
    } finally {
      lock.unlock();
    }
  }

  private List<Event> drainLocked(int maxEvents) {
    int count = Math.min(Math.max(0, maxEvents), size);
    if (count == 0) {
      return List.of();
    }
    List<Event> batch = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      batch.add(removeHead());
    }
    return batch;
  }

  private Event removeHead() {
    Node node = head;
    unlink(node);
    states.clearToken(node.event.deviceId());
    drained++;
    return node.event;
  }

  /**
   * Discards every queued event while keeping device times, so re-deliveries of older
   * positions are still rejected as stale.
   *
   * @return number of discarded events
   */
  public int flush() {
    int discarded;
    lock.lock();
    try {
      discarded = size;
      clearList();
      states.clearAllTokens();
      flushed += discarded;
      aboveWarningThreshold = false;
    } finally {
      lock.unlock();
    }
    log.info("Flushed {} events from queue {}", discarded, destinationId);
    return discarded;
  }

  /**
   * Closes the queue: queued events and device state are discarded, later admissions are
   * rejected and waiting consumers are released.
   *
   * @return number of discarded events
   */
  public int close() {
    int discarded;
    lock.lock();
    try {
      if (closed) {
        return 0;
      }
      closed = true;
      discarded = size;
      clearList();
      states.clear();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    log.info("Closed queue {}, discarded {} events", destinationId, discarded);
    return discarded;
  }

  /**
   * Sweeps device states idle for longer than {@code olderThan}.
   *
   * @param olderThan staleness window
   * @return ids of the swept devices
   */
  public List<String> evictStale(Duration olderThan) {
    lock.lock();
    try {
      if (closed) {
        return List.of();
      }
      List<String> evicted = states.evictStale(olderThan, clock.instant());
      staleEvicted += evicted.size();
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  /** Queued events in drain order, without removing them. */
  public List<Event> snapshot() {
    lock.lock();
    try {
      List<Event> events = new ArrayList<>(size);
      for (Node node = head; node != null; node = node.next) {
        events.add(node.event);
      }
      return events;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public QueueStats stats() {
    lock.lock();
    try {
      return new QueueStats(
          destinationId,
          size,
          settings.maxDevices(),
          states.size(),
          maxSizeReached,
          accepted,
          replaced,
          rejectedStale,
          rejectedMalformed,
          droppedCapacity,
          rejectedClosed,
          drained,
          flushed,
          staleEvicted,
          closed);
    } finally {
      lock.unlock();
    }
  }

  private Node append(Event event) {
    Node node = new Node(event);
    if (tail == null) {
      head = node;
    } else {
      tail.next = node;
      node.prev = tail;
    }
    tail = node;
    size++;
    return node;
  }

  private void unlink(Node node) {
    if (node.prev == null) {
      head = node.next;
    } else {
      node.prev.next = node.next;
    }
    if (node.next == null) {
      tail = node.prev;
    } else {
      node.next.prev = node.prev;
    }
    node.prev = null;
    node.next = null;
    size--;
  }

  private void clearList() {
    head = null;
    tail = null;
    size = 0;
  }

  private static final class Node {
    private final Event event;
    private Node prev;
    private Node next;

    private Node(Event event) {
      this.event = event;
    }
  }
}
