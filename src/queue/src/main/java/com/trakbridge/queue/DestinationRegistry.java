package com.trakbridge.queue;

import com.trakbridge.queue.event.Event;
import com.trakbridge.queue.event.EventParser;
import com.trakbridge.queue.event.ParseResult;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one {@link ReplacementQueue} per destination and routes producer and consumer calls.
 *
 * <p>Raw payloads are parsed before any queue lock is taken. Destinations are independent:
 * each queue has its own lock, so admissions for different destinations never contend.
 */
public class DestinationRegistry {
  private static final Logger log = LoggerFactory.getLogger(DestinationRegistry.class);

  private final EventParser parser;
  private final QueueSettings defaultSettings;
  private final Clock clock;
  private final Map<String, ReplacementQueue> queues = new ConcurrentHashMap<>();

  public DestinationRegistry(EventParser parser, QueueSettings defaultSettings) {
    this(parser, defaultSettings, Clock.systemUTC());
  }

  public DestinationRegistry(EventParser parser, QueueSettings defaultSettings, Clock clock) {
    this.parser = parser;
    this.defaultSettings = defaultSettings.sanitized();
    this.clock = clock;
  }

  public ReplacementQueue register(String destinationId) {
    return register(destinationId, defaultSettings);
  }

  /**
   * Registers a destination, or returns its queue when it is already registered.
   *
   * @param destinationId destination identity
   * @param settings queue tunables
   * @return the destination queue
   */
  public ReplacementQueue register(String destinationId, QueueSettings settings) {
    if (destinationId == null || destinationId.isBlank()) {
      throw new IllegalArgumentException("destinationId must not be blank");
    }
    return queues.computeIfAbsent(destinationId, id -> {
      ReplacementQueue queue = new ReplacementQueue(id, settings, clock);
      log.info(
          "Registered destination {} (max devices {}, warning threshold {})",
          id,
          queue.settings().maxDevices(),
          queue.settings().warningThreshold());
      return queue;
    });
  }

  public Optional<ReplacementQueue> queue(String destinationId) {
    return Optional.ofNullable(queues.get(destinationId));
  }

  public List<String> destinationIds() {
    return List.copyOf(queues.keySet());
  }

  /**
   * Parses and admits a batch into one destination.
   *
   * <p>Events refused because the destination is closed or unknown are counted in
   * {@link AdmissionReport#rejectedClosed()}, separately from {@code rejectedMalformed}.
   *
   * @param destinationId destination identity
   * @param batch raw payloads in source order
   * @return tally of the batch; every event is counted as rejected-closed when the destination
   *     is unknown or torn down
   */
  public AdmissionReport admit(String destinationId, List<byte[]> batch) {
    ReplacementQueue queue = queues.get(destinationId);
    if (queue == null) {
      log.warn("Admission of {} events to unknown destination {}", batch.size(), destinationId);
      return AdmissionReport.closed(batch.size());
    }
    return queue.admitParsed(parseAll(batch));
  }

  /**
   * Parses a batch once and admits it into every registered destination.
   *
   * @param batch raw payloads in source order
   * @return tally per destination
   */
  public Map<String, AdmissionReport> admitToAll(List<byte[]> batch) {
    List<ParseResult> parsed = parseAll(batch);
    Map<String, AdmissionReport> reports = new LinkedHashMap<>();
    queues.forEach((id, queue) -> reports.put(id, queue.admitParsed(parsed)));
    return reports;
  }

  public Optional<Event> drain(String destinationId) {
    ReplacementQueue queue = queues.get(destinationId);
    return queue == null ? Optional.empty() : queue.drain();
  }

  public List<Event> drainBatch(String destinationId, int maxEvents) {
    ReplacementQueue queue = queues.get(destinationId);
    return queue == null ? List.of() : queue.drainBatch(maxEvents);
  }

  /**
   * Waits for and drains a batch from one destination.
   *
   * @param destinationId destination identity
   * @param maxEvents upper bound on the returned batch
   * @param timeout maximum time to wait for the first event
   * @return drained events, empty on timeout or for an unknown destination
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public List<Event> pollBatch(String destinationId, int maxEvents, Duration timeout)
      throws InterruptedException {
    ReplacementQueue queue = queues.get(destinationId);
    return queue == null ? List.of() : queue.pollBatch(maxEvents, timeout);
  }

  /**
   * Discards the queued events of one destination.
   *
   * @param destinationId destination identity
   * @return number of discarded events, empty for an unknown destination
   */
  public Optional<Integer> flush(String destinationId) {
    ReplacementQueue queue = queues.get(destinationId);
    return queue == null ? Optional.empty() : Optional.of(queue.flush());
  }

  /**
   * Discards the queued events of every destination, for example after a configuration change.
   *
   * @return total number of discarded events
   */
  public int flushAll() {
    int total = 0;
    for (ReplacementQueue queue : queues.values()) {
      total += queue.flush();
    }
    log.info("Flushed {} events across {} destinations", total, queues.size());
    return total;
  }

  /**
   * Deregisters a destination and closes its queue.
   *
   * <p>The queue is removed from the registry before it is closed; a producer that looked it up
   * just before removal finds it closed and gets its events counted as rejected-closed.
   *
   * @param destinationId destination identity
   * @return {@code true} when the destination existed
   */
  public boolean teardown(String destinationId) {
    ReplacementQueue queue = queues.remove(destinationId);
    if (queue == null) {
      log.warn("Destination {} does not exist for teardown", destinationId);
      return false;
    }
    queue.close();
    log.info("Destination {} torn down", destinationId);
    return true;
  }

  /**
   * Sweeps idle device states on every destination.
   *
   * @param olderThan staleness window
   * @return swept device ids per destination, destinations without evictions omitted
   */
  public Map<String, List<String>> evictStale(Duration olderThan) {
    Map<String, List<String>> evicted = new LinkedHashMap<>();
    queues.forEach((id, queue) -> {
      List<String> devices = queue.evictStale(olderThan);
      if (!devices.isEmpty()) {
        evicted.put(id, devices);
      }
    });
    return evicted;
  }

  public Optional<QueueStats> stats(String destinationId) {
    ReplacementQueue queue = queues.get(destinationId);
    return queue == null ? Optional.empty() : Optional.of(queue.stats());
  }

  public List<QueueStats> allStats() {
    List<QueueStats> stats = new ArrayList<>();
    for (ReplacementQueue queue : queues.values()) {
      stats.add(queue.stats());
    }
    stats.sort((a, b) -> a.destinationId().compareTo(b.destinationId()));
    return stats;
  }

  private List<ParseResult> parseAll(List<byte[]> batch) {
    List<ParseResult> parsed = new ArrayList<>(batch.size());
    for (byte[] raw : batch) {
      ParseResult result = parser.parse(raw);
      if (result.isMalformed()) {
        log.warn("Rejecting malformed event: {}", result.reason());
      }
      parsed.add(result);
    }
    return parsed;
  }
}
