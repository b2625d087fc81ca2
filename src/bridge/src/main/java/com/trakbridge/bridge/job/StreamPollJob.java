package com.trakbridge.bridge.job;

import com.trakbridge.bridge.source.EventSource;
import com.trakbridge.queue.AdmissionReport;
import com.trakbridge.queue.DestinationRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls every enabled source and admits each batch into all destination queues.
 */
@Component
public class StreamPollJob {
  private static final Logger log = LoggerFactory.getLogger(StreamPollJob.class);

  private final List<EventSource> sources;
  private final DestinationRegistry registry;
  private final MeterRegistry meterRegistry;
  private final Map<String, Counter> eventCounters = new ConcurrentHashMap<>();
  private final Map<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public StreamPollJob(List<EventSource> sources, DestinationRegistry registry, MeterRegistry meterRegistry) {
    this.sources = sources;
    this.registry = registry;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void logSources() {
    log.info(
        "Polling {} sources {} into {} destinations",
        sources.size(),
        sources.stream().map(EventSource::name).toList(),
        registry.destinationIds().size());
  }

  @Scheduled(fixedDelayString = "${bridge.sources.poll-ms}")
  public void poll() {
    for (EventSource source : sources) {
      pollSource(source);
    }
  }

  /**
   * Runs one poll cycle for a single source.
   *
   * @param source source to poll
   * @return reports per destination, empty when the source returned nothing or failed
   */
  Map<String, AdmissionReport> pollSource(EventSource source) {
    try {
      List<byte[]> batch = source.poll();
      if (batch.isEmpty()) {
        return Map.of();
      }
      eventCounter(source.name()).increment(batch.size());
      Map<String, AdmissionReport> reports = registry.admitToAll(batch);
      reports.forEach((destination, report) -> log.info(
          "Source {} -> {}: {} events, accepted={}, replaced={}, stale={}, malformed={}, capacity={}, closed={}",
          source.name(),
          destination,
          report.submitted(),
          report.accepted(),
          report.replaced(),
          report.rejectedStale(),
          report.rejectedMalformed(),
          report.droppedCapacity(),
          report.rejectedClosed()));
      return reports;
    } catch (Exception ex) {
      // A failing source must not stop the scheduler or the other sources.
      errorCounter(source.name()).increment();
      log.error("Poll cycle failed for source {}", source.name(), ex);
      return Map.of();
    }
  }

  private Counter eventCounter(String source) {
    return eventCounters.computeIfAbsent(
        source, s -> meterRegistry.counter("bridge.poll.events", "source", s));
  }

  private Counter errorCounter(String source) {
    return errorCounters.computeIfAbsent(
        source, s -> meterRegistry.counter("bridge.poll.errors", "source", s));
  }
}
