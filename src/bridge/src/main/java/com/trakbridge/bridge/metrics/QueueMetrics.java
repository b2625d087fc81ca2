package com.trakbridge.bridge.metrics;

import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.QueueStats;
import com.trakbridge.queue.ReplacementQueue;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.function.ToLongFunction;
import org.springframework.stereotype.Component;

/**
 * Exposes the counters of every registered queue as Micrometer meters.
 *
 * <p>Meters read {@link ReplacementQueue#stats()} on scrape, so nothing is recorded on the
 * admission path.
 */
@Component
public class QueueMetrics {
  private final MeterRegistry meterRegistry;

  public QueueMetrics(DestinationRegistry registry, MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    for (String destinationId : registry.destinationIds()) {
      registry.queue(destinationId).ifPresent(this::bind);
    }
  }

  void bind(ReplacementQueue queue) {
    String destination = queue.destinationId();
    outcome(queue, "accepted", QueueStats::accepted);
    outcome(queue, "replaced", QueueStats::replaced);
    outcome(queue, "rejected_stale", QueueStats::rejectedStale);
    outcome(queue, "rejected_malformed", QueueStats::rejectedMalformed);
    outcome(queue, "dropped_capacity", QueueStats::droppedCapacity);
    outcome(queue, "rejected_closed", QueueStats::rejectedClosed);
    outcome(queue, "drained", QueueStats::drained);

    Gauge.builder("bridge.queue.devices", queue, q -> q.stats().size())
        .description("Events currently queued (one per device)")
        .tag("destination", destination)
        .register(meterRegistry);
    Gauge.builder("bridge.queue.tracked_devices", queue, q -> q.stats().trackedDevices())
        .description("Devices with retained state")
        .tag("destination", destination)
        .register(meterRegistry);
  }

  /**
   * Removes every meter tagged with the destination, after it has been torn down.
   *
   * @param destinationId destination identity
   * @return number of removed meters
   */
  public int unbind(String destinationId) {
    List<Meter> tagged = meterRegistry.getMeters().stream()
        .filter(meter -> destinationId.equals(meter.getId().getTag("destination")))
        .toList();
    tagged.forEach(meterRegistry::remove);
    return tagged.size();
  }

  private void outcome(ReplacementQueue queue, String outcome, ToLongFunction<QueueStats> value) {
    FunctionCounter.builder("bridge.queue.events", queue, q -> value.applyAsLong(q.stats()))
        .description("Queue admissions and drains (by outcome)")
        .tag("destination", queue.destinationId())
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
