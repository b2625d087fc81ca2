package com.trakbridge.bridge.dispatch;

import com.trakbridge.bridge.config.BridgeProperties;
import com.trakbridge.bridge.metrics.QueueMetrics;
import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.ReplacementQueue;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns one {@link DestinationDispatcher} per configured destination.
 */
@Service
public class DispatchService {
  private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

  private final DestinationRegistry registry;
  private final CotTransportFactory transportFactory;
  private final BridgeProperties properties;
  private final MeterRegistry meterRegistry;
  private final QueueMetrics queueMetrics;
  private final Map<String, DestinationDispatcher> dispatchers = new ConcurrentHashMap<>();

  public DispatchService(
      DestinationRegistry registry,
      CotTransportFactory transportFactory,
      BridgeProperties properties,
      MeterRegistry meterRegistry,
      QueueMetrics queueMetrics) {
    this.registry = registry;
    this.transportFactory = transportFactory;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.queueMetrics = queueMetrics;
  }

  @PostConstruct
  public void start() {
    for (BridgeProperties.Destination destination : properties.destinations()) {
      Optional<ReplacementQueue> queue = registry.queue(destination.id());
      if (queue.isEmpty()) {
        log.warn("No queue registered for destination {}", destination.id());
        continue;
      }
      DestinationDispatcher dispatcher = new DestinationDispatcher(
          queue.get(), transportFactory.open(destination), properties.dispatch(), meterRegistry);
      dispatchers.put(destination.id(), dispatcher);
      dispatcher.start();
    }
    log.info("Started {} dispatchers", dispatchers.size());
  }

  @PreDestroy
  public void stop() {
    dispatchers.values().forEach(DestinationDispatcher::stop);
    dispatchers.clear();
  }

  /**
   * Tears a destination down: its queue is closed, its dispatcher stopped and its meters removed.
   *
   * @param destinationId destination identity
   * @return {@code true} when the destination existed
   */
  public boolean removeDestination(String destinationId) {
    boolean existed = registry.teardown(destinationId);
    DestinationDispatcher dispatcher = dispatchers.remove(destinationId);
    if (dispatcher != null) {
      dispatcher.stop();
    }
    if (existed) {
      int removed = queueMetrics.unbind(destinationId);
      log.debug("Removed {} meters of destination {}", removed, destinationId);
    }
    return existed;
  }

  public List<String> activeDestinations() {
    return dispatchers.keySet().stream().sorted().toList();
  }
}
