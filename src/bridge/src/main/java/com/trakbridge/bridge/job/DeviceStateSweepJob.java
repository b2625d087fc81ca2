package com.trakbridge.bridge.job;

import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.QueueSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically forgets devices that have not reported for a while.
 *
 * <p>Queued devices are never swept.
 */
@Component
public class DeviceStateSweepJob {
  private static final Logger log = LoggerFactory.getLogger(DeviceStateSweepJob.class);

  private final DestinationRegistry registry;
  private final Duration staleAfter;

  public DeviceStateSweepJob(DestinationRegistry registry, QueueSettings queueSettings) {
    this.registry = registry;
    this.staleAfter = queueSettings.staleAfter();
  }

  @Scheduled(fixedDelayString = "${bridge.queue.sweep-interval-ms}")
  public void sweep() {
    try {
      Map<String, List<String>> evicted = registry.evictStale(staleAfter);
      evicted.forEach((destination, devices) ->
          log.info("Swept {} idle devices from {}", devices.size(), destination));
    } catch (Exception ex) {
      log.error("Device state sweep failed", ex);
    }
  }
}
