package com.trakbridge.bridge.source;

import com.trakbridge.bridge.config.BridgeProperties;
import com.trakbridge.bridge.cot.CotEventFactory;
import com.trakbridge.bridge.cot.PositionReport;
import com.trakbridge.queue.event.EventTimes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Turns Traccar's current positions into CoT events, one per device.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.sources.traccar", name = "enabled", havingValue = "true")
public class TraccarEventSource implements EventSource {
  private static final Logger log = LoggerFactory.getLogger(TraccarEventSource.class);
  private static final double KNOTS_TO_METERS_PER_SECOND = 0.514444;
  private static final String UID_PREFIX = "traccar-";

  private final TraccarClient client;
  private final CotEventFactory cotEventFactory;
  private final Clock clock;

  public TraccarEventSource(TraccarClient client, BridgeProperties properties, Clock clock) {
    this.client = client;
    BridgeProperties.Traccar traccar = properties.sources().traccar();
    this.cotEventFactory = new CotEventFactory(traccar.cotType(), traccar.staleSeconds());
    this.clock = clock;
  }

  @Override
  public String name() {
    return "traccar";
  }

  @Override
  public List<byte[]> poll() {
    List<TraccarPosition> positions = client.fetchPositions();
    if (positions.isEmpty()) {
      return List.of();
    }
    Map<Long, String> names = client.fetchDeviceNames();

    List<byte[]> events = new ArrayList<>(positions.size());
    for (TraccarPosition position : positions) {
      if (position.deviceId() == null || position.latitude() == null || position.longitude() == null) {
        log.debug("Skipping incomplete Traccar position {}", position.id());
        continue;
      }
      events.add(cotEventFactory.toCot(toReport(position, names)));
    }
    return events;
  }

  private PositionReport toReport(TraccarPosition position, Map<Long, String> names) {
    String callsign = names.getOrDefault(position.deviceId(), "Device " + position.deviceId());
    String rawTime = position.deviceTime() != null ? position.deviceTime() : position.fixTime();
    Instant time = EventTimes.parse(rawTime).orElseGet(clock::instant);
    Double speed = position.speed() == null ? null : position.speed() * KNOTS_TO_METERS_PER_SECOND;
    return new PositionReport(
        UID_PREFIX + position.deviceId(),
        callsign,
        position.latitude(),
        position.longitude(),
        position.altitude(),
        speed,
        position.course(),
        time,
        "Traccar device " + callsign);
  }
}
