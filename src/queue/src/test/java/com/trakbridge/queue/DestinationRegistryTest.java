package com.trakbridge.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.trakbridge.queue.event.CotEventParser;
import com.trakbridge.queue.event.Event;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DestinationRegistryTest {
  private static final Instant BASE = Instant.parse("2025-06-01T12:00:00Z");

  private final MutableClock clock = new MutableClock(BASE);
  private final DestinationRegistry registry =
      new DestinationRegistry(new CotEventParser(clock), QueueSettings.defaults(), clock);

  @Test
  void admitParsesCotPayloadsAndCollapsesPerDevice() {
    registry.register("tak-1");
    List<byte[]> batch = new ArrayList<>();
    for (int step = 0; step < 6; step++) {
      for (int device = 0; device < 50; device++) {
        batch.add(cot("dev-" + device, BASE.plusSeconds(step)));
      }
    }

    AdmissionReport report = registry.admit("tak-1", batch);

    assertThat(report.accepted()).isEqualTo(50);
    assertThat(report.replaced()).isEqualTo(250);
    assertThat(report.rejectedStale()).isZero();
    assertThat(registry.stats("tak-1")).hasValueSatisfying(stats -> assertThat(stats.size()).isEqualTo(50));
  }

  @Test
  void malformedPayloadsDoNotAffectSiblings() {
    registry.register("tak-1");

    AdmissionReport report = registry.admit("tak-1", List.of(
        "not xml".getBytes(StandardCharsets.UTF_8),
        cot("A", BASE),
        "<event time=\"2025-06-01T12:00:00Z\"/>".getBytes(StandardCharsets.UTF_8)));

    assertThat(report.rejectedMalformed()).isEqualTo(2);
    assertThat(report.accepted()).isEqualTo(1);
    assertThat(registry.drain("tak-1")).map(Event::deviceId).contains("A");
  }

  @Test
  void outOfRangeTimeDoesNotLoseSiblings() {
    registry.register("tak-1");

    AdmissionReport report = registry.admit("tak-1", List.of(
        cot("A", BASE),
        "<event uid=\"B\" time=\"-99999999999999999\"/>".getBytes(StandardCharsets.UTF_8)));

    assertThat(report.accepted()).isEqualTo(2);
    assertThat(report.rejectedMalformed()).isZero();
    List<Event> drained = registry.drainBatch("tak-1", 10);
    assertThat(drained).extracting(Event::deviceId).containsExactly("A", "B");
    assertThat(drained.get(1).eventTime()).isEqualTo(BASE);
    assertThat(drained.get(1).timeDegraded()).isTrue();
  }

  @Test
  void unknownDestinationRejectsAsClosed() {
    AdmissionReport report = registry.admit("missing", List.of(cot("A", BASE)));

    assertThat(report.rejectedClosed()).isEqualTo(1);
    assertThat(report.rejectedMalformed()).isZero();
    assertThat(registry.drain("missing")).isEmpty();
    assertThat(registry.drainBatch("missing", 10)).isEmpty();
    assertThat(registry.stats("missing")).isEmpty();
  }

  @Test
  void teardownClosesQueueAndRejectsLaterAdmissions() {
    ReplacementQueue queue = registry.register("tak-1");
    registry.admit("tak-1", List.of(cot("A", BASE)));

    assertThat(registry.teardown("tak-1")).isTrue();
    AdmissionReport afterTeardown = registry.admit("tak-1", List.of(cot("B", BASE)));
    AdmissionReport racingProducer = queue.admitAll(List.of(
        new Event("C", BASE, BASE, new byte[0])));

    assertThat(queue.isClosed()).isTrue();
    assertThat(afterTeardown.rejectedClosed()).isEqualTo(1);
    assertThat(racingProducer.rejectedClosed()).isEqualTo(1);
    assertThat(registry.destinationIds()).isEmpty();
    assertThat(registry.teardown("tak-1")).isFalse();
  }

  @Test
  void admitToAllFeedsEveryDestinationIndependently() {
    registry.register("tak-1");
    registry.register("tak-2", QueueSettings.withMaxDevices(1));

    Map<String, AdmissionReport> reports =
        registry.admitToAll(List.of(cot("A", BASE), cot("B", BASE)));

    assertThat(reports).containsOnlyKeys("tak-1", "tak-2");
    assertThat(reports.get("tak-1").accepted()).isEqualTo(2);
    assertThat(reports.get("tak-2").accepted()).isEqualTo(2);
    assertThat(reports.get("tak-2").droppedCapacity()).isEqualTo(1);
    assertThat(reports.get("tak-2").evictedDeviceIds()).containsExactly("A");
    assertThat(registry.drainBatch("tak-1", 10)).hasSize(2);
    assertThat(registry.drainBatch("tak-2", 10)).extracting(Event::deviceId).containsExactly("B");
  }

  @Test
  void registerIsIdempotentAndRejectsBlankIds() {
    ReplacementQueue first = registry.register("tak-1");

    assertThat(registry.register("tak-1")).isSameAs(first);
    assertThrows(IllegalArgumentException.class, () -> registry.register(" "));
  }

  @Test
  void flushAllEmptiesEveryQueue() {
    registry.register("tak-1");
    registry.register("tak-2");
    registry.admitToAll(List.of(cot("A", BASE), cot("B", BASE)));

    assertThat(registry.flushAll()).isEqualTo(4);
    assertThat(registry.flush("tak-1")).contains(0);
    assertThat(registry.flush("missing")).isEmpty();
    assertThat(registry.allStats()).allSatisfy(stats -> assertThat(stats.size()).isZero());
  }

  @Test
  void evictStaleReportsSweptDevicesPerDestination() {
    registry.register("tak-1");
    registry.register("tak-2");
    registry.admitToAll(List.of(cot("A", BASE)));
    registry.drain("tak-1");
    clock.advance(Duration.ofHours(1));

    Map<String, List<String>> evicted = registry.evictStale(Duration.ofMinutes(15));

    assertThat(evicted).containsOnlyKeys("tak-1");
    assertThat(evicted.get("tak-1")).containsExactly("A");
  }

  @Test
  void allStatsAreSortedByDestination() {
    registry.register("tak-b");
    registry.register("tak-a");

    assertThat(registry.allStats()).extracting(QueueStats::destinationId).containsExactly("tak-a", "tak-b");
  }

  private static byte[] cot(String uid, Instant time) {
    String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<event version=\"2.0\" uid=\"" + uid + "\" type=\"a-f-G-U-C\" time=\"" + time
        + "\" start=\"" + time + "\" stale=\"" + time.plusSeconds(300) + "\" how=\"m-g\">"
        + "<point lat=\"40.0\" lon=\"-74.0\" hae=\"0.0\" ce=\"1.0\" le=\"1.0\"/>"
        + "<detail><contact callsign=\"" + uid + "\"/></detail></event>";
    return xml.getBytes(StandardCharsets.UTF_8);
  }
}
