package com.trakbridge.queue;

import static org.assertj.core.api.Assertions.assertThat;

import com.trakbridge.queue.event.Event;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ReplacementQueueConcurrencyTest {
  private static final Instant BASE = Instant.parse("2025-06-01T12:00:00Z");
  private static final int THREADS = 8;
  private static final int ADMISSIONS_PER_THREAD = 1_250;
  private static final int DEVICES_PER_THREAD = 100;

  @Test
  void concurrentProducersWithDisjointDevicesLoseNoUpdates() throws Exception {
    ReplacementQueue queue = new ReplacementQueue(
        "tak-1", QueueSettings.withMaxDevices(THREADS * DEVICES_PER_THREAD));
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<AdmissionReport>> futures = new ArrayList<>();

    for (int t = 0; t < THREADS; t++) {
      int producer = t;
      futures.add(pool.submit(() -> {
        start.await();
        AdmissionReport total = AdmissionReport.empty();
        for (int i = 0; i < ADMISSIONS_PER_THREAD; i++) {
          String device = "p" + producer + "-dev-" + (i % DEVICES_PER_THREAD);
          total = total.merge(queue.admit(event(device, i)));
        }
        return total;
      }));
    }
    start.countDown();

    AdmissionReport combined = AdmissionReport.empty();
    for (Future<AdmissionReport> future : futures) {
      combined = combined.merge(future.get(30, TimeUnit.SECONDS));
    }
    pool.shutdown();

    Set<String> expected = new HashSet<>();
    for (int t = 0; t < THREADS; t++) {
      for (int d = 0; d < DEVICES_PER_THREAD; d++) {
        expected.add("p" + t + "-dev-" + d);
      }
    }
    List<Event> queued = queue.snapshot();
    assertThat(queued).hasSize(expected.size());
    assertThat(queued).extracting(Event::deviceId).containsExactlyInAnyOrderElementsOf(expected);
    assertThat(combined.accepted()).isEqualTo(expected.size());
    assertThat(combined.replaced()).isEqualTo(THREADS * ADMISSIONS_PER_THREAD - expected.size());
    assertThat(combined.droppedCapacity()).isZero();
  }

  @Test
  void concurrentProducersAndConsumerNeverSeeDuplicateDevicesInOneDrain() throws Exception {
    ReplacementQueue queue = new ReplacementQueue("tak-1", QueueSettings.withMaxDevices(1_000));
    ExecutorService pool = Executors.newFixedThreadPool(THREADS + 1);
    AtomicBoolean producing = new AtomicBoolean(true);
    AtomicLong drainedCount = new AtomicLong();
    Set<String> duplicateBatches = ConcurrentHashMap.newKeySet();

    Future<?> consumer = pool.submit(() -> {
      while (producing.get() || queue.size() > 0) {
        List<Event> batch = queue.pollBatch(50, Duration.ofMillis(20));
        Set<String> seen = new HashSet<>();
        for (Event event : batch) {
          if (!seen.add(event.deviceId())) {
            duplicateBatches.add(event.deviceId());
          }
        }
        drainedCount.addAndGet(batch.size());
      }
      return null;
    });

    List<Future<?>> producers = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      producers.add(pool.submit(() -> {
        for (int i = 0; i < ADMISSIONS_PER_THREAD; i++) {
          queue.admit(event("shared-" + (i % 50), i));
        }
      }));
    }
    for (Future<?> producer : producers) {
      producer.get(30, TimeUnit.SECONDS);
    }
    producing.set(false);
    consumer.get(30, TimeUnit.SECONDS);
    pool.shutdown();

    QueueStats stats = queue.stats();
    assertThat(duplicateBatches).isEmpty();
    assertThat(queue.size()).isZero();
    assertThat(stats.drained()).isEqualTo(drainedCount.get());
    assertThat(stats.accepted() + stats.replaced() + stats.rejectedStale())
        .isEqualTo((long) THREADS * ADMISSIONS_PER_THREAD);
  }

  private static Event event(String deviceId, long secondsOffset) {
    return new Event(
        deviceId,
        BASE.plusSeconds(secondsOffset),
        Instant.now(),
        (deviceId + "@" + secondsOffset).getBytes(StandardCharsets.UTF_8));
  }
}
