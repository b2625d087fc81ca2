package com.trakbridge.bridge.dispatch;

import com.trakbridge.bridge.config.BridgeProperties;
import com.trakbridge.queue.ReplacementQueue;
import com.trakbridge.queue.event.Event;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains one destination queue and writes the batches to its TAK server.
 *
 * <p>Runs on a single daemon thread. A batch that still fails after {@code maxAttempts} tries is
 * dropped; newer positions for the same devices will be queued again by the sources. The loop
 * ends when the queue is closed or the thread is interrupted.
 */
public class DestinationDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(DestinationDispatcher.class);

  private final ReplacementQueue queue;
  private final CotTransport transport;
  private final int batchSize;
  private final Duration pollTimeout;
  private final int maxAttempts;
  private final long retryBackoffMs;
  private final ExecutorService executor;
  private final Counter sentCounter;
  private final Counter droppedCounter;
  private final Counter failedAttemptCounter;
  private volatile boolean running;

  public DestinationDispatcher(
      ReplacementQueue queue,
      CotTransport transport,
      BridgeProperties.Dispatch settings,
      MeterRegistry meterRegistry) {
    this.queue = queue;
    this.transport = transport;
    this.batchSize = Math.max(1, settings.batchSize());
    this.pollTimeout = Duration.ofMillis(Math.max(1L, settings.pollTimeoutMs()));
    this.maxAttempts = Math.max(1, settings.maxAttempts());
    this.retryBackoffMs = Math.max(0L, settings.retryBackoffMs());
    String destinationId = queue.destinationId();
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "dispatcher-" + destinationId);
      thread.setDaemon(true);
      return thread;
    });
    this.sentCounter = meterRegistry.counter(
        "bridge.dispatch.events", "destination", destinationId, "outcome", "sent");
    this.droppedCounter = meterRegistry.counter(
        "bridge.dispatch.events", "destination", destinationId, "outcome", "dropped");
    this.failedAttemptCounter = meterRegistry.counter(
        "bridge.dispatch.attempts.failed", "destination", destinationId);
  }

  public String destinationId() {
    return queue.destinationId();
  }

  public void start() {
    running = true;
    executor.submit(this::runLoop);
  }

  /** Stops the loop, waits briefly for it to finish and closes the transport. */
  public void stop() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Dispatcher {} did not stop within 5s", destinationId());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      closeTransport();
    }
  }

  public boolean isRunning() {
    return running;
  }

  private void runLoop() {
    LOGGER.info("Dispatcher for {} started", destinationId());
    while (!Thread.currentThread().isInterrupted()) {
      try {
        List<Event> batch = queue.pollBatch(batchSize, pollTimeout);
        if (batch.isEmpty()) {
          if (queue.isClosed()) {
            break;
          }
          continue;
        }
        deliver(batch);
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          LOGGER.debug("Dispatcher {} interrupted during shutdown", destinationId());
          break;
        }
        LOGGER.warn("Dispatcher {} loop error", destinationId(), ex);
      }
    }
    running = false;
    closeTransport();
    LOGGER.info("Dispatcher for {} stopped", destinationId());
  }

  void deliver(List<Event> batch) throws InterruptedException {
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        transport.send(batch);
        sentCounter.increment(batch.size());
        LOGGER.debug("Sent {} events to {}", batch.size(), destinationId());
        return;
      } catch (IOException ex) {
        failedAttemptCounter.increment();
        LOGGER.warn(
            "Send to {} failed (attempt {}/{}): {}",
            destinationId(),
            attempt,
            maxAttempts,
            ex.getMessage());
        if (attempt < maxAttempts && retryBackoffMs > 0) {
          Thread.sleep(retryBackoffMs);
        }
      }
    }
    droppedCounter.increment(batch.size());
    LOGGER.error(
        "Dropped {} events for {} after {} failed attempts", batch.size(), destinationId(), maxAttempts);
  }

  private void closeTransport() {
    try {
      transport.close();
    } catch (IOException ex) {
      LOGGER.debug("Error closing transport for {}", destinationId(), ex);
    }
  }

  private static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
