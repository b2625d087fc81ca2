package com.trakbridge.bridge.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration bound from {@code bridge.*} in {@code application.yml} and the environment.
 */
@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(
    Queue queue,
    Dispatch dispatch,
    List<Destination> destinations,
    Sources sources,
    Parser parser) {

  public BridgeProperties {
    destinations = destinations == null ? List.of() : List.copyOf(destinations);
  }

  /** Replacement queue tunables shared by every destination. */
  public record Queue(int maxDevices, int warningThreshold, Duration staleAfter, long sweepIntervalMs) {}

  /** Dispatcher loop and retry tunables. */
  public record Dispatch(
      int batchSize,
      long pollTimeoutMs,
      int maxAttempts,
      long retryBackoffMs,
      int connectTimeoutMs) {}

  /** One TAK server receiving CoT over TCP, optionally wrapped in TLS. */
  public record Destination(String id, String host, int port, boolean tls) {}

  /**
   * Payload format of source batches: {@code cot} (XML) or {@code json}, with the JSON identity
   * and time field names.
   */
  public record Parser(String format, String idField, String timeField) {}

  public record Sources(long pollMs, Redis redis, Traccar traccar) {}

  /** Raw CoT payloads pushed by external plugins into a Redis list. */
  public record Redis(boolean enabled, String key, int maxBatch) {}

  /** Traccar REST server polled for current positions. */
  public record Traccar(
      boolean enabled,
      String baseUrl,
      String username,
      String password,
      String cotType,
      long staleSeconds,
      int timeoutSeconds) {}
}
