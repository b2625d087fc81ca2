package com.trakbridge.bridge.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trakbridge.bridge.config.BridgeProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Minimal Traccar REST client for current positions and device names.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.sources.traccar", name = "enabled", havingValue = "true")
public class TraccarClient {
  private static final Logger log = LoggerFactory.getLogger(TraccarClient.class);

  private final BridgeProperties.Traccar properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Counter successCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;

  public TraccarClient(
      BridgeProperties bridgeProperties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.properties = bridgeProperties.sources().traccar();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
  }

  /**
   * Fetches the latest known position of every device visible to the configured user.
   *
   * @return positions, empty when the request failed
   */
  public List<TraccarPosition> fetchPositions() {
    JsonNode body = get("/api/positions");
    if (body == null || !body.isArray()) {
      return List.of();
    }
    return objectMapper.convertValue(body, new TypeReference<List<TraccarPosition>>() {});
  }

  /**
   * Fetches device names keyed by device id.
   *
   * @return names, empty when the request failed
   */
  public Map<Long, String> fetchDeviceNames() {
    JsonNode body = get("/api/devices");
    Map<Long, String> names = new HashMap<>();
    if (body == null || !body.isArray()) {
      return names;
    }
    for (JsonNode device : body) {
      JsonNode id = device.path("id");
      JsonNode name = device.path("name");
      if (id.canConvertToLong() && name.isTextual() && !name.asText().isBlank()) {
        names.put(id.asLong(), name.asText().trim());
      }
    }
    return names;
  }

  private JsonNode get(String path) {
    String baseUrl = properties.baseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("Traccar base URL is missing.");
    }
    String url = baseUrl.replaceAll("/+$", "") + path;
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .timeout(Duration.ofSeconds(Math.max(1, properties.timeoutSeconds())))
          .header("Authorization", basicAuth())
          .header("Accept", "application/json")
          .GET()
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 400) {
        if (response.statusCode() >= 500) {
          serverErrorCounter.increment();
        } else {
          clientErrorCounter.increment();
        }
        log.warn("Traccar request {} failed: status={}", path, response.statusCode());
        return null;
      }
      successCounter.increment();
      return objectMapper.readTree(response.body());
    } catch (InterruptedException ex) {
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.error("Traccar request {} interrupted", path, ex);
      return null;
    } catch (Exception ex) {
      exceptionCounter.increment();
      log.error("Traccar request {} failed", path, ex);
      return null;
    }
  }

  private String basicAuth() {
    String user = properties.username() == null ? "" : properties.username();
    String password = properties.password() == null ? "" : properties.password();
    String token = Base64.getEncoder()
        .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
    return "Basic " + token;
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("bridge.traccar.http.requests.total")
        .description("Traccar REST requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
