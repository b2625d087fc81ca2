package com.trakbridge.bridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trakbridge.bridge.dispatch.CotTransportFactory;
import com.trakbridge.bridge.dispatch.TcpCotTransport;
import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.QueueSettings;
import com.trakbridge.queue.event.CotEventParser;
import com.trakbridge.queue.event.EventParser;
import com.trakbridge.queue.event.JsonEventParser;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** CoT XML parser unless {@code bridge.parser.format} selects JSON. */
  @Bean
  public EventParser eventParser(BridgeProperties properties, ObjectMapper objectMapper, Clock clock) {
    BridgeProperties.Parser parser = properties.parser();
    String format = parser == null || parser.format() == null ? "cot" : parser.format().trim();
    if ("json".equalsIgnoreCase(format)) {
      String idField = parser.idField() == null || parser.idField().isBlank() ? "uid" : parser.idField();
      String timeField =
          parser.timeField() == null || parser.timeField().isBlank() ? "time" : parser.timeField();
      log.info("Parsing source payloads as JSON (id field '{}', time field '{}')", idField, timeField);
      return new JsonEventParser(objectMapper, idField, timeField, clock);
    }
    if (!"cot".equalsIgnoreCase(format)) {
      throw new IllegalArgumentException("Unsupported bridge.parser.format: " + format);
    }
    return new CotEventParser(clock);
  }

  @Bean
  public QueueSettings queueSettings(BridgeProperties properties) {
    BridgeProperties.Queue queue = properties.queue();
    if (queue == null) {
      return QueueSettings.defaults();
    }
    return new QueueSettings(queue.maxDevices(), queue.warningThreshold(), queue.staleAfter()).sanitized();
  }

  /** Registry with one queue per configured destination. */
  @Bean
  public DestinationRegistry destinationRegistry(
      EventParser eventParser, QueueSettings queueSettings, BridgeProperties properties, Clock clock) {
    DestinationRegistry registry = new DestinationRegistry(eventParser, queueSettings, clock);
    for (BridgeProperties.Destination destination : properties.destinations()) {
      registry.register(destination.id());
    }
    return registry;
  }

  @Bean
  public CotTransportFactory cotTransportFactory(BridgeProperties properties) {
    int connectTimeoutMs = properties.dispatch() == null ? 5000 : properties.dispatch().connectTimeoutMs();
    return destination -> new TcpCotTransport(destination, connectTimeoutMs);
  }
}
