package com.trakbridge.queue.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses flat JSON position records such as those pushed by custom plugins.
 *
 * <p>The identity and time field names are configurable; time values may be ISO-8601 strings
 * or epoch seconds/milliseconds.
 */
public class JsonEventParser implements EventParser {
  private static final Logger log = LoggerFactory.getLogger(JsonEventParser.class);

  private final ObjectMapper objectMapper;
  private final String idField;
  private final String timeField;
  private final Clock clock;

  public JsonEventParser(ObjectMapper objectMapper) {
    this(objectMapper, "uid", "time", Clock.systemUTC());
  }

  public JsonEventParser(ObjectMapper objectMapper, String idField, String timeField, Clock clock) {
    this.objectMapper = objectMapper;
    this.idField = idField;
    this.timeField = timeField;
    this.clock = clock;
  }

  @Override
  public ParseResult parse(byte[] raw) {
    if (raw == null || raw.length == 0) {
      return ParseResult.malformed("empty payload");
    }
    Instant receivedAt = clock.instant();

    JsonNode root;
    try {
      root = objectMapper.readTree(raw);
    } catch (IOException ex) {
      log.debug("Rejecting unparseable JSON payload", ex);
      return ParseResult.malformed("invalid JSON: " + ex.getMessage());
    }
    if (root == null || !root.isObject()) {
      return ParseResult.malformed("payload is not a JSON object");
    }

    JsonNode idNode = root.path(idField);
    if (!idNode.isValueNode() || idNode.isNull() || idNode.asText().isBlank()) {
      return ParseResult.malformed("missing " + idField);
    }
    String deviceId = idNode.asText().trim();

    Optional<Instant> eventTime = readTime(root.path(timeField));
    if (eventTime.isEmpty()) {
      log.warn("JSON event for {} has unusable {}, using receipt time", deviceId, timeField);
      return ParseResult.parsed(new Event(deviceId, receivedAt, receivedAt, raw, true));
    }
    return ParseResult.parsed(new Event(deviceId, eventTime.get(), receivedAt, raw, false));
  }

  private static Optional<Instant> readTime(JsonNode node) {
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? EventTimes.fromEpoch(node.asLong()) : Optional.empty();
    }
    if (node.isTextual()) {
      return EventTimes.parse(node.asText());
    }
    return Optional.empty();
  }
}
