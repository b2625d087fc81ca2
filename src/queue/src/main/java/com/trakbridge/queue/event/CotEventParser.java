package com.trakbridge.queue.event;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Cursor-on-Target XML events.
 *
 * <p>Only the root {@code <event>} element is read: {@code uid} is the device identity and
 * {@code time} the event time. The rest of the document is never inspected, so large
 * {@code <detail>} sections cost nothing.
 */
public class CotEventParser implements EventParser {
  private static final Logger log = LoggerFactory.getLogger(CotEventParser.class);
  private static final String ROOT_ELEMENT = "event";
  private static final String UID_ATTRIBUTE = "uid";
  private static final String TIME_ATTRIBUTE = "time";

  private final XMLInputFactory inputFactory;
  private final Clock clock;

  public CotEventParser() {
    this(Clock.systemUTC());
  }

  public CotEventParser(Clock clock) {
    this.clock = clock;
    this.inputFactory = XMLInputFactory.newFactory();
    inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
  }

  @Override
  public ParseResult parse(byte[] raw) {
    if (raw == null || raw.length == 0) {
      return ParseResult.malformed("empty payload");
    }
    Instant receivedAt = clock.instant();

    String uid;
    String time;
    XMLStreamReader reader = null;
    try {
      reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(raw));
      while (reader.hasNext() && reader.next() != XMLStreamConstants.START_ELEMENT) {
        if (reader.getEventType() == XMLStreamConstants.DTD) {
          return ParseResult.malformed("DTD not allowed");
        }
      }
      if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
        return ParseResult.malformed("no root element");
      }
      if (!ROOT_ELEMENT.equals(reader.getLocalName())) {
        return ParseResult.malformed("root element is <" + reader.getLocalName() + ">, expected <event>");
      }
      uid = reader.getAttributeValue(null, UID_ATTRIBUTE);
      time = reader.getAttributeValue(null, TIME_ATTRIBUTE);
    } catch (XMLStreamException ex) {
      log.debug("Rejecting unparseable CoT payload", ex);
      return ParseResult.malformed("invalid XML: " + ex.getMessage());
    } finally {
      closeQuietly(reader);
    }

    if (uid == null || uid.isBlank()) {
      return ParseResult.malformed("missing uid");
    }
    String deviceId = uid.trim();

    Optional<Instant> eventTime = EventTimes.parse(time);
    if (eventTime.isEmpty()) {
      log.warn("CoT event for {} has unusable time '{}', using receipt time", deviceId, time);
      return ParseResult.parsed(new Event(deviceId, receivedAt, receivedAt, raw, true));
    }
    return ParseResult.parsed(new Event(deviceId, eventTime.get(), receivedAt, raw, false));
  }

  private static void closeQuietly(XMLStreamReader reader) {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (XMLStreamException ex) {
      log.debug("Failed to close XML reader", ex);
    }
  }
}
