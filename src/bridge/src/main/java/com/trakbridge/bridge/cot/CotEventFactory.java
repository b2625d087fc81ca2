package com.trakbridge.bridge.cot;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Encodes {@link PositionReport}s as Cursor-on-Target XML events.
 */
public class CotEventFactory {
  private static final String HOW_GPS = "h-g-i-g-o";
  private static final double UNKNOWN_ERROR = 9999999.0;
  private static final DateTimeFormatter COT_TIME = DateTimeFormatter.ISO_INSTANT;

  private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();
  private final String cotType;
  private final long staleSeconds;

  public CotEventFactory(String cotType, long staleSeconds) {
    this.cotType = cotType == null || cotType.isBlank() ? "a-f-G-U-C" : cotType;
    this.staleSeconds = staleSeconds > 0 ? staleSeconds : 300;
  }

  /**
   * Builds one CoT event.
   *
   * @param report normalized position
   * @return UTF-8 encoded XML
   */
  public byte[] toCot(PositionReport report) {
    Instant time = report.time().truncatedTo(ChronoUnit.SECONDS);
    StringWriter out = new StringWriter();
    try {
      XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
      xml.writeStartElement("event");
      xml.writeAttribute("version", "2.0");
      xml.writeAttribute("uid", report.uid());
      xml.writeAttribute("type", cotType);
      xml.writeAttribute("time", COT_TIME.format(time));
      xml.writeAttribute("start", COT_TIME.format(time));
      xml.writeAttribute("stale", COT_TIME.format(time.plusSeconds(staleSeconds)));
      xml.writeAttribute("how", HOW_GPS);

      xml.writeEmptyElement("point");
      xml.writeAttribute("lat", format("%.8f", report.latitude()));
      xml.writeAttribute("lon", format("%.8f", report.longitude()));
      xml.writeAttribute("hae", format("%.2f", report.altitude() == null ? 0.0 : report.altitude()));
      xml.writeAttribute("ce", format("%.2f", UNKNOWN_ERROR));
      xml.writeAttribute("le", format("%.2f", UNKNOWN_ERROR));

      xml.writeStartElement("detail");
      xml.writeEmptyElement("contact");
      xml.writeAttribute("callsign", report.callsign() == null ? report.uid() : report.callsign());
      if (report.speed() != null || report.course() != null) {
        xml.writeEmptyElement("track");
        xml.writeAttribute("speed", format("%.2f", report.speed() == null ? 0.0 : report.speed()));
        xml.writeAttribute("course", format("%.2f", report.course() == null ? 0.0 : report.course()));
      }
      if (report.remarks() != null && !report.remarks().isBlank()) {
        xml.writeStartElement("remarks");
        xml.writeCharacters(report.remarks());
        xml.writeEndElement();
      }
      xml.writeEndElement();

      xml.writeEndElement();
      xml.flush();
      xml.close();
    } catch (XMLStreamException ex) {
      throw new IllegalStateException("Failed to encode CoT event for " + report.uid(), ex);
    }
    return out.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static String format(String pattern, double value) {
    return String.format(Locale.ROOT, pattern, value);
  }
}
