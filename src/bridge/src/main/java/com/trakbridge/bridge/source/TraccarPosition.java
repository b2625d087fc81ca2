package com.trakbridge.bridge.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of Traccar's {@code /api/positions} response.
 *
 * <p>Unknown attributes are ignored; Traccar reports speed in knots.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraccarPosition(
    @JsonProperty("id") Long id,
    @JsonProperty("deviceId") Long deviceId,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("altitude") Double altitude,
    @JsonProperty("speed") Double speed,
    @JsonProperty("course") Double course,
    @JsonProperty("fixTime") String fixTime,
    @JsonProperty("deviceTime") String deviceTime) {}
