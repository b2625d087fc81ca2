package com.trakbridge.bridge.cot;

import java.time.Instant;

/**
 * Normalized position produced by a source before CoT encoding.
 *
 * @param uid CoT uid, stable per device
 * @param callsign display name shown on TAK clients
 * @param latitude WGS84 latitude in degrees
 * @param longitude WGS84 longitude in degrees
 * @param altitude height above ellipsoid in meters, {@code null} when unknown
 * @param speed speed in meters per second, {@code null} when unknown
 * @param course course over ground in degrees, {@code null} when unknown
 * @param time source-reported fix time
 * @param remarks free text placed in the CoT remarks element, may be {@code null}
 */
public record PositionReport(
    String uid,
    String callsign,
    double latitude,
    double longitude,
    Double altitude,
    Double speed,
    Double course,
    Instant time,
    String remarks) {}
