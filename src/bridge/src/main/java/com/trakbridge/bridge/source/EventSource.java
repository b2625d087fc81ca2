package com.trakbridge.bridge.source;

import java.util.List;

/**
 * A tracking data source polled by {@link com.trakbridge.bridge.job.StreamPollJob}.
 *
 * <p>Each poll returns raw CoT payloads in source order. Implementations report transport
 * problems by logging and returning what they have; an exception fails only this source's cycle.
 */
public interface EventSource {

  /** Short, low-cardinality name used in logs and metric tags. */
  String name();

  List<byte[]> poll();
}
