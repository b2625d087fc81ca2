package com.trakbridge.queue.event;

/**
 * Extracts device identity and event time from a raw plugin payload.
 *
 * <p>Implementations must not throw for bad input: a payload without a usable identity is
 * returned as {@link ParseResult#malformed(String)}, while an unusable timestamp falls back to
 * the receipt time and sets {@link Event#timeDegraded()}.
 */
public interface EventParser {

  /**
   * Parses one raw payload.
   *
   * @param raw payload bytes as produced by a source
   * @return parsed event or malformed result, never {@code null}
   */
  ParseResult parse(byte[] raw);
}
