package com.trakbridge.bridge.dispatch;

import com.trakbridge.queue.event.Event;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/** Delivery channel to one TAK server. */
public interface CotTransport extends Closeable {

  /**
   * Writes the event bodies in order.
   *
   * @param events drained events, oldest first
   * @throws IOException if the batch could not be written completely
   */
  void send(List<Event> events) throws IOException;
}
