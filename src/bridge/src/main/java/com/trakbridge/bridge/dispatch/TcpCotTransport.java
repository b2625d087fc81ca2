package com.trakbridge.bridge.dispatch;

import com.trakbridge.bridge.config.BridgeProperties;
import com.trakbridge.queue.event.Event;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;
import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams CoT XML to a TAK server over TCP, optionally TLS.
 *
 * <p>The socket is opened on first send and dropped after any I/O failure; the next send
 * reconnects. Sends come from the owning dispatcher thread; {@link #close()} may be called from
 * any thread and aborts a write in progress.
 */
public class TcpCotTransport implements CotTransport {
  private static final Logger log = LoggerFactory.getLogger(TcpCotTransport.class);

  private final BridgeProperties.Destination destination;
  private final int connectTimeoutMs;
  private final SocketFactory socketFactory;
  private Socket socket;
  private OutputStream out;

  public TcpCotTransport(BridgeProperties.Destination destination, int connectTimeoutMs) {
    this(
        destination,
        connectTimeoutMs,
        destination.tls() ? SSLSocketFactory.getDefault() : SocketFactory.getDefault());
  }

  public TcpCotTransport(
      BridgeProperties.Destination destination, int connectTimeoutMs, SocketFactory socketFactory) {
    this.destination = destination;
    this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
    this.socketFactory = socketFactory;
  }

  @Override
  public void send(List<Event> events) throws IOException {
    if (events.isEmpty()) {
      return;
    }
    try {
      OutputStream stream = connection();
      for (Event event : events) {
        stream.write(event.body());
      }
      stream.flush();
    } catch (IOException ex) {
      disconnect();
      throw ex;
    }
  }

  private synchronized OutputStream connection() throws IOException {
    if (socket != null && socket.isConnected() && !socket.isClosed()) {
      return out;
    }
    Socket created = socketFactory.createSocket();
    try {
      created.connect(new InetSocketAddress(destination.host(), destination.port()), connectTimeoutMs);
    } catch (IOException ex) {
      created.close();
      throw ex;
    }
    socket = created;
    out = new BufferedOutputStream(created.getOutputStream());
    log.info(
        "Connected to destination {} at {}:{}{}",
        destination.id(),
        destination.host(),
        destination.port(),
        destination.tls() ? " (tls)" : "");
    return out;
  }

  private synchronized void disconnect() {
    Socket current = socket;
    socket = null;
    out = null;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException ex) {
      log.debug("Error closing connection to {}", destination.id(), ex);
    }
  }

  @Override
  public void close() {
    disconnect();
  }
}
