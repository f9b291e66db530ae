package cafe.woden.ircingest.irc;

import cafe.woden.ircingest.config.IngestProperties;
import cafe.woden.ircingest.logging.ChatLineSink;
import cafe.woden.ircingest.net.IrcConnection;
import cafe.woden.ircingest.net.IrcConnector;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.CharacterCodingException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One ingest session over one connection: authenticate, then receive chunks until the connection
 * dies or {@link #close()} is called.
 *
 * <p>Each received chunk is decoded and either answered (liveness probe) or handed to the
 * {@link ChatLineSink} verbatim. Chunks are not split into protocol lines here; the parser does
 * that later from the log.
 *
 * <p>{@link #receiveLoop(ChatLineSink)} runs on the caller's thread. {@link #close()} is safe from
 * any other thread.
 */
public final class IrcIngestor implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(IrcIngestor.class);

  static final String LIVENESS_PROBE = "PING";
  static final String LIVENESS_RESPONSE = "PONG";
  static final String WELCOME = "001";

  private final IrcConnection connection;
  private final Clock clock;
  private final int readBufferBytes;
  private final IngestProperties.Heartbeat heartbeat;
  private final Utf8ChunkDecoder decoder = new Utf8ChunkDecoder();
  private final AtomicReference<IngestState> state = new AtomicReference<>(IngestState.CONNECTED);

  public IrcIngestor(IrcConnection connection, IngestProperties.Client client, Clock clock) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(client, "client");
    this.readBufferBytes = client.readBufferBytes();
    this.heartbeat = client.heartbeat();
  }

  /**
   * Open a connection and wrap it in a new ingestor.
   *
   * @throws IrcConnectionException if the server cannot be reached
   */
  public static IrcIngestor connect(
      IrcConnector connector, String host, int port, IngestProperties.Client client, Clock clock) {
    Objects.requireNonNull(connector, "connector");
    try {
      IrcConnection conn = connector.open(host, port);
      log.info("[ircingest] Connected to {}:{}", host, port);
      return new IrcIngestor(conn, client, clock);
    } catch (IOException e) {
      throw new IrcConnectionException("Failed to connect to " + host + ":" + port, e);
    }
  }

  /**
   * Send {@code PASS}, {@code NICK} and {@code JOIN}. The server's answer is not awaited; a bad
   * credential shows up later as missing traffic or a server-side disconnect.
   */
  public void authenticate(String token, String nickname, String channel) {
    String pass = requireNonBlank(token, "token");
    String nick = requireNonBlank(nickname, "nickname");
    String chan = normalizeChannel(requireNonBlank(channel, "channel"));

    if (state.get() != IngestState.CONNECTED) {
      throw new IrcConnectionException("Cannot authenticate: ingestor is " + state.get());
    }
    try {
      connection.writeLine("PASS " + pass);
      connection.writeLine("NICK " + nick);
      connection.writeLine("JOIN " + chan);
    } catch (IOException e) {
      throw new IrcConnectionException("Failed to send credentials to " + connection.remote(), e);
    }
    log.info("[ircingest] Authenticated as {} and joined {}", nick, chan);
  }

  /**
   * Receive until closed or failed.
   *
   * <p>Returns normally when {@link #close()} was called (or the thread was interrupted).
   *
   * @throws TransportReadException on I/O failure, end of stream, or idle timeout
   * @throws java.io.UncheckedIOException if the sink cannot persist a chunk
   */
  public void receiveLoop(ChatLineSink sink) {
    Objects.requireNonNull(sink, "sink");
    byte[] buffer = new byte[readBufferBytes];
    long lastInboundMs = clock.millis();
    try {
      while (state.get() == IngestState.CONNECTED) {
        if (Thread.currentThread().isInterrupted()) {
          log.info("[ircingest] Receive thread interrupted; closing {}", connection.remote());
          close();
          break;
        }

        int n;
        try {
          n = connection.read(buffer);
        } catch (SocketTimeoutException timeout) {
          checkIdle(lastInboundMs);
          continue;
        } catch (IOException e) {
          if (state.get() != IngestState.CONNECTED) break;
          throw new TransportReadException("Read from " + connection.remote() + " failed", e);
        }

        if (n < 0) {
          if (state.get() != IngestState.CONNECTED) break;
          throw new TransportReadException("Connection closed by " + connection.remote());
        }
        if (n == 0) continue;

        lastInboundMs = clock.millis();
        handleChunk(buffer, n, sink);
      }
    } finally {
      closeConnection();
      state.set(IngestState.CLOSED);
      log.info("[ircingest] Receive loop for {} ended", connection.remote());
    }
  }

  private void handleChunk(byte[] buffer, int length, ChatLineSink sink) {
    String text;
    try {
      text = decoder.decode(buffer, length);
    } catch (CharacterCodingException e) {
      log.warn("[ircingest] Skipping {}-byte chunk with malformed UTF-8: {}", length, e.toString());
      return;
    }

    if (text.startsWith(LIVENESS_PROBE)) {
      sendLivenessResponse();
      return;
    }
    if (text.isEmpty()) return;

    sink.append(LocalDateTime.now(clock), text);
  }

  private void sendLivenessResponse() {
    try {
      connection.writeLine(LIVENESS_RESPONSE);
      log.debug("[ircingest] Answered PING from {}", connection.remote());
    } catch (IOException e) {
      if (state.get() != IngestState.CONNECTED) return;
      throw new TransportReadException("Failed to answer PING from " + connection.remote(), e);
    }
  }

  private void checkIdle(long lastInboundMs) {
    IngestProperties.Heartbeat hb = heartbeat;
    if (hb == null || !hb.enabled()) return;
    long idleMs = clock.millis() - lastInboundMs;
    if (idleMs > hb.timeoutMs() && state.get() == IngestState.CONNECTED) {
      throw new TransportReadException(
          "Ping timeout (no inbound traffic for " + (idleMs / 1000) + "s)");
    }
  }

  public IngestState state() {
    return state.get();
  }

  /** Request the receive loop to stop. Idempotent. */
  @Override
  public void close() {
    if (state.compareAndSet(IngestState.CONNECTED, IngestState.CLOSING)) {
      log.info("[ircingest] Closing connection to {}", connection.remote());
      closeConnection();
    }
  }

  private void closeConnection() {
    try {
      connection.close();
    } catch (IOException e) {
      log.debug("[ircingest] Error closing {}", connection.remote(), e);
    }
  }

  /** True if any protocol line in {@code chunk} is the {@code 001} registration reply. */
  static boolean containsWelcome(String chunk) {
    if (chunk == null) return false;
    for (String raw : chunk.lines().toList()) {
      String line = raw.strip();
      if (line.startsWith("@")) {
        int sp = line.indexOf(' ');
        line = sp < 0 ? "" : line.substring(sp + 1).stripLeading();
      }
      String[] tokens = line.split(" +", 3);
      int cmd = line.startsWith(":") ? 1 : 0;
      if (tokens.length > cmd && WELCOME.equals(tokens[cmd])) return true;
    }
    return false;
  }

  static String normalizeChannel(String channel) {
    String c = channel.trim();
    return c.startsWith("#") ? c : "#" + c;
  }

  private static String requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
    return value.trim();
  }
}
