package cafe.woden.ircingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ingest configuration: which server/channel to watch, how to talk to it and where to persist.
 *
 * <p>Example YAML:
 * <pre>
 * ingest:
 *   server:
 *     host: irc.chat.twitch.tv
 *     port: 6667
 *     nick: mynick
 *     token: oauth:xxxxxxxx
 *     channel: "#ninja"
 *   log:
 *     file: chat.log
 * </pre>
 */
@ConfigurationProperties(prefix = "ingest")
public record IngestProperties(Server server, Client client, Log log) {

  public record Server(
      String host,
      int port,
      boolean tls,
      String nick,
      /** Credential sent as {@code PASS}. For Twitch this is {@code oauth:<token>}. */
      String token,
      String channel
  ) {
    public Server {
      if (host == null || host.isBlank()) host = "irc.chat.twitch.tv";
      if (port <= 0 || port > 65535) port = tls ? 6697 : 6667;
      if (nick == null) nick = "";
      if (token == null) token = "";
      if (channel == null) channel = "";
    }
  }

  /** Transport tuning shared by every session. */
  public record Client(
      int readBufferBytes,
      long connectTimeoutMs,
      /**
       * Socket read timeout. Reads wake up at least this often so the receive loop can notice a
       * close request or an idle connection.
       */
      long readTimeoutMs,
      Reconnect reconnect,
      Heartbeat heartbeat
  ) {
    public Client {
      if (readBufferBytes <= 0) readBufferBytes = 2048;
      if (connectTimeoutMs <= 0) connectTimeoutMs = 20_000;
      if (readTimeoutMs <= 0) readTimeoutMs = 1_000;
      if (reconnect == null) reconnect = new Reconnect(true, 1_000, 120_000, 2.0, 0.20, 0);
      if (heartbeat == null) heartbeat = new Heartbeat(true, 360_000);
    }
  }

  public record Reconnect(
      boolean enabled,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct,
      int maxAttempts
  ) {
    public Reconnect {
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 120_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
      // maxAttempts == 0 means "infinite".
      if (maxAttempts < 0) maxAttempts = 0;
    }
  }

  /**
   * Idle detection. Twitch sends {@code PING} roughly every five minutes, so no inbound bytes for
   * {@code timeoutMs} means the connection silently died.
   */
  public record Heartbeat(boolean enabled, long timeoutMs) {
    public Heartbeat {
      if (timeoutMs <= 0) timeoutMs = 360_000;
    }
  }

  public record Log(
      String file,
      /** If true (default), emoji are rewritten to bracketed names before they are persisted. */
      Boolean substitutePictographs
  ) {
    public Log {
      if (file == null || file.isBlank()) file = "chat.log";
      if (substitutePictographs == null) substitutePictographs = Boolean.TRUE;
    }
  }

  public IngestProperties {
    if (server == null) server = new Server(null, 0, false, null, null, null);
    if (client == null) client = new Client(0, 0, 0, null, null);
    if (log == null) log = new Log(null, null);
  }
}
