package cafe.woden.ircingest.net;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import javax.net.SocketFactory;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

/**
 * Opens TCP (optionally TLS) connections with an explicit connect timeout and a read timeout that
 * doubles as the receive loop's poll interval.
 */
public final class SocketIrcConnector implements IrcConnector {

  private final SocketFactory factory;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;

  public SocketIrcConnector(boolean tls, long connectTimeoutMs, long readTimeoutMs) {
    this(tls ? SSLSocketFactory.getDefault() : SocketFactory.getDefault(), connectTimeoutMs, readTimeoutMs);
  }

  SocketIrcConnector(SocketFactory factory, long connectTimeoutMs, long readTimeoutMs) {
    this.factory = factory;
    this.connectTimeoutMs = (int) Math.max(0, Math.min(Integer.MAX_VALUE, connectTimeoutMs));
    this.readTimeoutMs = (int) Math.max(0, Math.min(Integer.MAX_VALUE, readTimeoutMs));
  }

  @Override
  public IrcConnection open(String host, int port) throws IOException {
    Socket s = factory.createSocket();
    try {
      s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
      s.setSoTimeout(readTimeoutMs);
      s.setKeepAlive(true);
      if (s instanceof SSLSocket ssl) {
        // Surface certificate problems as a connect failure rather than on the first read.
        ssl.startHandshake();
      }
      return new SocketIrcConnection(s);
    } catch (IOException | RuntimeException e) {
      try {
        s.close();
      } catch (IOException closeErr) {
        e.addSuppressed(closeErr);
      }
      throw e;
    }
  }
}
