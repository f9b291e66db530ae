package cafe.woden.ircingest.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SocketIrcConnectorTest {

  private ServerSocket server;
  private final SocketIrcConnector connector = new SocketIrcConnector(false, 2_000, 200);

  @BeforeEach
  void setUp() throws IOException {
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    server.setSoTimeout(5_000);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.close();
  }

  @Test
  void writeLineSendsUtf8TerminatedByNewline() throws Exception {
    try (IrcConnection conn = connector.open("127.0.0.1", server.getLocalPort());
        Socket peer = server.accept()) {
      conn.writeLine("PRIVMSG #c :a — b");

      BufferedReader r = new BufferedReader(
          new InputStreamReader(peer.getInputStream(), StandardCharsets.UTF_8));
      assertEquals("PRIVMSG #c :a — b", r.readLine());
      assertTrue(conn.isOpen());
      assertTrue(conn.remote().contains(String.valueOf(server.getLocalPort())));
    }
  }

  @Test
  void readReturnsWhatThePeerSent() throws Exception {
    try (IrcConnection conn = connector.open("127.0.0.1", server.getLocalPort());
        Socket peer = server.accept()) {
      OutputStream out = peer.getOutputStream();
      out.write("PING :tmi.twitch.tv\r\n".getBytes(StandardCharsets.US_ASCII));
      out.flush();

      byte[] buf = new byte[2048];
      int n = conn.read(buf);

      assertEquals("PING :tmi.twitch.tv\r\n", new String(buf, 0, n, StandardCharsets.US_ASCII));
    }
  }

  @Test
  void silentPeerTimesOutWithoutClosingTheConnection() throws Exception {
    try (IrcConnection conn = connector.open("127.0.0.1", server.getLocalPort());
        Socket peer = server.accept()) {
      assertThrows(SocketTimeoutException.class, () -> conn.read(new byte[16]));
      assertTrue(conn.isOpen());
    }
  }

  @Test
  void peerCloseIsEndOfStream() throws Exception {
    try (IrcConnection conn = connector.open("127.0.0.1", server.getLocalPort())) {
      server.accept().close();

      assertEquals(-1, conn.read(new byte[16]));
    }
  }

  @Test
  void closeMarksTheConnectionClosed() throws Exception {
    IrcConnection conn = connector.open("127.0.0.1", server.getLocalPort());
    server.accept().close();

    conn.close();

    assertFalse(conn.isOpen());
  }

  @Test
  void refusedConnectionThrows() throws Exception {
    int port = server.getLocalPort();
    server.close();

    assertThrows(ConnectException.class, () -> connector.open("127.0.0.1", port));
  }
}
