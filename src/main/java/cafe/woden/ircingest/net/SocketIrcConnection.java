package cafe.woden.ircingest.net;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** {@link IrcConnection} over a plain or TLS {@link Socket}. */
final class SocketIrcConnection implements IrcConnection {

  private final Socket socket;
  private final InputStream in;
  private final OutputStream out;
  private final String remote;

  SocketIrcConnection(Socket socket) throws IOException {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.in = socket.getInputStream();
    this.out = socket.getOutputStream();
    this.remote = String.valueOf(socket.getRemoteSocketAddress());
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    return in.read(buffer);
  }

  @Override
  public void writeLine(String line) throws IOException {
    byte[] bytes = (Objects.toString(line, "") + "\n").getBytes(StandardCharsets.UTF_8);
    synchronized (out) {
      out.write(bytes);
      out.flush();
    }
  }

  @Override
  public boolean isOpen() {
    return !socket.isClosed();
  }

  @Override
  public String remote() {
    return remote;
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
