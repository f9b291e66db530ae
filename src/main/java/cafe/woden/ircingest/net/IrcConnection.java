package cafe.woden.ircingest.net;

import java.io.Closeable;
import java.io.IOException;

/**
 * A connected, byte-oriented IRC transport.
 *
 * <p>Reads are bounded by the transport's read timeout: a read that sees no data within it throws
 * {@link java.net.SocketTimeoutException} and the connection stays usable. {@link #close()} may be
 * called from any thread and makes a blocked read return or fail promptly.
 */
public interface IrcConnection extends Closeable {

  /**
   * Read whatever bytes are available into {@code buffer}.
   *
   * @return number of bytes read, or {@code -1} at end of stream
   */
  int read(byte[] buffer) throws IOException;

  /** Send {@code line} as UTF-8 followed by {@code \n}, flushed. */
  void writeLine(String line) throws IOException;

  boolean isOpen();

  /** Human-readable peer, for logs. */
  String remote();
}
