package cafe.woden.ircingest.irc;

import cafe.woden.ircingest.net.IrcConnection;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * Test transport that replays a script of reads.
 *
 * <p>When the script runs out the connection reports end of stream, or keeps timing out if
 * {@link #idleWhenDrained()} was requested.
 */
final class ScriptedIrcConnection implements IrcConnection {

  private static final Object TIMEOUT = new Object();

  private final Deque<Object> script = new ArrayDeque<>();
  private final List<String> written = new CopyOnWriteArrayList<>();
  private final CountDownLatch closedLatch = new CountDownLatch(1);
  private volatile boolean closed;
  private volatile boolean idleWhenDrained;
  private volatile IOException writeFailure;

  ScriptedIrcConnection chunk(String text) {
    return bytes(text.getBytes(StandardCharsets.UTF_8));
  }

  synchronized ScriptedIrcConnection bytes(byte[] bytes) {
    script.add(bytes);
    return this;
  }

  synchronized ScriptedIrcConnection timeout() {
    script.add(TIMEOUT);
    return this;
  }

  synchronized ScriptedIrcConnection failure(IOException e) {
    script.add(e);
    return this;
  }

  /** Runs {@code action} when the read reaches this step, then continues with the next step. */
  synchronized ScriptedIrcConnection then(Runnable action) {
    script.add(action);
    return this;
  }

  ScriptedIrcConnection idleWhenDrained() {
    this.idleWhenDrained = true;
    return this;
  }

  ScriptedIrcConnection failWrites(IOException e) {
    this.writeFailure = e;
    return this;
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    while (true) {
      if (closed) throw new SocketException("Socket closed");
      Object step;
      synchronized (this) {
        step = script.poll();
      }
      if (step == null) {
        if (!idleWhenDrained) return -1;
        try {
          Thread.sleep(5);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        throw new SocketTimeoutException("Read timed out");
      }
      if (step instanceof Runnable r) {
        r.run();
        continue;
      }
      if (step == TIMEOUT) throw new SocketTimeoutException("Read timed out");
      if (step instanceof IOException e) throw e;
      byte[] b = (byte[]) step;
      System.arraycopy(b, 0, buffer, 0, b.length);
      return b.length;
    }
  }

  @Override
  public void writeLine(String line) throws IOException {
    if (writeFailure != null) throw writeFailure;
    written.add(line + "\n");
  }

  @Override
  public boolean isOpen() {
    return !closed;
  }

  @Override
  public String remote() {
    return "scripted:6667";
  }

  @Override
  public void close() {
    closed = true;
    closedLatch.countDown();
  }

  List<String> written() {
    return written;
  }

  boolean isClosed() {
    return closed;
  }

  CountDownLatch closedLatch() {
    return closedLatch;
  }
}
