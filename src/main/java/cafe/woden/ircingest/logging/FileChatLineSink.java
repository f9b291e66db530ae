package cafe.woden.ircingest.logging;

import cafe.woden.ircingest.model.LogRecordRaw;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only UTF-8 file sink.
 *
 * <p>The file is opened lazily on the first append so a process that only parses never touches
 * it. Every append is flushed before returning.
 */
public final class FileChatLineSink implements ChatLineSink, Closeable {
  private static final Logger log = LoggerFactory.getLogger(FileChatLineSink.class);

  private final Path file;
  private BufferedWriter out;

  public FileChatLineSink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void append(LocalDateTime receivedAt, String text) {
    String record = LogRecordFormat.format(new LogRecordRaw(receivedAt, text));
    try {
      BufferedWriter w = open();
      w.write(record);
      w.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append to chat log " + file, e);
    }
  }

  private BufferedWriter open() throws IOException {
    if (out == null) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      out = Files.newBufferedWriter(
          file,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND,
          StandardOpenOption.WRITE);
      log.info("[ircingest] Appending chat log to {}", file.toAbsolutePath());
    }
    return out;
  }

  @Override
  public synchronized void close() throws IOException {
    if (out != null) {
      try {
        out.close();
      } finally {
        out = null;
      }
    }
  }
}
