package cafe.woden.ircingest.parse;

import cafe.woden.ircingest.logging.LogRecordFormat;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazily splits a chat log into records on {@link LogRecordFormat#RECORD_DELIMITER}.
 *
 * <p>Candidates are trimmed; blank ones (runs of extra newlines, a trailing delimiter) are skipped.
 * Single-use: one iteration per reader.
 */
final class LogRecordReader implements Iterator<String>, Closeable {

  private static final int DELIMITER_NEWLINES = LogRecordFormat.RECORD_DELIMITER.length();

  private final BufferedReader in;
  private final StringBuilder buf = new StringBuilder(512);
  private String next;
  private boolean eof;

  LogRecordReader(Reader in) {
    Objects.requireNonNull(in, "in");
    this.in = (in instanceof BufferedReader b) ? b : new BufferedReader(in);
  }

  @Override
  public boolean hasNext() {
    while (next == null && !eof) {
      String candidate = readCandidate();
      if (candidate != null && !candidate.isBlank()) {
        next = candidate.strip();
      }
    }
    return next != null;
  }

  @Override
  public String next() {
    if (!hasNext()) throw new NoSuchElementException();
    String r = next;
    next = null;
    return r;
  }

  /** Reads up to and excluding the next delimiter, or to end of input. Null once input is drained. */
  private String readCandidate() {
    buf.setLength(0);
    int newlines = 0;
    try {
      int c;
      while ((c = in.read()) >= 0) {
        if (c == '\n') {
          newlines++;
          if (newlines == DELIMITER_NEWLINES) {
            buf.setLength(buf.length() - (DELIMITER_NEWLINES - 1));
            return buf.toString();
          }
        } else {
          newlines = 0;
        }
        buf.append((char) c);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read chat log", e);
    }
    eof = true;
    return buf.length() == 0 ? null : buf.toString();
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
