package cafe.woden.ircingest.logging;

import cafe.woden.ircingest.model.LogRecordRaw;
import com.google.common.base.CharMatcher;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * On-disk layout of the chat log.
 *
 * <pre>
 * &lt;yyyy-MM-dd_HH:mm:ss&gt; — &lt;raw chunk, possibly multi-line&gt;\n\n\n
 * </pre>
 *
 * <p>The writer owns the record delimiter: chunk text never contains three consecutive newlines
 * once formatted, so the reader can split on {@link #RECORD_DELIMITER} without misaligning.
 */
public final class LogRecordFormat {

  /** Em dash. Multi-byte in UTF-8. */
  public static final String SEPARATOR = "—";

  public static final String RECORD_DELIMITER = "\n\n\n";

  public static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("uuuu-MM-dd_HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  private static final CharMatcher LINE_TERMINATORS = CharMatcher.anyOf("\r\n");
  private static final Pattern NEWLINE_RUNS = Pattern.compile("\n{3,}");

  private LogRecordFormat() {}

  /** Full record text including the trailing delimiter. */
  public static String format(LogRecordRaw record) {
    Objects.requireNonNull(record, "record");
    String body = LINE_TERMINATORS.trimTrailingFrom(record.text());
    body = NEWLINE_RUNS.matcher(body).replaceAll("\n\n");
    return TIMESTAMP.format(record.receivedAt()) + " " + SEPARATOR + " " + body + RECORD_DELIMITER;
  }

  /** Strict parse of a timestamp token; empty when it does not match the log format. */
  public static Optional<LocalDateTime> parseTimestamp(String token) {
    if (token == null || token.isEmpty()) return Optional.empty();
    try {
      return Optional.of(LocalDateTime.parse(token, TIMESTAMP));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
