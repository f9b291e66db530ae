package cafe.woden.ircingest.parse;

import cafe.woden.ircingest.logging.LogRecordFormat;
import cafe.woden.ircingest.model.LogRecordRaw;
import cafe.woden.ircingest.model.ParsedMessage;
import com.google.common.collect.ImmutableList;
import io.reactivex.rxjava3.core.Flowable;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a chat log written by the ingestor back into {@link ParsedMessage}s.
 *
 * <p>Both streams are cold and lazy: each subscription opens the file, reads it record by record,
 * and closes it on completion, error or cancellation. Re-subscribing to an unchanged file yields the
 * same sequence.
 *
 * <p>Malformed input never fails the stream; it surfaces as {@link ParseOutcome.Dropped}. Only an
 * unreadable file does.
 */
@Component
public class ChatLogParser {
  private static final Logger log = LoggerFactory.getLogger(ChatLogParser.class);

  /**
   * Chat messages only, in file order.
   *
   * <p>One message per PRIVMSG line, not per record: a record whose chunk carried several chat
   * lines yields several messages sharing the record's timestamp.
   */
  public Flowable<ParsedMessage> parseLog(Path path) {
    return outcomes(path)
        .doOnNext(o -> {
          if (o instanceof ParseOutcome.Dropped d && log.isDebugEnabled()) {
            log.debug("[ircingest] Dropped {} ({}): {}", d.reason(), d.detail(), abbreviate(d.input()));
          }
        })
        .ofType(ParseOutcome.Parsed.class)
        .map(ParseOutcome.Parsed::message);
  }

  /** Every parse attempt, successes and drops, in file order. */
  public Flowable<ParseOutcome> outcomes(Path path) {
    Objects.requireNonNull(path, "path");
    return Flowable.using(
        () -> new LogRecordReader(
            new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8)),
        reader -> Flowable.<String>fromIterable(() -> reader).concatMapIterable(this::parseRecord),
        LogRecordReader::close);
  }

  /** Parse one delimiter-free record. Always returns at least one outcome. */
  List<ParseOutcome> parseRecord(String record) {
    String r = record == null ? "" : record.strip();
    if (r.isEmpty()) {
      return List.of(new ParseOutcome.Dropped(DropReason.EMPTY_RECORD, "", ""));
    }

    int tokenEnd = indexOfWhitespace(r);
    String token = tokenEnd < 0 ? r : r.substring(0, tokenEnd);
    Optional<LocalDateTime> ts = LogRecordFormat.parseTimestamp(token);
    if (ts.isEmpty()) {
      return List.of(new ParseOutcome.Dropped(DropReason.BAD_TIMESTAMP, "", r));
    }

    String remainder = tokenEnd < 0 ? "" : r.substring(tokenEnd);
    int sep = remainder.indexOf(LogRecordFormat.SEPARATOR);
    if (sep < 0) {
      return List.of(new ParseOutcome.Dropped(DropReason.MISSING_SEPARATOR, "", r));
    }
    // Only the first separator belongs to the log format; later ones are chat text.
    String body = remainder.substring(sep + LogRecordFormat.SEPARATOR.length()).strip();

    return matchLines(new LogRecordRaw(ts.get(), body));
  }

  private List<ParseOutcome> matchLines(LogRecordRaw raw) {
    ImmutableList.Builder<ParseOutcome> out = ImmutableList.builder();
    boolean any = false;
    for (String line : raw.text().lines().toList()) {
      if (line.isBlank()) continue;
      any = true;
      PrivmsgMatcher.Result result = PrivmsgMatcher.match(line);
      if (result instanceof PrivmsgMatcher.Match m) {
        out.add(toOutcome(raw, m, line));
      } else if (result instanceof PrivmsgMatcher.NoMatch nm) {
        out.add(new ParseOutcome.Dropped(DropReason.NOT_PRIVMSG, nm.mismatch().name(), line));
      }
    }
    if (!any) {
      out.add(new ParseOutcome.Dropped(
          DropReason.NOT_PRIVMSG, PrivmsgMatcher.Mismatch.EMPTY_LINE.name(), raw.text()));
    }
    return out.build();
  }

  private static ParseOutcome toOutcome(LogRecordRaw raw, PrivmsgMatcher.Match m, String line) {
    try {
      return new ParseOutcome.Parsed(
          new ParsedMessage(raw.receivedAt(), m.channel(), m.username(), m.message()));
    } catch (IllegalArgumentException e) {
      return new ParseOutcome.Dropped(DropReason.NOT_PRIVMSG, e.getMessage(), line);
    }
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }

  private static String abbreviate(String s) {
    return s.length() <= 120 ? s : s.substring(0, 117) + "...";
  }
}
