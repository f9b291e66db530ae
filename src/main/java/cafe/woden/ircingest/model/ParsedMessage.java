package cafe.woden.ircingest.model;

import java.time.LocalDateTime;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One chat message recovered from the persisted log.
 *
 * <p>The timestamp is the local wall-clock time at which the chunk carrying the message was
 * received; the log format has no zone.
 */
@ValueObject
public record ParsedMessage(
    LocalDateTime timestamp,
    String channel,
    String username,
    String message
) {
  public ParsedMessage {
    Objects.requireNonNull(timestamp, "timestamp");
    requireNonBlank(channel, "channel");
    requireNonBlank(username, "username");
    requireNonBlank(message, "message");
  }

  private static void requireNonBlank(String v, String name) {
    Objects.requireNonNull(v, name);
    if (v.isBlank()) throw new IllegalArgumentException(name + " is blank");
  }
}
