package cafe.woden.ircingest.parse;

import cafe.woden.ircingest.model.ParsedMessage;
import java.util.Objects;

/** Result of one parse attempt. */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Dropped {

  record Parsed(ParsedMessage message) implements ParseOutcome {
    public Parsed {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * @param detail finer-grained cause for {@link DropReason#NOT_PRIVMSG} (the grammar step that
   *     failed); empty otherwise
   * @param input the record or line that was dropped
   */
  record Dropped(DropReason reason, String detail, String input) implements ParseOutcome {
    public Dropped {
      Objects.requireNonNull(reason, "reason");
      if (detail == null) detail = "";
      if (input == null) input = "";
    }
  }
}
