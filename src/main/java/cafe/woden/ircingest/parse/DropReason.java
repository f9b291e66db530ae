package cafe.woden.ircingest.parse;

/** Why a log record (or one protocol line of it) produced no {@code ParsedMessage}. */
public enum DropReason {
  /** Nothing but whitespace between delimiters. */
  EMPTY_RECORD,
  /** The leading token is not a {@code yyyy-MM-dd_HH:mm:ss} timestamp. */
  BAD_TIMESTAMP,
  /** No em-dash separator after the timestamp. */
  MISSING_SEPARATOR,
  /** The line is not a channel PRIVMSG from a tmi host (notices, joins, numerics, ...). */
  NOT_PRIVMSG
}
