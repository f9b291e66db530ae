package cafe.woden.ircingest.irc;

/**
 * Lifecycle of one {@link IrcIngestor}.
 *
 * <p>{@code CONNECTED -> CLOSING -> CLOSED} when closed from outside,
 * {@code CONNECTED -> CLOSED} when the transport fails.
 */
public enum IngestState {
  CONNECTED,
  CLOSING,
  CLOSED
}
