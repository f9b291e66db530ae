package cafe.woden.ircingest.irc;

/** Base type for failures that end an ingest session. */
public class IrcIngestException extends RuntimeException {

  public IrcIngestException(String message) {
    super(message);
  }

  public IrcIngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
