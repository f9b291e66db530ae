package cafe.woden.ircingest.irc;

/** The server could not be reached, or the credential/join lines could not be sent. */
public class IrcConnectionException extends IrcIngestException {

  public IrcConnectionException(String message) {
    super(message);
  }

  public IrcConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
