package cafe.woden.ircingest.irc;

/**
 * The connection failed while the receive loop was running: an I/O error, end of stream, or no
 * inbound traffic for longer than the idle timeout.
 */
public class TransportReadException extends IrcIngestException {

  public TransportReadException(String message) {
    super(message);
  }

  public TransportReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
