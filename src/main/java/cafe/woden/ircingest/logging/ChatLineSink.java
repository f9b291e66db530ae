package cafe.woden.ircingest.logging;

import java.time.LocalDateTime;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Durable destination for received chat chunks.
 *
 * <p>One instance is built at startup and handed to the ingestor; there is a single producer, so
 * implementations need no locking.
 */
@ApplicationLayer
@FunctionalInterface
public interface ChatLineSink {

  /**
   * Persist one received chunk.
   *
   * @param receivedAt local time the chunk arrived
   * @param text decoded chunk, verbatim (may hold several protocol lines)
   */
  void append(LocalDateTime receivedAt, String text);
}
