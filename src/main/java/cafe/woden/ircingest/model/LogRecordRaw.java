package cafe.woden.ircingest.model;

import java.time.LocalDateTime;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A single persisted log record: receive time plus the raw chunk exactly as it was appended. */
@ValueObject
public record LogRecordRaw(LocalDateTime receivedAt, String text) {
  public LogRecordRaw {
    Objects.requireNonNull(receivedAt, "receivedAt");
    Objects.requireNonNull(text, "text");
  }
}
