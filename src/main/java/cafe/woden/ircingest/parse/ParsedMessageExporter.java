package cafe.woden.ircingest.parse;

import cafe.woden.ircingest.model.ParsedMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.reactivex.rxjava3.core.Flowable;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Writes parsed messages as JSON lines, one object per message:
 *
 * <pre>
 * {"timestamp":"2018-12-10T11:26:40","channel":"ninja","username":"alice","message":"hello world"}
 * </pre>
 */
@Component
public class ParsedMessageExporter {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  /**
   * Drains {@code messages} into {@code out} and flushes it. The writer is not closed.
   *
   * @return number of messages written
   */
  public long writeJsonLines(Flowable<ParsedMessage> messages, Writer out) throws IOException {
    Objects.requireNonNull(messages, "messages");
    Objects.requireNonNull(out, "out");
    long count = 0;
    for (ParsedMessage m : messages.blockingIterable()) {
      out.write(MAPPER.writeValueAsString(m));
      out.write('\n');
      count++;
    }
    out.flush();
    return count;
  }
}
