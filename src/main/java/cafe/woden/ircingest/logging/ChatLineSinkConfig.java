package cafe.woden.ircingest.logging;

import cafe.woden.ircingest.config.IngestProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the file-backed {@link ChatLineSink} unless the context already defines one.
 *
 * <p>Spring infers {@code close()} as the destroy method, so the log file is released on shutdown.
 */
@Configuration
public class ChatLineSinkConfig {

  @Bean
  @ConditionalOnMissingBean(ChatLineSink.class)
  public ChatLineSink chatLineSink(IngestProperties props) {
    FileChatLineSink file = new FileChatLineSink(Path.of(props.log().file()));
    if (Boolean.TRUE.equals(props.log().substitutePictographs())) {
      return new PictographSubstitutingSink(file);
    }
    return file;
  }
}
