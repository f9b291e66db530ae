package cafe.woden.ircingest.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Spring owns creation and shutdown so nothing outlives the context.
 */
@Configuration
public class ExecutorConfig {
  public static final String INGEST_RECEIVE_EXECUTOR = "ingestReceiveExecutor";

  @Bean(name = INGEST_RECEIVE_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService ingestReceiveExecutor() {
    return Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "ircingest-receive");
      t.setDaemon(true);
      return t;
    });
  }
}
