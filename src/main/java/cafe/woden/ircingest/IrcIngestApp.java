package cafe.woden.ircingest;

import cafe.woden.ircingest.config.IngestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "IRC Ingest",
    sharedModules = {"config", "model"})
@EnableConfigurationProperties(IngestProperties.class)
public class IrcIngestApp {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(IrcIngestApp.class, args)));
  }
}
