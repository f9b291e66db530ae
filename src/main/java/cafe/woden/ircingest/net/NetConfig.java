package cafe.woden.ircingest.net;

import cafe.woden.ircingest.config.IngestProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NetConfig {

  @Bean
  @ConditionalOnMissingBean(IrcConnector.class)
  public IrcConnector ircConnector(IngestProperties props) {
    IngestProperties.Client c = props.client();
    return new SocketIrcConnector(props.server().tls(), c.connectTimeoutMs(), c.readTimeoutMs());
  }
}
