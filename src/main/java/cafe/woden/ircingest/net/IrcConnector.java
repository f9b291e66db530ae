package cafe.woden.ircingest.net;

import java.io.IOException;

/** Opens {@link IrcConnection}s. */
@FunctionalInterface
public interface IrcConnector {
  IrcConnection open(String host, int port) throws IOException;
}
