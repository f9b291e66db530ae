package cafe.woden.ircingest.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import cafe.woden.ircingest.config.IngestProperties;
import cafe.woden.ircingest.irc.IrcConnectionException;
import cafe.woden.ircingest.irc.IrcIngestService;
import cafe.woden.ircingest.parse.ChatLogParser;
import cafe.woden.ircingest.parse.ParsedMessageExporter;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.springframework.boot.DefaultApplicationArguments;

class IngestCommandRunnerTest {

  private static final String LOG =
      "2018-12-10_11:26:40 — :alice!alice@alice.tmi.twitch.tv PRIVMSG #ninja :hello world\n\n\n"
          + "2018-12-10_11:26:41 — :tmi.twitch.tv NOTICE * :Login unsuccessful\n\n\n";

  @TempDir Path dir;

  private final IrcIngestService ingestService = mock(IrcIngestService.class);
  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

  private IngestCommandRunner runner(String logFile) {
    IngestProperties props = new IngestProperties(
        null, null, new IngestProperties.Log(logFile, true));
    return new IngestCommandRunner(
        props,
        ingestService,
        new ChatLogParser(),
        new ParsedMessageExporter(),
        new PrintStream(stdout, true, StandardCharsets.UTF_8));
  }

  private static DefaultApplicationArguments args(String... a) {
    return new DefaultApplicationArguments(a);
  }

  @Test
  void ingestIsTheDefaultCommand() throws Exception {
    when(ingestService.awaitTermination()).thenReturn(Optional.empty());
    IngestCommandRunner r = runner("chat.log");

    r.run(args());

    InOrder order = inOrder(ingestService);
    order.verify(ingestService).start();
    order.verify(ingestService).awaitTermination();
    assertEquals(0, r.getExitCode());
  }

  @Test
  void ingestFailureSetsANonZeroExitCode() throws Exception {
    when(ingestService.awaitTermination())
        .thenReturn(Optional.of(new IrcConnectionException("refused")));
    IngestCommandRunner r = runner("chat.log");

    r.run(args("ingest"));

    assertEquals(IngestCommandRunner.EXIT_FAILURE, r.getExitCode());
  }

  @Test
  void parseWritesJsonLinesToStdout() throws Exception {
    Path log = dir.resolve("chat.log");
    Files.writeString(log, LOG, StandardCharsets.UTF_8);
    IngestCommandRunner r = runner("unused.log");

    r.run(args("parse", log.toString()));

    List<String> lines = stdout.toString(StandardCharsets.UTF_8).lines().toList();
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).contains("\"username\":\"alice\""));
    assertTrue(lines.get(0).contains("\"message\":\"hello world\""));
    assertEquals(0, r.getExitCode());
    verifyNoInteractions(ingestService);
  }

  @Test
  void parseDefaultsToTheConfiguredLogAndHonoursOut() throws Exception {
    Path log = dir.resolve("chat.log");
    Files.writeString(log, LOG, StandardCharsets.UTF_8);
    Path out = dir.resolve("messages.jsonl");
    IngestCommandRunner r = runner(log.toString());

    r.run(args("parse", "--out=" + out));

    assertEquals(1, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    assertEquals("", stdout.toString(StandardCharsets.UTF_8));
    assertEquals(0, r.getExitCode());
  }

  @Test
  void parseOfAMissingLogFails() throws Exception {
    IngestCommandRunner r = runner(dir.resolve("missing.log").toString());

    r.run(args("parse"));

    assertEquals(IngestCommandRunner.EXIT_FAILURE, r.getExitCode());
  }

  @Test
  void unknownCommandIsAUsageError() throws Exception {
    IngestCommandRunner r = runner("chat.log");

    r.run(args("frobnicate"));

    assertEquals(IngestCommandRunner.EXIT_USAGE, r.getExitCode());
    verifyNoInteractions(ingestService);
  }
}
