package cafe.woden.ircingest.app;

import cafe.woden.ircingest.config.IngestProperties;
import cafe.woden.ircingest.irc.IrcIngestService;
import cafe.woden.ircingest.model.ParsedMessage;
import cafe.woden.ircingest.parse.ChatLogParser;
import cafe.woden.ircingest.parse.ParsedMessageExporter;
import io.reactivex.rxjava3.core.Flowable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <pre>
 * ingest                          watch the configured channel until stopped (default)
 * parse [&lt;log&gt;] [--out=&lt;file&gt;]   write the log's chat messages as JSON lines
 * </pre>
 */
@Component
public class IngestCommandRunner implements ApplicationRunner, ExitCodeGenerator {
  private static final Logger log = LoggerFactory.getLogger(IngestCommandRunner.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private final IngestProperties props;
  private final IrcIngestService ingestService;
  private final ChatLogParser parser;
  private final ParsedMessageExporter exporter;
  private final PrintStream stdout;

  private volatile int exitCode;

  @Autowired
  public IngestCommandRunner(
      IngestProperties props,
      IrcIngestService ingestService,
      ChatLogParser parser,
      ParsedMessageExporter exporter) {
    this(props, ingestService, parser, exporter, System.out);
  }

  IngestCommandRunner(
      IngestProperties props,
      IrcIngestService ingestService,
      ChatLogParser parser,
      ParsedMessageExporter exporter,
      PrintStream stdout) {
    this.props = Objects.requireNonNull(props, "props");
    this.ingestService = Objects.requireNonNull(ingestService, "ingestService");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.stdout = Objects.requireNonNull(stdout, "stdout");
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    List<String> positional = args.getNonOptionArgs();
    String command = positional.isEmpty() ? "ingest" : positional.get(0).toLowerCase(Locale.ROOT);
    switch (command) {
      case "ingest" -> runIngest();
      case "parse" -> runParse(
          positional.size() > 1 ? Path.of(positional.get(1)) : Path.of(props.log().file()),
          args.getOptionValues("out"));
      default -> {
        log.error("[ircingest] Unknown command '{}' (expected 'ingest' or 'parse')", command);
        exitCode = EXIT_USAGE;
      }
    }
  }

  private void runIngest() throws InterruptedException {
    IngestProperties.Server s = props.server();
    log.info("[ircingest] Ingesting {} on {}:{} into {}", s.channel(), s.host(), s.port(), props.log().file());
    ingestService.start();
    Optional<Throwable> failure = ingestService.awaitTermination();
    if (failure.isPresent()) {
      exitCode = EXIT_FAILURE;
    }
  }

  private void runParse(Path logFile, List<String> outOption) {
    Flowable<ParsedMessage> messages = parser.parseLog(logFile);
    try {
      long written;
      if (outOption == null || outOption.isEmpty()) {
        Writer w = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
        written = exporter.writeJsonLines(messages, w);
      } else {
        Path out = Path.of(outOption.get(0));
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
          written = exporter.writeJsonLines(messages, w);
        }
        log.info("[ircingest] Wrote {}", out.toAbsolutePath());
      }
      log.info("[ircingest] Parsed {} chat messages from {}", written, logFile);
    } catch (IOException | RuntimeException e) {
      log.error("[ircingest] Failed to parse {}: {}", logFile, e.toString(), e);
      exitCode = EXIT_FAILURE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
