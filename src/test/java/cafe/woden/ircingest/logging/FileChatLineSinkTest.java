package cafe.woden.ircingest.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileChatLineSinkTest {

  private static final LocalDateTime AT = LocalDateTime.of(2018, 12, 10, 11, 26, 40);

  @TempDir Path dir;

  @Test
  void fileIsNotCreatedUntilFirstAppend() throws Exception {
    Path file = dir.resolve("chat.log");
    try (FileChatLineSink sink = new FileChatLineSink(file)) {
      assertFalse(Files.exists(file));
    }
    assertFalse(Files.exists(file));
  }

  @Test
  void appendsAreFlushedImmediately() throws Exception {
    Path file = dir.resolve("chat.log");
    try (FileChatLineSink sink = new FileChatLineSink(file)) {
      sink.append(AT, "one\r\n");
      assertEquals("2018-12-10_11:26:40 — one\n\n\n", Files.readString(file, StandardCharsets.UTF_8));

      sink.append(AT.plusSeconds(1), "two\r\n");
      assertEquals(
          "2018-12-10_11:26:40 — one\n\n\n2018-12-10_11:26:41 — two\n\n\n",
          Files.readString(file, StandardCharsets.UTF_8));
    }
  }

  @Test
  void reopeningAppendsRatherThanTruncates() throws Exception {
    Path file = dir.resolve("chat.log");
    try (FileChatLineSink sink = new FileChatLineSink(file)) {
      sink.append(AT, "one");
    }
    try (FileChatLineSink sink = new FileChatLineSink(file)) {
      sink.append(AT, "two");
    }

    String content = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(content.startsWith("2018-12-10_11:26:40 — one"));
    assertTrue(content.endsWith("— two\n\n\n"));
  }

  @Test
  void appendAfterCloseReopensTheFile() throws Exception {
    Path file = dir.resolve("chat.log");
    FileChatLineSink sink = new FileChatLineSink(file);
    sink.append(AT, "one");
    sink.close();
    sink.append(AT, "two");
    sink.close();

    assertTrue(Files.readString(file, StandardCharsets.UTF_8).endsWith("— two\n\n\n"));
  }

  @Test
  void missingParentDirectoriesAreCreated() throws Exception {
    Path file = dir.resolve("logs/twitch/chat.log");
    try (FileChatLineSink sink = new FileChatLineSink(file)) {
      sink.append(AT, "hi");
    }

    assertTrue(Files.isRegularFile(file));
  }

  @Test
  void unwritableTargetSurfacesAsUncheckedIoException() throws Exception {
    try (FileChatLineSink sink = new FileChatLineSink(dir)) {
      assertThrows(UncheckedIOException.class, () -> sink.append(AT, "hi"));
    }
  }
}
