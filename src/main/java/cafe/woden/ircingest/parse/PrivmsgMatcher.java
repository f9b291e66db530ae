package cafe.woden.ircingest.parse;

/**
 * Hand-written matcher for the one line shape we keep:
 *
 * <pre>
 * [@tags ]:&lt;username&gt;!&lt;user&gt;@&lt;anything&gt;.tmi.&lt;domain&gt; PRIVMSG #&lt;channel&gt; :&lt;message&gt;
 * </pre>
 *
 * <p>Each grammar step that can fail has its own {@link Mismatch}, so a dropped line says where it
 * stopped matching.
 */
final class PrivmsgMatcher {

  private static final String TMI_LABEL = ".tmi.";
  private static final String COMMAND = "PRIVMSG";

  enum Mismatch {
    EMPTY_LINE,
    NO_PREFIX,
    NO_USERNAME,
    NO_HOST,
    NOT_TMI_HOST,
    NOT_PRIVMSG,
    NO_CHANNEL,
    NO_MESSAGE
  }

  sealed interface Result permits Match, NoMatch {}

  record Match(String username, String channel, String message) implements Result {}

  record NoMatch(Mismatch mismatch) implements Result {}

  private PrivmsgMatcher() {}

  static Result match(String rawLine) {
    if (rawLine == null) return new NoMatch(Mismatch.EMPTY_LINE);
    String line = stripTags(rawLine.strip());
    if (line.isEmpty()) return new NoMatch(Mismatch.EMPTY_LINE);

    // Prefix token: ":nick!user@host"
    if (line.charAt(0) != ':') return new NoMatch(Mismatch.NO_PREFIX);
    int prefixEnd = line.indexOf(' ');
    if (prefixEnd < 0) return new NoMatch(Mismatch.NO_PREFIX);
    String prefix = line.substring(1, prefixEnd);

    int bang = prefix.indexOf('!');
    if (bang <= 0) return new NoMatch(Mismatch.NO_USERNAME);
    String username = prefix.substring(0, bang);
    if (username.isBlank()) return new NoMatch(Mismatch.NO_USERNAME);

    int at = prefix.indexOf('@', bang + 1);
    if (at < 0 || at == prefix.length() - 1) return new NoMatch(Mismatch.NO_HOST);
    String host = prefix.substring(at + 1);
    int tmi = host.indexOf(TMI_LABEL);
    if (tmi < 0 || tmi + TMI_LABEL.length() >= host.length()) {
      return new NoMatch(Mismatch.NOT_TMI_HOST);
    }

    // Command token.
    Cursor cur = new Cursor(line, prefixEnd);
    String command = cur.nextToken();
    if (!COMMAND.equals(command)) return new NoMatch(Mismatch.NOT_PRIVMSG);

    // Target token: "#channel"
    String target = cur.nextToken();
    if (target == null || target.length() < 2 || target.charAt(0) != '#') {
      return new NoMatch(Mismatch.NO_CHANNEL);
    }
    String channel = target.substring(1);
    if (channel.isBlank()) return new NoMatch(Mismatch.NO_CHANNEL);

    // Trailing parameter: ":message"
    String trailing = cur.rest();
    if (trailing.length() < 2 || trailing.charAt(0) != ':') return new NoMatch(Mismatch.NO_MESSAGE);
    String message = trailing.substring(1).strip();
    if (message.isEmpty()) return new NoMatch(Mismatch.NO_MESSAGE);

    return new Match(username, channel, message);
  }

  /** IRCv3 message tags: "@aaa=bbb;ccc :prefix COMMAND ...". */
  static String stripTags(String line) {
    if (!line.startsWith("@")) return line;
    int sp = line.indexOf(' ');
    if (sp < 0) return "";
    return line.substring(sp + 1).stripLeading();
  }

  /** Space-separated tokenizer over the part of the line after the prefix. */
  private static final class Cursor {
    private final String s;
    private int pos;

    Cursor(String s, int pos) {
      this.s = s;
      this.pos = pos;
    }

    String nextToken() {
      skipSpaces();
      if (pos >= s.length()) return null;
      int end = s.indexOf(' ', pos);
      if (end < 0) end = s.length();
      String tok = s.substring(pos, end);
      pos = end;
      return tok;
    }

    String rest() {
      skipSpaces();
      return pos >= s.length() ? "" : s.substring(pos);
    }

    private void skipSpaces() {
      while (pos < s.length() && s.charAt(pos) == ' ') pos++;
    }
  }
}
