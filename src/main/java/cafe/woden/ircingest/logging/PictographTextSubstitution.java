package cafe.woden.ircingest.logging;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Rewrites emoji into bracketed, lower-case Unicode names.
 *
 * <p>{@code "gg 😂"} becomes {@code "gg [face_with_tears_of_joy]"}. Emoji presentation selectors
 * and zero-width joiners carry no meaning once the glyphs are spelled out, so they are dropped.
 * Stateless and thread-safe.
 */
public final class PictographTextSubstitution implements UnaryOperator<String> {

  private static final int VARIATION_SELECTOR_16 = 0xFE0F;
  private static final int ZERO_WIDTH_JOINER = 0x200D;

  @Override
  public String apply(String text) {
    if (text == null || text.isEmpty()) return text;

    StringBuilder sb = null;
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      int next = i + Character.charCount(cp);

      String replacement = null;
      if (cp == VARIATION_SELECTOR_16 || cp == ZERO_WIDTH_JOINER) {
        replacement = "";
      } else if (isPictograph(cp)) {
        String name = Character.getName(cp);
        if (name != null) replacement = "[" + toSnake(name) + "]";
      }

      if (replacement != null) {
        if (sb == null) {
          sb = new StringBuilder(text.length() + 16);
          sb.append(text, 0, i);
        }
        sb.append(replacement);
      } else if (sb != null) {
        sb.appendCodePoint(cp);
      }
      i = next;
    }
    return sb == null ? text : sb.toString();
  }

  static boolean isPictograph(int cp) {
    int type = Character.getType(cp);
    if (type != Character.OTHER_SYMBOL && type != Character.MODIFIER_SYMBOL) return false;
    return (cp >= 0x1F000 && cp <= 0x1FAFF)
        || (cp >= 0x2600 && cp <= 0x27BF)
        || (cp >= 0x2B00 && cp <= 0x2BFF);
  }

  private static String toSnake(String unicodeName) {
    return unicodeName.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
  }
}
