package cafe.woden.ircbot.commands;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits command text into words.
 *
 * <p>Double quotes group words and are dropped from the result; an unterminated quote runs to the
 * end of the line. Empty words are never returned, so {@code ""} yields nothing.
 */
final class ArgumentSplitter {

  private ArgumentSplitter() {}

  static List<String> split(String text) {
    List<String> out = new ArrayList<>();
    if (text == null) return out;

    StringBuilder word = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (!quoted && Character.isWhitespace(c)) {
        flush(word, out);
      } else {
        word.append(c);
      }
    }
    flush(word, out);
    return out;
  }

  private static void flush(StringBuilder word, List<String> out) {
    if (word.length() > 0) {
      out.add(word.toString());
      word.setLength(0);
    }
  }
}
