package cafe.woden.ircbot.irc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Line codec for the wire protocol.
 *
 * <p>Stateless; every method is a pure function of its input.
 */
public final class IrcCodec {

  /** Hard ceiling for one encoded line, terminator included. */
  public static final int MAX_LINE_BYTES = 512;

  private static final byte[] EMPTY = new byte[0];

  private IrcCodec() {}

  /**
   * Decodes one raw line.
   *
   * <p>Lines mentioning {@code QUIT} are dropped on purpose, as is blank input. {@code PING} and
   * {@code ERROR} carry no sender prefix and only expose their trailing argument.
   */
  public static Optional<InboundEvent> decode(String rawLine) {
    if (rawLine == null) return Optional.empty();
    String line = rawLine.strip();
    if (line.isEmpty()) return Optional.empty();

    String[] fields = line.split("\\s+");

    if (line.contains("QUIT")) return Optional.empty();

    if (line.startsWith("PING")) {
      return Optional.of(new InboundEvent("", "", "PING", "", trailing(fields)));
    }
    if (line.startsWith("ERROR")) {
      return Optional.of(new InboundEvent("", "", "ERROR", "", trailing(fields)));
    }

    for (int i = 0; i < 4 && i < fields.length; i++) {
      if (fields[i].startsWith(":")) fields[i] = fields[i].substring(1);
    }

    String prefix = fields[0];
    String nick;
    String mask;
    int bang = prefix.indexOf('!');
    if (bang >= 0) {
      nick = prefix.substring(0, bang);
      mask = prefix.substring(bang + 1);
    } else {
      nick = prefix;
      mask = prefix;
    }

    String type = fields.length > 1 ? fields[1] : "";
    String target = fields.length > 2 ? fields[2] : "";
    String payload =
        fields.length > 3 ? String.join(" ", Arrays.copyOfRange(fields, 3, fields.length)) : "";

    return Optional.of(new InboundEvent(nick, mask, type, target, payload));
  }

  /**
   * Encodes a command verb and its arguments.
   *
   * <p>The last argument is written in trailing form ({@code :arg}) when it is empty, contains a
   * space or starts with a colon.
   */
  public static byte[] encode(String verb, String... args) {
    StringBuilder sb = new StringBuilder(verb == null ? "" : verb.trim());
    if (args != null) {
      for (int i = 0; i < args.length; i++) {
        String a = args[i] == null ? "" : args[i];
        boolean last = i == args.length - 1;
        sb.append(' ');
        if (last && needsTrailing(a)) {
          sb.append(':');
        }
        sb.append(a);
      }
    }
    return format(sb.toString());
  }

  /**
   * Terminates an already formatted line and applies the size rules.
   *
   * <p>Returns an empty array when nothing should be written. Oversized lines are cut to exactly
   * {@link #MAX_LINE_BYTES} and the final two bytes overwritten with CRLF, even when that splits a
   * multi-byte character.
   */
  public static byte[] format(String line) {
    byte[] data = ((line == null ? "" : line) + "\r\n").getBytes(StandardCharsets.UTF_8);
    if (data.length <= 2) return EMPTY;

    if (data.length >= MAX_LINE_BYTES) {
      data = Arrays.copyOf(data, MAX_LINE_BYTES);
      data[MAX_LINE_BYTES - 2] = '\r';
      data[MAX_LINE_BYTES - 1] = '\n';
    }
    return data;
  }

  private static boolean needsTrailing(String arg) {
    return arg.isEmpty() || arg.indexOf(' ') >= 0 || arg.startsWith(":");
  }

  private static String trailing(String[] fields) {
    if (fields.length < 2) return "";
    String s = fields[1];
    return s.startsWith(":") ? s.substring(1) : s;
  }
}
