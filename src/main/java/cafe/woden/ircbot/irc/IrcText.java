package cafe.woden.ircbot.irc;

/** Control-code wrappers for message text. */
public final class IrcText {
  private IrcText() {}

  /** A CTCP ACTION, rendered by clients like {@code /me ...}. */
  public static String action(String text) {
    return "\u0001ACTION " + text + "\u0001";
  }

  public static String bold(String text) {
    return "\u0002" + text + "\u0002";
  }

  public static String italic(String text) {
    return "\u001d" + text + "\u001d";
  }

  public static String underline(String text) {
    return "\u001f" + text + "\u001f";
  }
}
