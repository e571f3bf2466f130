package cafe.woden.ircbot.irc;

/** Numeric replies the bot reacts to. */
public final class IrcNumerics {
  public static final String RPL_WELCOME = "001";
  public static final String RPL_ENDOFMOTD = "376";
  public static final String ERR_NOMOTD = "422";
  public static final String ERR_NICKNAMEINUSE = "433";

  private IrcNumerics() {}

  /** True for the replies that mark the end of connection registration. */
  public static boolean isLoginComplete(String messageType) {
    return RPL_ENDOFMOTD.equals(messageType) || ERR_NOMOTD.equals(messageType);
  }
}
