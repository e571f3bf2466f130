package cafe.woden.ircbot.commands;

import java.util.regex.Pattern;

/** Value patterns for command parameters. A value must match the whole pattern. */
public final class ParamPatterns {

  public static final Pattern ANY = Pattern.compile(".*");
  public static final Pattern INT = Pattern.compile("[+-]?\\d+");
  public static final Pattern UINT = Pattern.compile("\\+?\\d+");
  public static final Pattern FLOAT = Pattern.compile("[+-]?\\d+(\\.\\d+([eE][+-]?\\d+)?)?");
  public static final Pattern BOOL = Pattern.compile("1|0|t(rue)?|f(alse)?|y(es)?|no?|on|off");
  public static final Pattern CHANNEL = Pattern.compile("[#&+!][^ ,:]{1,50}");
  public static final Pattern MODE = Pattern.compile("[+-][obveI]");
  public static final Pattern URL =
      Pattern.compile("https?://[a-zA-Z0-9\\-.]+\\.[a-zA-Z]+(:[0-9]+)?(/\\S*)?");

  private ParamPatterns() {}
}
