package cafe.woden.ircbot.commands;

/** Replies sent to users whose command was refused. */
final class CommandReplies {

  static final String MISSING_PARAMETERS = "Missing parameters for command: %s";
  static final String INVALID_PARAMETER = "Command %s: invalid value for parameter \"%s\"";
  static final String ACCESS_DENIED =
      "Sorry, the command \"%s\" may only be used by administrators.";

  private CommandReplies() {}
}
