package cafe.woden.ircbot.config;

import cafe.woden.ircbot.irc.ChannelSpec;
import java.util.List;

/**
 * Live view of the bot profile.
 *
 * <p>Static values come from {@link BotProperties}; the mutable parts (nick, passwords, whitelist,
 * inbound logging) can change while the bot runs.
 */
public interface BotProfile {

  /** {@code host:port} of the server. */
  String address();

  BotProperties.Tls tls();

  String nickname();

  /**
   * Sets the nickname. Called when the configured nick turned out to be taken and could not be
   * recovered.
   */
  void setNickname(String nickname);

  String nickservPassword();

  void setNickservPassword(String password);

  String operPassword();

  String connectionPassword();

  String realName();

  String commandPrefix();

  List<ChannelSpec> channels();

  /** Case-insensitive whitelist check used to authorize restricted commands. */
  boolean isWhitelisted(String hostmask);

  List<String> whitelist();

  void whitelistAdd(String hostmask);

  void whitelistRemove(String hostmask);

  /** True if {@code name} equals the bot's current nick (case-insensitive). */
  boolean isNick(String name);

  /** Application arguments for a handed-off child process. */
  List<String> restartArgs();

  boolean logging();

  void setLogging(boolean enabled);
}
