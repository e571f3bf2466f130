package cafe.woden.ircbot.irc;

import java.io.IOException;
import java.util.Objects;

/**
 * Encoders for the commands the bot actually sends.
 *
 * <p>Each method formats through {@link IrcCodec} and writes one line per protocol message. When a
 * command needs more than one line the later writes only happen if the earlier ones succeeded,
 * since any {@link IOException} propagates immediately.
 */
public final class IrcCommands {

  static final String NICKSERV = "nickserv";
  static final String CHANSERV = "chanserv";

  private IrcCommands() {}

  /** Sends a pre-formatted line verbatim (subject to the size rules). */
  public static void raw(IrcWriter w, String line) throws IOException {
    send(w, IrcCodec.format(line));
  }

  /** Connection password. Must precede NICK/USER; skipped when empty. */
  public static void pass(IrcWriter w, String password) throws IOException {
    if (password == null || password.isEmpty()) return;
    send(w, IrcCodec.encode("PASS", password));
  }

  /** {@code USER <username> <mode> * :<realName>} */
  public static void user(IrcWriter w, String username, String mode, String realName)
      throws IOException {
    raw(w, "USER " + require(username, "username") + " " + require(mode, "mode") + " * :"
        + Objects.toString(realName, ""));
  }

  /** Changes nick and, when a password is given, identifies with nick services. */
  public static void nick(IrcWriter w, String nickname, String nickservPassword)
      throws IOException {
    send(w, IrcCodec.encode("NICK", require(nickname, "nickname")));
    if (nickservPassword != null && !nickservPassword.isEmpty()) {
      privMsg(w, NICKSERV, "IDENTIFY " + nickservPassword);
    }
  }

  public static void nick(IrcWriter w, String nickname) throws IOException {
    nick(w, nickname, null);
  }

  /**
   * Joins a channel, with its key when set. A channel password results in a second, separate
   * IDENTIFY message to channel services.
   */
  public static void join(IrcWriter w, ChannelSpec channel) throws IOException {
    Objects.requireNonNull(channel, "channel");
    String name = require(channel.name(), "channel");
    if (channel.hasKey()) {
      raw(w, "JOIN " + name + " " + channel.key());
    } else {
      raw(w, "JOIN " + name);
    }

    if (channel.hasPassword()) {
      privMsg(w, CHANSERV, "IDENTIFY " + name + " " + channel.password());
    }
  }

  public static void part(IrcWriter w, String channel) throws IOException {
    raw(w, "PART " + require(channel, "channel") + " :");
  }

  public static void privMsg(IrcWriter w, String target, String text) throws IOException {
    raw(w, "PRIVMSG " + require(target, "target") + " :" + Objects.toString(text, ""));
  }

  public static void notice(IrcWriter w, String target, String text) throws IOException {
    raw(w, "NOTICE " + require(target, "target") + " :" + Objects.toString(text, ""));
  }

  public static void pong(IrcWriter w, String payload) throws IOException {
    raw(w, "PONG " + Objects.toString(payload, ""));
  }

  public static void ping(IrcWriter w, String token) throws IOException {
    raw(w, "PING " + require(token, "token"));
  }

  public static void mode(IrcWriter w, String target, String mode) throws IOException {
    raw(w, "MODE " + require(target, "target") + " " + require(mode, "mode"));
  }

  public static void mode(IrcWriter w, String target, String mode, String argument)
      throws IOException {
    raw(w, "MODE " + require(target, "target") + " " + require(mode, "mode") + " "
        + require(argument, "argument"));
  }

  /** Asks nick services to release our registered nick after a nick collision. */
  public static void recover(IrcWriter w, String nickname, String password) throws IOException {
    raw(w, "NS RECOVER " + require(nickname, "nickname") + " " + require(password, "password"));
  }

  public static void oper(IrcWriter w, String name, String password) throws IOException {
    raw(w, "OPER " + require(name, "name") + " " + require(password, "password"));
  }

  public static void quit(IrcWriter w, String message) throws IOException {
    if (message == null || message.isBlank()) {
      raw(w, "QUIT");
    } else {
      raw(w, "QUIT :" + message);
    }
  }

  private static void send(IrcWriter w, byte[] line) throws IOException {
    if (line.length == 0) return;
    w.write(line);
  }

  private static String require(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(what + " is blank");
    }
    return value.trim();
  }
}
