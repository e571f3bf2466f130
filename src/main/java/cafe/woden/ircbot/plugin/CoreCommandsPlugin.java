package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.commands.CommandRegistry;
import cafe.woden.ircbot.commands.ParamList;
import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.handoff.ControlEvent;
import cafe.woden.ircbot.handoff.HandoffController;
import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcCommands;
import cafe.woden.ircbot.irc.IrcText;
import cafe.woden.ircbot.irc.IrcWriter;
import cafe.woden.ircbot.irc.ProtocolBinder;
import cafe.woden.ircbot.util.AppVersion;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Commands every bot has: {@code help}, {@code version} and the restricted {@code reload}.
 *
 * <p>The core registry is consulted from a PRIVMSG binding, so commands are matched in the order
 * they arrive; only the handlers run on the command executor.
 */
@ApplicationLayer
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CoreCommandsPlugin implements BotPlugin {

  static final String HELP = "help";
  static final String VERSION = "version";
  static final String RELOAD = "reload";

  private static final String PRIVMSG = "PRIVMSG";

  private final CommandRegistry registry;
  private final HandoffController handoff;
  private final ProtocolBinder.MessageHandler onPrivMsg = this::onPrivMsg;

  private volatile ProtocolBinder binder;

  public CoreCommandsPlugin(CommandRegistry coreCommandRegistry, HandoffController handoff) {
    this.registry = Objects.requireNonNull(coreCommandRegistry, "coreCommandRegistry");
    this.handoff = Objects.requireNonNull(handoff, "handoff");
  }

  @Override
  public void load(ProtocolBinder binder, BotProfile profile) {
    registry.bind(HELP, false, this::help);
    registry.bind(VERSION, false, this::version);
    registry.bind(RELOAD, true, this::reload);
    this.binder = binder;
    binder.bind(PRIVMSG, onPrivMsg);
  }

  @Override
  public void unload(BotProfile profile) {
    registry.unbind(HELP);
    registry.unbind(VERSION);
    registry.unbind(RELOAD);
    ProtocolBinder b = binder;
    if (b != null) b.unbind(PRIVMSG, onPrivMsg);
  }

  private void onPrivMsg(IrcWriter writer, InboundEvent event) throws IOException {
    registry.dispatch(writer, event);
  }

  /** Sent privately so a channel is not flooded with the listing. */
  private void help(IrcWriter w, InboundEvent event, ParamList params) throws IOException {
    IrcCommands.notice(
        w, event.senderNick(), IrcText.bold("Commands") + " (* = administrators only):");
    for (String line : registry.helpLines()) {
      IrcCommands.notice(w, event.senderNick(), line);
    }
  }

  private void version(IrcWriter w, InboundEvent event, ParamList params) throws IOException {
    IrcCommands.privMsg(
        w,
        event.target(),
        event.senderNick()
            + ", I am "
            + IrcText.bold(AppVersion.appNameWithVersion())
            + ". Last restart was "
            + formatUptime(AppVersion.uptime())
            + " ago.");
  }

  private void reload(IrcWriter w, InboundEvent event, ParamList params) {
    handoff.submit(ControlEvent.RELOAD);
  }

  static String formatUptime(Duration d) {
    long s = Math.max(0, d.getSeconds());
    long days = s / 86_400;
    long hours = (s % 86_400) / 3_600;
    long minutes = (s % 3_600) / 60;
    if (days > 0) return days + "d " + hours + "h " + minutes + "m";
    if (hours > 0) return hours + "h " + minutes + "m";
    return minutes + "m " + (s % 60) + "s";
  }
}
