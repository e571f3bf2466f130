package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.irc.ChannelSpec;
import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcCodec;
import cafe.woden.ircbot.irc.IrcCommands;
import cafe.woden.ircbot.irc.IrcNumerics;
import cafe.woden.ircbot.irc.IrcWriter;
import cafe.woden.ircbot.plugin.PluginHost;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles one raw inbound line.
 *
 * <p>Server housekeeping (PING, ERROR, registration numerics) is answered here. Everything else
 * goes to the plugin host, which runs the bound protocol handlers on this thread. A private message
 * to the bot gets the sender as target so replies go back to them.
 */
@ApplicationLayer
@Component
class InboundRouter {
  private static final Logger log = LoggerFactory.getLogger(InboundRouter.class);

  private final BotProfile profile;
  private final PluginHost plugins;

  // nick to reclaim through nick services once registration is done
  private final AtomicReference<String> pendingRecover = new AtomicReference<>();

  InboundRouter(BotProfile profile, PluginHost plugins) {
    this.profile = Objects.requireNonNull(profile, "profile");
    this.plugins = Objects.requireNonNull(plugins, "plugins");
  }

  void route(IrcWriter writer, String rawLine) throws IOException {
    Optional<InboundEvent> decoded = IrcCodec.decode(rawLine);
    if (decoded.isEmpty()) return;
    InboundEvent event = decoded.get();

    if (profile.isNick(event.target())) {
      event = event.withTarget(event.senderNick());
    }

    switch (event.messageType()) {
      case "ERROR" -> {
        log.warn("[ircbot] network error: {}", event.payload());
        return;
      }
      case "PING" -> {
        IrcCommands.pong(writer, event.payload());
        return;
      }
      case IrcNumerics.RPL_WELCOME -> log.info("[ircbot] registered: {}", event.payload());
      case IrcNumerics.ERR_NICKNAMEINUSE -> onNicknameInUse(writer);
      default -> {
        if (IrcNumerics.isLoginComplete(event.messageType())) onLoginComplete(writer);
      }
    }

    plugins.dispatch(writer, event);

    if (profile.logging()) {
      log.info("[>] {}", event);
    }
  }

  private void onLoginComplete(IrcWriter writer) throws IOException {
    String wanted = pendingRecover.getAndSet(null);
    if (wanted != null) {
      log.info("[ircbot] reclaiming nickname {}", wanted);
      IrcCommands.recover(writer, wanted, profile.nickservPassword());
      IrcCommands.nick(writer, wanted, profile.nickservPassword());
      profile.setNickname(wanted);
    }

    if (!profile.operPassword().isEmpty()) {
      IrcCommands.oper(writer, profile.nickname(), profile.operPassword());
    }
    for (ChannelSpec channel : profile.channels()) {
      IrcCommands.join(writer, channel);
    }
  }

  /** Falls back to {@code <nick>_}; with a nick services password the nick is reclaimed later. */
  private void onNicknameInUse(IrcWriter writer) throws IOException {
    String current = profile.nickname();
    String fallback = current + "_";
    log.warn("[ircbot] nickname {} is in use; trying {}", current, fallback);

    if (!profile.nickservPassword().isEmpty()) {
      pendingRecover.compareAndSet(null, current);
    }
    IrcCommands.nick(writer, fallback);
    profile.setNickname(fallback);
  }
}
