package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcWriter;
import cafe.woden.ircbot.irc.ProtocolBinder;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * An extension that sees every inbound event.
 *
 * <p>Plugins are Spring beans; the {@link PluginHost} picks them up in bean order.
 */
@ApplicationLayer
public interface BotPlugin {

  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Acquires resources and binds protocol handlers on {@code binder}. A failure is logged and does
   * not keep other plugins from loading.
   */
  void load(ProtocolBinder binder, BotProfile profile) throws Exception;

  /** Flushes state and releases resources. Called once at shutdown. */
  void unload(BotProfile profile) throws Exception;

  /**
   * Called on a plugin worker thread, never on the read loop. One plugin sees events in the order
   * they arrived and never two at once.
   */
  default void dispatch(IrcWriter writer, InboundEvent event) throws Exception {}
}
