package cafe.woden.ircbot.commands;

import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcWriter;

/**
 * Body of a bound command.
 *
 * <p>Runs on the command executor. Anything it throws is logged together with the triggering
 * event; it never reaches the read loop.
 */
@FunctionalInterface
public interface CommandHandler {

  void handle(IrcWriter writer, InboundEvent event, ParamList params) throws Exception;
}
