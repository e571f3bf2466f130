package cafe.woden.ircbot.irc;

import java.io.IOException;

/**
 * Routes raw message types to handlers.
 *
 * <p>Plugins that need to observe server replies for a query they issued (WHOIS, NAMES, ...) bind a
 * handler for the numeric they expect. {@link #ANY_TYPE} registers a catch-all handler.
 *
 * <p>Handlers run on the read loop in the order lines arrive, so they must not block.
 */
public interface ProtocolBinder {

  String ANY_TYPE = "*";

  /** Handler receiving the writer of the live connection and the inbound event. */
  @FunctionalInterface
  interface MessageHandler {
    void handle(IrcWriter writer, InboundEvent event) throws IOException;
  }

  void bind(String messageType, MessageHandler handler);

  void unbind(String messageType, MessageHandler handler);

  void clear();
}
