package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcWriter;
import cafe.woden.ircbot.irc.ProtocolBinder;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The {@link ProtocolBinder} handed to plugins; consulted for every decoded event. */
final class MessageBindings implements ProtocolBinder {
  private static final Logger log = LoggerFactory.getLogger(MessageBindings.class);

  private final Map<String, List<MessageHandler>> handlers = new ConcurrentHashMap<>();

  @Override
  public void bind(String messageType, MessageHandler handler) {
    Objects.requireNonNull(handler, "handler");
    handlers.computeIfAbsent(key(messageType), k -> new CopyOnWriteArrayList<>()).add(handler);
  }

  @Override
  public void unbind(String messageType, MessageHandler handler) {
    List<MessageHandler> list = handlers.get(key(messageType));
    if (list != null) list.remove(handler);
  }

  @Override
  public void clear() {
    handlers.clear();
  }

  /** Runs the handlers for the event's type, then the catch-all ones. */
  void deliver(IrcWriter writer, InboundEvent event) {
    run(handlers.get(key(event.messageType())), writer, event);
    run(handlers.get(ANY_TYPE), writer, event);
  }

  private static void run(List<MessageHandler> list, IrcWriter writer, InboundEvent event) {
    if (list == null) return;
    for (MessageHandler h : list) {
      try {
        h.handle(writer, event);
      } catch (IOException e) {
        log.warn("[ircbot] message handler could not reply to event: {}", event, e);
      } catch (RuntimeException e) {
        log.warn("[ircbot] message handler failed on event: {}", event, e);
      }
    }
  }

  private static String key(String messageType) {
    return Objects.toString(messageType, "").trim().toUpperCase(Locale.ROOT);
  }
}
