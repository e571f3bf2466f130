package cafe.woden.ircbot.irc;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single decoded line received from the server.
 *
 * <p>{@code messageType} is the protocol verb or numeric ("PRIVMSG", "PING", "001", ...). The
 * {@code target} is a channel or the bot's own nick; routing code replaces the latter with the
 * sender's nick via {@link #withTarget(String)} so replies end up at the right recipient.
 */
@ValueObject
public record InboundEvent(
    String senderNick, String senderHostmask, String messageType, String target, String payload) {

  public InboundEvent {
    senderNick = Objects.toString(senderNick, "");
    senderHostmask = Objects.toString(senderHostmask, "");
    messageType = Objects.toString(messageType, "");
    target = Objects.toString(target, "");
    payload = Objects.toString(payload, "");
  }

  public InboundEvent withTarget(String newTarget) {
    return new InboundEvent(senderNick, senderHostmask, messageType, newTarget, payload);
  }

  /** True when the event was addressed to a channel rather than a user or service. */
  public boolean fromChannel() {
    if (target.isEmpty()) return false;
    char c = target.charAt(0);
    return c == '#' || c == '&' || c == '!' || c == '+';
  }

  public boolean isPrivMsg() {
    return "PRIVMSG".equals(messageType);
  }

  /** Payload words, skipping the first {@code n}. Empty when {@code n} is out of range. */
  public List<String> fields(int n) {
    String trimmed = payload.trim();
    if (trimmed.isEmpty()) return List.of();
    String[] words = trimmed.split("\\s+");
    if (n < 0 || n >= words.length) return List.of();
    return List.copyOf(Arrays.asList(words).subList(n, words.length));
  }

  @Override
  public String toString() {
    return senderHostmask + " " + senderNick + " " + messageType + " " + target + " " + payload;
  }
}
