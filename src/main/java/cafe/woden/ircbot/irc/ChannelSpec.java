package cafe.woden.ircbot.irc;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A channel to join.
 *
 * <p>{@code key} is the channel key sent with JOIN; {@code password} is the channel services
 * password used for a follow-up IDENTIFY.
 */
@ValueObject
public record ChannelSpec(String name, String key, String password) {
  public ChannelSpec {
    name = Objects.toString(name, "").trim();
    key = Objects.toString(key, "").trim();
    password = Objects.toString(password, "");
  }

  public static ChannelSpec named(String name) {
    return new ChannelSpec(name, "", "");
  }

  public boolean hasKey() {
    return !key.isEmpty();
  }

  public boolean hasPassword() {
    return !password.isEmpty();
  }
}
