package cafe.woden.ircbot.commands;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** A named command bound in a {@link CommandRegistry}. */
public final class Command {

  private final String name;
  private final boolean restricted;
  private final CommandHandler handler;
  private final List<ParamSpec> params = new CopyOnWriteArrayList<>();

  Command(String name, boolean restricted, CommandHandler handler) {
    this.name = normalizeName(name);
    if (this.name.isEmpty()) throw new IllegalArgumentException("command name is blank");
    this.restricted = restricted;
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  static String normalizeName(String name) {
    return Objects.toString(name, "").trim().toLowerCase(Locale.ROOT);
  }

  /** Declares the next parameter. A null pattern accepts anything. */
  public Command addParam(String name, boolean required, Pattern pattern) {
    params.add(new ParamSpec(name, required, pattern));
    return this;
  }

  public Command addParam(String name, boolean required) {
    return addParam(name, required, null);
  }

  public String name() {
    return name;
  }

  public boolean restricted() {
    return restricted;
  }

  public CommandHandler handler() {
    return handler;
  }

  public List<ParamSpec> params() {
    return List.copyOf(params);
  }

  public int requiredParamCount() {
    int count = 0;
    for (ParamSpec p : params) {
      if (p.required()) count++;
    }
    return count;
  }

  /** Parameter usage, e.g. {@code <channel> [key]}. */
  public String usage() {
    return params.stream().map(ParamSpec::usage).collect(Collectors.joining(" "));
  }

  @Override
  public String toString() {
    return "Command[" + name + (restricted ? ", restricted" : "") + ", params=" + params + "]";
  }
}
