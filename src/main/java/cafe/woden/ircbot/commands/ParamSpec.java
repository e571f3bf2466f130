package cafe.woden.ircbot.commands;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jmolecules.ddd.annotation.ValueObject;

/** Declared parameter of a command; {@code pattern} defaults to {@link ParamPatterns#ANY}. */
@ValueObject
public record ParamSpec(String name, boolean required, Pattern pattern) {

  public ParamSpec {
    name = Objects.toString(name, "").trim().toLowerCase(Locale.ROOT);
    if (name.isEmpty()) throw new IllegalArgumentException("parameter name is blank");
    if (pattern == null) pattern = ParamPatterns.ANY;
  }

  public boolean accepts(String value) {
    return value != null && pattern.matcher(value).matches();
  }

  /** {@code <name>} when required, {@code [name]} otherwise. */
  public String usage() {
    return required ? "<" + name + ">" : "[" + name + "]";
  }
}
