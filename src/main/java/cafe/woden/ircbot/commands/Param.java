package cafe.woden.ircbot.commands;

import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A validated argument value.
 *
 * <p>The numeric accessors return 0 when the value does not parse.
 */
@ValueObject
public record Param(String value) {

  public Param {
    value = Objects.toString(value, "");
  }

  public String asString() {
    return value;
  }

  /** Radix follows the prefix: {@code 0x} hex, {@code 0b} binary, {@code 0} octal. */
  public long asLong() {
    String s = value.trim();
    boolean negative = false;
    if (s.startsWith("+") || s.startsWith("-")) {
      negative = s.charAt(0) == '-';
      s = s.substring(1);
    }
    int radix = 10;
    String lower = s.toLowerCase(Locale.ROOT);
    if (lower.startsWith("0x")) {
      radix = 16;
      s = s.substring(2);
    } else if (lower.startsWith("0b")) {
      radix = 2;
      s = s.substring(2);
    } else if (s.length() > 1 && s.startsWith("0")) {
      radix = 8;
      s = s.substring(1);
    }
    if (s.isEmpty()) return 0;
    try {
      return Long.parseLong(negative ? "-" + s : s, radix);
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  public double asDouble() {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  /** True for {@code 1, t, true, y, yes, on} in any case; false for anything else. */
  public boolean asBoolean() {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "1", "t", "true", "y", "yes", "on":
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
