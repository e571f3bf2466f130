package cafe.woden.ircbot.handoff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * What a parent process passed on the command line: {@code --fork=N} descriptors at 3..3+N-1 and,
 * optionally, {@code --fork-buffer=<base64>} with input it had already read.
 */
public final class InheritedDescriptors {

  public static final int FIRST_SLOT = 3;
  public static final InheritedDescriptors NONE = new InheritedDescriptors(0, new byte[0]);

  static final String FORK_OPTION = "--fork";
  static final String FORK_BUFFER_OPTION = "--fork-buffer";

  private final int count;
  private final byte[] bufferedInput;

  public InheritedDescriptors(int count, byte[] bufferedInput) {
    if (count < 0) throw new IllegalArgumentException("negative descriptor count: " + count);
    this.count = count;
    this.bufferedInput = bufferedInput == null ? new byte[0] : bufferedInput.clone();
  }

  /**
   * Reads the fork options from raw program arguments. Both {@code --fork=N} and
   * {@code --fork N} are accepted.
   *
   * @throws IllegalArgumentException on a malformed count or buffer
   */
  public static InheritedDescriptors parse(String... args) {
    if (args == null || args.length == 0) return NONE;
    int count = 0;
    byte[] buffered = null;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String value;
      if (arg.startsWith(FORK_BUFFER_OPTION + "=")) {
        value = arg.substring(FORK_BUFFER_OPTION.length() + 1);
        buffered = decode(value);
      } else if (arg.equals(FORK_BUFFER_OPTION) && i + 1 < args.length) {
        buffered = decode(args[++i]);
      } else if (arg.startsWith(FORK_OPTION + "=")) {
        count = parseCount(arg.substring(FORK_OPTION.length() + 1));
      } else if (arg.equals(FORK_OPTION) && i + 1 < args.length) {
        count = parseCount(args[++i]);
      }
    }
    return count == 0 && buffered == null ? NONE : new InheritedDescriptors(count, buffered);
  }

  /** {@code args} without any fork options, so a child can append its own. */
  public static List<String> withoutForkOptions(List<String> args) {
    List<String> out = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      if (arg.equals(FORK_OPTION) || arg.equals(FORK_BUFFER_OPTION)) {
        i++;
      } else if (!arg.startsWith(FORK_OPTION + "=") && !arg.startsWith(FORK_BUFFER_OPTION + "=")) {
        out.add(arg);
      }
    }
    return out;
  }

  /** Options telling a child about {@code count} descriptors and the parent's unread input. */
  public static List<String> forkOptions(int count, byte[] bufferedInput) {
    List<String> out = new ArrayList<>(2);
    out.add(FORK_OPTION + "=" + count);
    if (bufferedInput != null && bufferedInput.length > 0) {
      out.add(FORK_BUFFER_OPTION + "=" + Base64.getEncoder().encodeToString(bufferedInput));
    }
    return out;
  }

  public int count() {
    return count;
  }

  public boolean inherited() {
    return count > 0;
  }

  /** Descriptor numbers in the order the parent passed them. */
  public List<Integer> slots() {
    List<Integer> slots = new ArrayList<>(count);
    for (int i = 0; i < count; i++) slots.add(FIRST_SLOT + i);
    return slots;
  }

  public byte[] bufferedInput() {
    return bufferedInput.clone();
  }

  private static int parseCount(String value) {
    try {
      int n = Integer.parseInt(value.trim());
      if (n < 0) throw new IllegalArgumentException("negative --fork count: " + value);
      return n;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid --fork count: " + value, e);
    }
  }

  private static byte[] decode(String value) {
    try {
      return Base64.getDecoder().decode(value.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid --fork-buffer value", e);
    }
  }

  @Override
  public String toString() {
    return "InheritedDescriptors[count=" + count + ", buffered=" + bufferedInput.length + "]";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof InheritedDescriptors other
        && count == other.count
        && Arrays.equals(bufferedInput, other.bufferedInput);
  }

  @Override
  public int hashCode() {
    return 31 * count + Arrays.hashCode(bufferedInput);
  }
}
