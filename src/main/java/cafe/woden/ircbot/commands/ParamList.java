package cafe.woden.ircbot.commands;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/** Validated arguments of one command invocation, in declaration order. */
public final class ParamList implements Iterable<Param> {

  public static final ParamList EMPTY = new ParamList(List.of());

  private final List<Param> values;

  public ParamList(List<Param> values) {
    this.values = List.copyOf(values);
  }

  public static ParamList of(String... values) {
    return new ParamList(Arrays.stream(values).map(Param::new).toList());
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Param get(int index) {
    return values.get(index);
  }

  public String string(int index) {
    return values.get(index).asString();
  }

  /** All values separated by single spaces. */
  public String join() {
    return values.stream().map(Param::asString).collect(Collectors.joining(" "));
  }

  @Override
  public Iterator<Param> iterator() {
    return values.iterator();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
