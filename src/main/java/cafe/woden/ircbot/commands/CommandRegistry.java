package cafe.woden.ircbot.commands;

import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcCommands;
import cafe.woden.ircbot.irc.IrcWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands reachable through one prefix, kept sorted by name.
 *
 * <p>Restricted commands run only when the authorization predicate accepts the sender's hostmask;
 * without a predicate they never run. Accepted invocations are handed to the executor, so
 * {@link #dispatch} returns before the handler does.
 */
@ApplicationLayer
public class CommandRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

  private final String prefix;
  private final Predicate<String> authorization;
  private final Executor executor;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  // sorted by name
  private final List<Command> commands = new ArrayList<>();

  public CommandRegistry(String prefix, Predicate<String> authorization, Executor executor) {
    this.prefix = Objects.toString(prefix, "");
    this.authorization = (authorization == null) ? hostmask -> false : authorization;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public String prefix() {
    return prefix;
  }

  /** Binds a command, replacing any command already bound under the same name. */
  public Command bind(String name, boolean restricted, CommandHandler handler) {
    Command cmd = new Command(name, restricted, handler);
    lock.writeLock().lock();
    try {
      int idx = indexOf(cmd.name());
      if (idx >= 0) {
        commands.set(idx, cmd);
        log.debug("[ircbot] command {} rebound", cmd.name());
      } else {
        commands.add(-(idx + 1), cmd);
      }
    } finally {
      lock.writeLock().unlock();
    }
    return cmd;
  }

  public void unbind(String name) {
    lock.writeLock().lock();
    try {
      int idx = indexOf(Command.normalizeName(name));
      if (idx >= 0) commands.remove(idx);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      commands.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Case-insensitive lookup; null when absent. */
  public Command find(String name) {
    lock.readLock().lock();
    try {
      int idx = indexOf(Command.normalizeName(name));
      return idx >= 0 ? commands.get(idx) : null;
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Command> commands() {
    lock.readLock().lock();
    try {
      return List.copyOf(commands);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** True only when a handler was submitted. */
  public boolean dispatch(IrcWriter writer, InboundEvent event) throws IOException {
    return dispatchOutcome(writer, event) == DispatchOutcome.DISPATCHED;
  }

  /**
   * Parses {@code event}'s payload as a command call and runs it.
   *
   * <p>Refusals are answered with a private message to the sender. Arguments beyond the declared
   * parameters are dropped; optional parameters that were not given are left out of the list.
   *
   * @throws IOException if a refusal could not be written
   */
  public DispatchOutcome dispatchOutcome(IrcWriter writer, InboundEvent event) throws IOException {
    Objects.requireNonNull(writer, "writer");
    if (event == null) return DispatchOutcome.IGNORED;
    String data = event.payload();
    if (!data.startsWith(prefix)) return DispatchOutcome.IGNORED;

    List<String> words = ArgumentSplitter.split(data.substring(prefix.length()));
    if (words.isEmpty()) return DispatchOutcome.IGNORED;

    Command cmd = find(words.get(0));
    if (cmd == null) return DispatchOutcome.IGNORED;
    List<String> args = words.subList(1, words.size());

    if (cmd.restricted() && !authorization.test(event.senderHostmask())) {
      log.debug("[ircbot] {} denied restricted command {}", event.senderHostmask(), cmd.name());
      IrcCommands.privMsg(
          writer, event.senderNick(), String.format(CommandReplies.ACCESS_DENIED, cmd.name()));
      return DispatchOutcome.ACCESS_DENIED;
    }

    if (cmd.requiredParamCount() > args.size()) {
      IrcCommands.privMsg(
          writer,
          event.senderNick(),
          String.format(CommandReplies.MISSING_PARAMETERS, cmd.name()));
      return DispatchOutcome.MISSING_PARAMETERS;
    }

    List<ParamSpec> specs = cmd.params();
    List<Param> values = new ArrayList<>(Math.min(args.size(), specs.size()));
    for (int i = 0; i < args.size() && i < specs.size(); i++) {
      ParamSpec spec = specs.get(i);
      if (!spec.accepts(args.get(i))) {
        IrcCommands.privMsg(
            writer,
            event.senderNick(),
            String.format(CommandReplies.INVALID_PARAMETER, cmd.name(), spec.name()));
        return DispatchOutcome.INVALID_PARAMETER;
      }
      values.add(new Param(args.get(i)));
    }

    ParamList params = new ParamList(values);
    executor.execute(() -> invoke(cmd, writer, event, params));
    return DispatchOutcome.DISPATCHED;
  }

  /** One line per command: {@code <prefix><name>[*] <usage>}, restricted ones marked with *. */
  public List<String> helpLines() {
    List<String> lines = new ArrayList<>();
    for (Command cmd : commands()) {
      StringBuilder sb = new StringBuilder(prefix).append(cmd.name());
      if (cmd.restricted()) sb.append('*');
      String usage = cmd.usage();
      if (!usage.isEmpty()) sb.append(' ').append(usage);
      lines.add(sb.toString());
    }
    return lines;
  }

  private static void invoke(
      Command cmd, IrcWriter writer, InboundEvent event, ParamList params) {
    try {
      cmd.handler().handle(writer, event, params);
    } catch (VirtualMachineError fatal) {
      throw fatal;
    } catch (Throwable t) {
      log.warn("[ircbot] command {} failed; event: {}", cmd.name(), event, t);
    }
  }

  private int indexOf(String name) {
    int lo = 0;
    int hi = commands.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      int c = commands.get(mid).name().compareTo(name);
      if (c < 0) {
        lo = mid + 1;
      } else if (c > 0) {
        hi = mid - 1;
      } else {
        return mid;
      }
    }
    return -(lo + 1);
  }
}
