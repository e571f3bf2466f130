package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.config.ExecutorConfig;
import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcWriter;
import cafe.woden.ircbot.irc.ProtocolBinder;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Loads, feeds and unloads the {@link BotPlugin}s.
 *
 * <p>Bound protocol handlers run on the caller's thread. Each plugin then gets the event on its own
 * worker of the plugin executor; a worker runs its tasks one at a time in submission order, so a
 * slow plugin delays only itself.
 */
@ApplicationLayer
@Component
public class PluginHost {
  private static final Logger log = LoggerFactory.getLogger(PluginHost.class);

  private record Lane(BotPlugin plugin, Scheduler.Worker worker) {}

  private final List<BotPlugin> plugins;
  private final BotProfile profile;
  private final ExecutorService executor;
  private final Scheduler scheduler;
  private final MessageBindings bindings = new MessageBindings();
  private final AtomicBoolean loaded = new AtomicBoolean(false);

  private volatile List<Lane> lanes = List.of();

  public PluginHost(
      ObjectProvider<BotPlugin> plugins,
      BotProfile profile,
      @Qualifier(ExecutorConfig.PLUGIN_EXECUTOR) ExecutorService executor) {
    this(plugins.orderedStream().toList(), profile, executor);
  }

  PluginHost(List<BotPlugin> plugins, BotProfile profile, ExecutorService executor) {
    this.plugins = List.copyOf(plugins);
    this.profile = Objects.requireNonNull(profile, "profile");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.scheduler = Schedulers.from(executor);
  }

  public List<BotPlugin> plugins() {
    return plugins;
  }

  ProtocolBinder bindings() {
    return bindings;
  }

  public void loadAll() {
    if (!loaded.compareAndSet(false, true)) return;
    List<Lane> next = new ArrayList<>(plugins.size());
    for (BotPlugin p : plugins) {
      log.info("[ircbot] loading plugin {}", p.name());
      try {
        p.load(bindings, profile);
      } catch (Exception e) {
        log.warn("[ircbot] plugin {} failed to load", p.name(), e);
      }
      next.add(new Lane(p, scheduler.createWorker()));
    }
    lanes = List.copyOf(next);
  }

  @PreDestroy
  public void unloadAll() {
    if (!loaded.compareAndSet(true, false)) return;
    List<Lane> current = lanes;
    lanes = List.of();
    for (Lane lane : current) {
      lane.worker().dispose();
    }
    for (BotPlugin p : plugins) {
      log.info("[ircbot] unloading plugin {}", p.name());
      try {
        p.unload(profile);
      } catch (Exception e) {
        log.warn("[ircbot] plugin {} failed to unload", p.name(), e);
      }
    }
    bindings.clear();
  }

  /** Runs the bound handlers for {@code event}, then queues it for every plugin. */
  public void dispatch(IrcWriter writer, InboundEvent event) {
    if (!loaded.get()) return;
    bindings.deliver(writer, event);
    if (executor.isShutdown()) {
      log.debug("[ircbot] plugin executor is shut down; dropping {}", event);
      return;
    }
    for (Lane lane : lanes) {
      lane.worker().schedule(() -> deliver(lane.plugin(), writer, event));
    }
  }

  private static void deliver(BotPlugin p, IrcWriter writer, InboundEvent event) {
    try {
      p.dispatch(writer, event);
    } catch (VirtualMachineError fatal) {
      throw fatal;
    } catch (Throwable t) {
      log.warn("[ircbot] plugin {} failed on event: {}", p.name(), event, t);
    }
  }
}
