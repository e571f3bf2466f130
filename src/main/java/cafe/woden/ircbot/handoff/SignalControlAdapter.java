package cafe.woden.ircbot.handoff;

import cafe.woden.ircbot.config.BotProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.InterfaceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import sun.misc.Signal;

/**
 * Feeds OS signals into the {@link HandoffController}: the reload signal ({@code USR1} unless
 * configured otherwise) becomes {@link ControlEvent#RELOAD}, {@code INT} and {@code TERM} become
 * {@link ControlEvent#STOP}.
 *
 * <p>Handling {@code INT}/{@code TERM} replaces the JVM's default of running shutdown hooks; the
 * controller exits through the application context instead.
 */
@InterfaceLayer
@Component
public class SignalControlAdapter {
  private static final Logger log = LoggerFactory.getLogger(SignalControlAdapter.class);

  private final HandoffController controller;
  private final String reloadSignal;

  public SignalControlAdapter(HandoffController controller, BotProperties properties) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.reloadSignal = properties.handoff().reloadSignal();
  }

  /** Signal names mapped to the control events they trigger. */
  Map<String, ControlEvent> bindings() {
    Map<String, ControlEvent> map = new LinkedHashMap<>();
    map.put(reloadSignal, ControlEvent.RELOAD);
    map.putIfAbsent("INT", ControlEvent.STOP);
    map.putIfAbsent("TERM", ControlEvent.STOP);
    return map;
  }

  public void install() {
    bindings().forEach(this::install);
  }

  private void install(String name, ControlEvent event) {
    try {
      Signal.handle(
          new Signal(name),
          signal -> {
            log.info("[ircbot] received SIG{}", signal.getName());
            controller.submit(event);
          });
      log.debug("[ircbot] SIG{} -> {}", name, event);
    } catch (IllegalArgumentException e) {
      log.warn("[ircbot] cannot handle SIG{} on this platform: {}", name, e.getMessage());
    }
  }
}
