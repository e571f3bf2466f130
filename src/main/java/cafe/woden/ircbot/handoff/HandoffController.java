package cafe.woden.ircbot.handoff;

import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.util.NamedThreads;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Zero-downtime restart of the bot process.
 *
 * <p>A single control thread consumes {@link ControlEvent}s. {@code RELOAD} pauses the reader,
 * spawns a fresh copy of this program that inherits the socket, and leaves this process idle until
 * a {@code STOP} arrives (normally sent by the child once it has taken over). A failed handoff is
 * logged and the bot keeps running. {@code STOP} closes the connection and exits.
 */
@ApplicationLayer
@Component
public class HandoffController {
  private static final Logger log = LoggerFactory.getLogger(HandoffController.class);

  private final BotProperties.Handoff settings;
  private final InheritedDescriptors inherited;
  private final LaunchCommand launchCommand;
  private final ProcessLauncher launcher;
  private final ProcessExit processExit;

  private final BlockingQueue<ControlEvent> events = new LinkedBlockingQueue<>();
  private final AtomicReference<HandoffState> state = new AtomicReference<>(HandoffState.RUNNING);

  private volatile HandoffSource source;
  private volatile int exitStatus;
  private volatile boolean handedOff;
  private volatile Thread controlThread;

  public HandoffController(
      BotProperties properties,
      InheritedDescriptors inherited,
      LaunchCommand launchCommand,
      ProcessLauncher launcher,
      ProcessExit processExit) {
    this.settings = Objects.requireNonNull(properties, "properties").handoff();
    this.inherited = Objects.requireNonNull(inherited, "inherited");
    this.launchCommand = Objects.requireNonNull(launchCommand, "launchCommand");
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.processExit = Objects.requireNonNull(processExit, "processExit");
  }

  /**
   * Starts the control loop for {@code source}. A process that did not inherit its connection
   * hands it off once right away when {@code fork-on-first-run} is set, so the process that ends up
   * serving is never the one a supervisor launched.
   */
  public synchronized void start(HandoffSource source) {
    if (controlThread != null) throw new IllegalStateException("already started");
    this.source = Objects.requireNonNull(source, "source");
    // the only non-daemon thread; it keeps the JVM alive until STOP
    Thread t = NamedThreads.unstarted("ircbot-control", this::runLoop);
    t.setDaemon(false);
    controlThread = t;
    t.start();
    if (!inherited.inherited() && settings.enabled() && settings.forkOnFirstRun()) {
      log.info("[ircbot] fresh session; handing off once");
      submit(ControlEvent.RELOAD);
    }
  }

  /** Called in a child process once the inherited connection is in use. */
  public void onInheritedConnectionAdopted() {
    try {
      launcher.stopParent();
    } catch (HandoffFailedException e) {
      log.warn("[ircbot] could not stop the parent process: {}", e.getMessage());
    }
  }

  /** The read loop ended on its own. Stops with a failure status so a supervisor restarts us. */
  public void connectionLost() {
    exitStatus = 1;
    submit(ControlEvent.STOP);
  }

  public void submit(ControlEvent event) {
    Objects.requireNonNull(event, "event");
    log.debug("[ircbot] control event {}", event);
    events.offer(event);
  }

  public HandoffState state() {
    return state.get();
  }

  public boolean handedOff() {
    return handedOff;
  }

  private void runLoop() {
    log.info("[ircbot] waiting for control events");
    while (state.get() != HandoffState.TERMINATED) {
      ControlEvent event;
      try {
        event = events.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      try {
        handle(event);
      } catch (RuntimeException e) {
        log.error("[ircbot] control event {} failed", event, e);
      }
    }
  }

  void handle(ControlEvent event) {
    switch (event) {
      case RELOAD -> reload();
      case STOP -> stop();
    }
  }

  private void reload() {
    if (!settings.enabled()) {
      log.info("[ircbot] handoff is disabled; ignoring reload");
      return;
    }
    if (source == null) {
      log.warn("[ircbot] no connection to hand off yet; ignoring reload");
      return;
    }
    if (handedOff) {
      log.info("[ircbot] connection already handed off; waiting for stop");
      return;
    }
    if (!state.compareAndSet(HandoffState.RUNNING, HandoffState.HANDOFF_IN_PROGRESS)) {
      log.info("[ircbot] ignoring reload in state {}", state.get());
      return;
    }

    HandoffSource src = source;
    byte[] unconsumed = null;
    try {
      int fd = descriptorOf(src);
      unconsumed = src.quiesce(quiesceTimeout());
      HandoffRequest request =
          new HandoffRequest(launchCommand.childArgv(1, unconsumed), List.of(fd));
      long pid = launcher.spawn(request);
      src.markHandedOff();
      handedOff = true;
      log.info("[ircbot] connection handed off to pid {}", pid);
    } catch (HandoffFailedException e) {
      log.warn("[ircbot] handoff failed; keeping the connection", e);
      src.resume(unconsumed);
    } finally {
      state.compareAndSet(HandoffState.HANDOFF_IN_PROGRESS, HandoffState.RUNNING);
    }
  }

  private void stop() {
    HandoffState previous = state.getAndSet(HandoffState.TERMINATED);
    if (previous == HandoffState.TERMINATED) return;
    log.info("[ircbot] stopping");
    HandoffSource src = source;
    if (src != null) src.close();
    processExit.exit(exitStatus);
  }

  private static int descriptorOf(HandoffSource src) throws HandoffFailedException {
    try {
      return src.descriptor();
    } catch (IOException e) {
      throw new HandoffFailedException("cannot obtain the connection descriptor", e);
    }
  }

  private Duration quiesceTimeout() {
    return settings.quiesceTimeout();
  }

  @PreDestroy
  void shutdown() {
    Thread t = controlThread;
    if (t != null && t != Thread.currentThread()) t.interrupt();
  }
}
