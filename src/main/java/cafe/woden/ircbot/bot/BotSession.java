package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.handoff.HandoffFailedException;
import cafe.woden.ircbot.handoff.HandoffSource;
import cafe.woden.ircbot.handoff.InheritedDescriptors;
import cafe.woden.ircbot.irc.IrcCommands;
import cafe.woden.ircbot.net.ConnectFailedException;
import cafe.woden.ircbot.net.ConnectionClosedException;
import cafe.woden.ircbot.net.ConnectionWatchdog;
import cafe.woden.ircbot.net.IrcConnection;
import cafe.woden.ircbot.net.IrcConnector;
import cafe.woden.ircbot.net.ServerAddress;
import cafe.woden.ircbot.util.NamedThreads;
import io.reactivex.rxjava3.disposables.Disposable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the server connection of this process and its read loop.
 *
 * <p>The read loop can be paused at a line boundary for a handoff. A PING goes out when pausing so
 * that a reader blocked on a quiet connection wakes up with the reply.
 */
@ApplicationLayer
@Component
public class BotSession implements HandoffSource {
  private static final Logger log = LoggerFactory.getLogger(BotSession.class);

  static final String READ_LOOP_THREAD = "ircbot-read-loop";
  static final String QUIESCE_TOKEN = "ircbot-handoff";

  private final IrcConnector connector;
  private final ConnectionWatchdog watchdog;
  private final InboundRouter router;
  private final BotProfile profile;
  private final InheritedDescriptors inherited;

  private final Object pauseMonitor = new Object();
  // guarded by pauseMonitor
  private boolean pauseRequested;
  private boolean paused;

  private volatile IrcConnection connection;
  private volatile Disposable watch;
  private volatile Thread reader;
  private volatile boolean closing;

  public BotSession(
      IrcConnector connector,
      ConnectionWatchdog watchdog,
      InboundRouter router,
      BotProfile profile,
      InheritedDescriptors inherited) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    this.router = Objects.requireNonNull(router, "router");
    this.profile = Objects.requireNonNull(profile, "profile");
    this.inherited = Objects.requireNonNull(inherited, "inherited");
  }

  /**
   * Adopts the inherited connection, or dials the server and registers.
   *
   * @return true when the connection was inherited from a parent process
   */
  public boolean open() throws ConnectFailedException {
    if (connection != null) throw new IllegalStateException("already open");
    ServerAddress address = ServerAddress.parse(profile.address());

    if (inherited.inherited()) {
      List<Integer> slots = inherited.slots();
      log.info("[ircbot] inheriting connection to {}", address);
      IrcConnection conn = connector.adopt(slots.get(0), address, profile.tls());
      conn.prependInput(inherited.bufferedInput());
      connection = conn;
      for (int fd : slots.subList(1, slots.size())) {
        closeExtraDescriptor(fd, address);
      }
      return true;
    }

    log.info("[ircbot] opening new connection to {}", address);
    IrcConnection conn = connector.dial(address, profile.tls());
    try {
      IrcCommands.pass(conn, profile.connectionPassword());
      IrcCommands.user(conn, profile.nickname(), "8", profile.realName());
      IrcCommands.nick(conn, profile.nickname(), profile.nickservPassword());
    } catch (IOException e) {
      conn.close("registration failed");
      throw new ConnectFailedException("registration with " + address + " failed", e);
    }
    connection = conn;
    return false;
  }

  /** Only the first inherited slot carries the server connection; the rest are closed. */
  private void closeExtraDescriptor(int fd, ServerAddress address) {
    try {
      IrcConnection extra = connector.adopt(fd, address, BotProperties.Tls.NONE);
      log.warn("[ircbot] closing unexpected inherited descriptor {}", fd);
      extra.close("unexpected inherited descriptor");
    } catch (ConnectFailedException e) {
      log.warn("[ircbot] cannot adopt inherited descriptor {}", fd, e);
    }
  }

  /** Starts the read loop; {@code onConnectionLost} runs when it ends other than by close. */
  public void start(Runnable onConnectionLost) {
    IrcConnection conn = requireConnection();
    Objects.requireNonNull(onConnectionLost, "onConnectionLost");
    watch = watchdog.watch(conn);
    reader = NamedThreads.start(READ_LOOP_THREAD, () -> readLoop(conn, onConnectionLost));
  }

  public IrcConnection connection() {
    return connection;
  }

  private void readLoop(IrcConnection conn, Runnable onConnectionLost) {
    log.info("[ircbot] entering read loop");
    try {
      while (true) {
        awaitResume();
        String line = conn.readLine();
        route(conn, line);
      }
    } catch (ConnectionClosedException e) {
      if (!closing) log.warn("[ircbot] connection lost: {}", e.getMessage());
    } catch (IOException e) {
      if (!closing) log.error("[ircbot] read failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      disposeWatch();
      if (!conn.isHandedOff()) conn.close("read loop ended");
      if (!closing) onConnectionLost.run();
    }
  }

  private void route(IrcConnection conn, String line) {
    try {
      router.route(conn, line);
    } catch (IOException e) {
      log.warn("[ircbot] reply failed for line: {}", line, e);
    } catch (RuntimeException e) {
      log.warn("[ircbot] failed to handle line: {}", line, e);
    }
  }

  private void awaitResume() throws InterruptedException {
    synchronized (pauseMonitor) {
      while (pauseRequested && !closing) {
        if (!paused) {
          paused = true;
          pauseMonitor.notifyAll();
        }
        pauseMonitor.wait();
      }
      paused = false;
    }
  }

  @Override
  public int descriptor() throws IOException {
    return requireConnection().descriptor();
  }

  @Override
  public byte[] quiesce(Duration timeout) throws HandoffFailedException {
    IrcConnection conn = requireConnection();
    Thread r = reader;
    if (r == null || !r.isAlive()) throw new HandoffFailedException("read loop is not running");

    synchronized (pauseMonitor) {
      pauseRequested = true;
    }
    try {
      IrcCommands.ping(conn, QUIESCE_TOKEN);
    } catch (IOException e) {
      resume(null);
      throw new HandoffFailedException("cannot wake the read loop", e);
    }

    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (pauseMonitor) {
      while (!paused) {
        long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
        if (remainingMs <= 0 || !r.isAlive()) {
          pauseRequested = false;
          pauseMonitor.notifyAll();
          throw new HandoffFailedException("read loop did not pause within " + timeout);
        }
        try {
          pauseMonitor.wait(remainingMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          pauseRequested = false;
          pauseMonitor.notifyAll();
          throw new HandoffFailedException("interrupted while pausing the read loop", e);
        }
      }
    }
    byte[] unconsumed = conn.takeBufferedInput();
    log.debug("[ircbot] read loop paused with {} buffered bytes", unconsumed.length);
    return unconsumed;
  }

  @Override
  public void resume(byte[] unconsumedInput) {
    IrcConnection conn = connection;
    if (conn != null) conn.prependInput(unconsumedInput);
    synchronized (pauseMonitor) {
      pauseRequested = false;
      paused = false;
      pauseMonitor.notifyAll();
    }
  }

  @Override
  public void markHandedOff() {
    requireConnection().markHandedOff();
    disposeWatch();
  }

  @Override
  public void close() {
    closing = true;
    synchronized (pauseMonitor) {
      pauseMonitor.notifyAll();
    }
    disposeWatch();
    IrcConnection conn = connection;
    if (conn != null) conn.close("shutting down");
  }

  private void disposeWatch() {
    Disposable d = watch;
    if (d != null && !d.isDisposed()) d.dispose();
  }

  private IrcConnection requireConnection() {
    IrcConnection conn = connection;
    if (conn == null) throw new IllegalStateException("connection is not open");
    return conn;
  }
}
