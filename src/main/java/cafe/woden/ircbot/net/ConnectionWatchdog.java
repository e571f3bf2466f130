package cafe.woden.ircbot.net;

import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Enforces the idle deadline of a connection.
 *
 * <p>A blocked read does not notice the deadline by itself; closing the connection wakes it up.
 */
@InfrastructureLayer
@Component
public class ConnectionWatchdog {
  private static final Logger log = LoggerFactory.getLogger(ConnectionWatchdog.class);

  private final Scheduler scheduler;
  private final long periodMs;

  public ConnectionWatchdog(
      BotProperties properties,
      @Qualifier(ExecutorConfig.CONNECTION_WATCHDOG_SCHEDULER) ScheduledExecutorService exec) {
    this.scheduler = Schedulers.from(Objects.requireNonNull(exec, "exec"));
    this.periodMs = properties.connection().watchdogPeriod().toMillis();
  }

  /** Starts watching; dispose the result when the connection is gone. */
  public Disposable watch(IrcConnection connection) {
    Objects.requireNonNull(connection, "connection");
    return Flowable.interval(periodMs, periodMs, TimeUnit.MILLISECONDS, scheduler)
        .takeUntil((Long tick) -> connection.isClosed())
        .subscribe(
            tick -> check(connection),
            err -> log.debug("[ircbot] watchdog ticker error for {}", connection, err));
  }

  private void check(IrcConnection connection) {
    if (connection.isClosed() || !connection.idleExpired()) return;
    log.warn("[ircbot] no traffic on {} within the idle timeout; closing", connection);
    connection.close("idle timeout");
  }
}
