package cafe.woden.ircbot;

import cafe.woden.ircbot.handoff.ProcessExit;
import cafe.woden.ircbot.util.NamedThreads;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.AbstractApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the Spring context (plugins unload, executors stop) and then exits the JVM with the
 * requested status.
 */
@Component
public class ApplicationShutdownCoordinator implements ProcessExit {
  private static final Logger log = LoggerFactory.getLogger(ApplicationShutdownCoordinator.class);

  // Hard-stop fallback in case a bean hangs while the context closes.
  private static final long SHUTDOWN_WATCHDOG_MS = 8000L;

  private final ConfigurableApplicationContext applicationContext;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  public ApplicationShutdownCoordinator(ConfigurableApplicationContext applicationContext) {
    this.applicationContext = applicationContext;
  }

  @Override
  public void exit(int status) {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return;
    }
    log.info("[ircbot] shutting down with status {}", status);

    NamedThreads.start(
        "ircbot-shutdown-watchdog",
        () -> {
          try {
            Thread.sleep(SHUTDOWN_WATCHDOG_MS);
          } catch (InterruptedException ignored) {
            return;
          }
          log.error(
              "[ircbot] shutdown watchdog fired after {}ms; forcing JVM halt.",
              SHUTDOWN_WATCHDOG_MS);
          Runtime.getRuntime().halt(status == 0 ? 1 : status);
        });

    Thread shutdown =
        NamedThreads.unstarted(
            "ircbot-shutdown",
            () -> {
              int exitCode = status;
              try {
                if (isApplicationContextAlreadyClosed()) {
                  log.debug("[ircbot] Spring context already closed before exit call.");
                } else {
                  int contextCode = SpringApplication.exit(applicationContext, () -> status);
                  if (exitCode == 0) exitCode = contextCode;
                }
              } catch (IllegalStateException ise) {
                if (isAlreadyClosedException(ise)) {
                  log.debug("[ircbot] Spring context already closed during shutdown.", ise);
                } else {
                  log.warn("[ircbot] error while closing Spring context", ise);
                  if (exitCode == 0) exitCode = 1;
                }
              } catch (RuntimeException e) {
                log.warn("[ircbot] error while closing Spring context", e);
                if (exitCode == 0) exitCode = 1;
              }
              System.exit(exitCode);
            });
    shutdown.setDaemon(false);
    shutdown.start();
  }

  private boolean isApplicationContextAlreadyClosed() {
    if (applicationContext instanceof AbstractApplicationContext ac) {
      return !ac.isActive();
    }
    return false;
  }

  private static boolean isAlreadyClosedException(IllegalStateException ex) {
    String msg = ex == null ? "" : String.valueOf(ex.getMessage());
    msg = msg.toLowerCase(Locale.ROOT);
    return msg.contains("has been closed already")
        || msg.contains("beanfactory not initialized or already closed");
  }
}
