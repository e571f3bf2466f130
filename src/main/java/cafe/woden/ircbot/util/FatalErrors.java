package cafe.woden.ircbot.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide uncaught exception policy.
 *
 * <p>A {@link VirtualMachineError} escaping any thread halts the process; the state of the JVM is
 * not trustworthy after one. Everything else is logged and the thread dies alone.
 */
public final class FatalErrors {
  private static final Logger log = LoggerFactory.getLogger(FatalErrors.class);

  static final int FATAL_EXIT_STATUS = 70;

  private FatalErrors() {}

  public static void install() {
    Thread.setDefaultUncaughtExceptionHandler(FatalErrors::uncaught);
  }

  static void uncaught(Thread thread, Throwable error) {
    if (error instanceof VirtualMachineError) {
      try {
        log.error("[ircbot] fatal error in thread {}; halting", thread.getName(), error);
      } finally {
        Runtime.getRuntime().halt(FATAL_EXIT_STATUS);
      }
      return;
    }
    log.error("[ircbot] uncaught exception in thread {}", thread.getName(), error);
  }
}
