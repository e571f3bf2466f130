package cafe.woden.ircbot.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors and threads with readable names. */
public final class NamedThreads {

  private NamedThreads() {}

  /** Daemon thread factory producing {@code baseName-1}, {@code baseName-2}, ... */
  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  /** Unbounded pool; every submitted task gets a thread right away. */
  public static ExecutorService newCachedThreadPool(String baseName) {
    return Executors.newCachedThreadPool(namedFactory(baseName));
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  public static Thread start(String name, Runnable task) {
    Thread t = unstarted(name, task);
    t.start();
    return t;
  }

  public static Thread unstarted(String name, Runnable task) {
    Thread t = new Thread(task, normalize(name));
    t.setDaemon(true);
    return t;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircbot-thread" : s;
  }
}
