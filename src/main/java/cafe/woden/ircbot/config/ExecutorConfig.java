package cafe.woden.ircbot.config;

import cafe.woden.ircbot.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>These remain workload-specific so a stuck command handler can never starve plugin delivery or
 * the connection watchdog, while giving Spring ownership of creation/shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String COMMAND_EXECUTOR = "commandExecutor";
  public static final String PLUGIN_EXECUTOR = "pluginExecutor";
  public static final String CONNECTION_WATCHDOG_SCHEDULER = "connectionWatchdogScheduler";

  @Bean(name = COMMAND_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService commandExecutor() {
    return NamedThreads.newCachedThreadPool("ircbot-command");
  }

  @Bean(name = PLUGIN_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService pluginExecutor() {
    return NamedThreads.newCachedThreadPool("ircbot-plugin");
  }

  @Bean(name = CONNECTION_WATCHDOG_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService connectionWatchdogScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircbot-deadline");
  }
}
