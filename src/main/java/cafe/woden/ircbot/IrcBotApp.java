package cafe.woden.ircbot;

import cafe.woden.ircbot.bot.BotSession;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.handoff.HandoffController;
import cafe.woden.ircbot.handoff.ProcessExit;
import cafe.woden.ircbot.handoff.SignalControlAdapter;
import cafe.woden.ircbot.net.ConnectFailedException;
import cafe.woden.ircbot.plugin.PluginHost;
import cafe.woden.ircbot.util.AppVersion;
import cafe.woden.ircbot.util.FatalErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "IRCafe Bot",
    sharedModules = {"config", "irc", "util"})
@EnableConfigurationProperties(BotProperties.class)
public class IrcBotApp {
  private static final Logger log = LoggerFactory.getLogger(IrcBotApp.class);

  public static void main(String[] args) {
    FatalErrors.install();
    SpringApplication.run(IrcBotApp.class, args);
  }

  /**
   * Startup order: plugins, connection, read loop, then the control loop. A child process tells its
   * parent to stop only after it owns the connection.
   */
  @Bean
  public ApplicationRunner run(
      PluginHost plugins,
      BotSession session,
      HandoffController handoff,
      SignalControlAdapter signals,
      ProcessExit processExit) {
    return args -> {
      log.info("[ircbot] starting {} (pid {})", AppVersion.appNameWithVersion(),
          ProcessHandle.current().pid());
      plugins.loadAll();

      boolean adopted;
      try {
        adopted = session.open();
      } catch (ConnectFailedException e) {
        log.error("[ircbot] {}", e.getMessage(), e);
        processExit.exit(1);
        return;
      }

      signals.install();
      session.start(handoff::connectionLost);
      handoff.start(session);
      if (adopted) handoff.onInheritedConnectionAdopted();
    };
  }
}
