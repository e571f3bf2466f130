package cafe.woden.ircbot.commands;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.config.ExecutorConfig;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** The bot's own command registry, authorized against the profile whitelist. */
@Configuration
public class CommandsConfig {

  @Bean
  public CommandRegistry coreCommandRegistry(
      BotProfile profile,
      @Qualifier(ExecutorConfig.COMMAND_EXECUTOR) ExecutorService commandExecutor) {
    return new CommandRegistry(profile.commandPrefix(), profile::isWhitelisted, commandExecutor);
  }
}
