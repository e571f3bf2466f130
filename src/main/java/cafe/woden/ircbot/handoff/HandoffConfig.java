package cafe.woden.ircbot.handoff;

import cafe.woden.ircbot.config.BotProfile;
import java.util.Arrays;
import java.util.List;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HandoffConfig {

  @Bean
  public InheritedDescriptors inheritedDescriptors(ApplicationArguments args) {
    return InheritedDescriptors.parse(args.getSourceArgs());
  }

  /** Restart arguments from the profile win over the arguments of this invocation. */
  @Bean
  public LaunchCommand launchCommand(BotProfile profile, ApplicationArguments args) {
    List<String> appArgs = profile.restartArgs();
    if (appArgs.isEmpty()) appArgs = Arrays.asList(args.getSourceArgs());
    return LaunchCommand.current(appArgs);
  }
}
