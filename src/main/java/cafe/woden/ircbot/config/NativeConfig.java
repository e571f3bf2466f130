package cafe.woden.ircbot.config;

import jnr.posix.POSIX;
import jnr.posix.POSIXFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** libc bindings shared by descriptor adoption and child spawning. */
@Configuration
public class NativeConfig {
  private static final Logger log = LoggerFactory.getLogger(NativeConfig.class);

  @Bean
  public POSIX posix() {
    POSIX posix = POSIXFactory.getPOSIX();
    if (!posix.isNative()) {
      log.warn("[ircbot] native POSIX support unavailable; process handoff will not work");
    }
    return posix;
  }
}
