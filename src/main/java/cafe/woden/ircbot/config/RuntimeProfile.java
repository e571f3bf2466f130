package cafe.woden.ircbot.config;

import cafe.woden.ircbot.irc.ChannelSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link BotProfile} seeded from {@link BotProperties} and mutated in memory afterwards.
 *
 * <p>Changes are not written back to the configuration source.
 */
@Component
public class RuntimeProfile implements BotProfile {
  private static final Logger log = LoggerFactory.getLogger(RuntimeProfile.class);

  private final BotProperties.Profile props;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private String nickname;
  private String nickservPassword;
  private boolean logging;
  private final List<String> whitelist;

  public RuntimeProfile(BotProperties properties) {
    this.props = Objects.requireNonNull(properties, "properties").profile();
    this.nickname = props.nickname();
    this.nickservPassword = props.nickservPassword();
    this.logging = props.logging();
    this.whitelist = new ArrayList<>();
    for (String mask : props.whitelist()) {
      if (mask != null && !mask.isBlank()) whitelist.add(mask.trim());
    }
  }

  @Override
  public String address() {
    return props.address();
  }

  @Override
  public BotProperties.Tls tls() {
    return props.tls();
  }

  @Override
  public String nickname() {
    lock.readLock().lock();
    try {
      return nickname;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void setNickname(String value) {
    if (value == null || value.isBlank()) return;
    lock.writeLock().lock();
    try {
      log.info("[ircbot] nickname changed: {} -> {}", nickname, value.trim());
      nickname = value.trim();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public String nickservPassword() {
    lock.readLock().lock();
    try {
      return nickservPassword;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void setNickservPassword(String password) {
    lock.writeLock().lock();
    try {
      nickservPassword = Objects.toString(password, "");
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public String operPassword() {
    return props.operPassword();
  }

  @Override
  public String connectionPassword() {
    return props.connectionPassword();
  }

  @Override
  public String realName() {
    return props.realName();
  }

  @Override
  public String commandPrefix() {
    return props.commandPrefix();
  }

  @Override
  public List<ChannelSpec> channels() {
    return props.channels();
  }

  @Override
  public boolean isWhitelisted(String hostmask) {
    if (hostmask == null || hostmask.isBlank()) return false;
    String needle = hostmask.trim().toLowerCase(Locale.ROOT);
    lock.readLock().lock();
    try {
      for (String mask : whitelist) {
        if (mask.toLowerCase(Locale.ROOT).equals(needle)) return true;
      }
      return false;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<String> whitelist() {
    lock.readLock().lock();
    try {
      return List.copyOf(whitelist);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void whitelistAdd(String hostmask) {
    if (hostmask == null || hostmask.isBlank() || isWhitelisted(hostmask)) return;
    lock.writeLock().lock();
    try {
      whitelist.add(hostmask.trim());
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void whitelistRemove(String hostmask) {
    if (hostmask == null || hostmask.isBlank()) return;
    String needle = hostmask.trim();
    lock.writeLock().lock();
    try {
      whitelist.removeIf(mask -> mask.equalsIgnoreCase(needle));
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean isNick(String name) {
    return name != null && name.equalsIgnoreCase(nickname());
  }

  @Override
  public List<String> restartArgs() {
    return props.restartArgs();
  }

  @Override
  public boolean logging() {
    lock.readLock().lock();
    try {
      return logging;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void setLogging(boolean enabled) {
    lock.writeLock().lock();
    try {
      logging = enabled;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
