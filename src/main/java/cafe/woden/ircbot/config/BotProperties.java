package cafe.woden.ircbot.config;

import cafe.woden.ircbot.irc.ChannelSpec;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bot configuration.
 *
 * <p>Example YAML:
 *
 * <pre>
 * ircbot:
 *   profile:
 *     address: irc.libera.chat:6697
 *     nickname: ircafe_bot
 *     command-prefix: "!"
 *     tls:
 *       cert: /etc/ircbot/client.pem
 *       key: /etc/ircbot/client.key
 * </pre>
 */
@ConfigurationProperties(prefix = "ircbot")
public record BotProperties(Profile profile, Connection connection, Handoff handoff) {

  public BotProperties {
    if (profile == null) {
      profile =
          new Profile(null, null, null, null, null, null, null, false, null, null, null, null);
    }
    if (connection == null) {
      connection = new Connection(null, null, null);
    }
    if (handoff == null) {
      handoff = new Handoff(null, null, null, null);
    }
  }

  /** Identity, credentials and startup behavior of the bot. */
  public record Profile(
      String address,
      String nickname,
      String nickservPassword,
      String operPassword,
      String connectionPassword,
      String commandPrefix,
      List<String> whitelist,
      boolean logging,
      List<ChannelSpec> channels,
      /**
       * Application arguments passed to a handed-off child process.
       *
       * <p>If empty, the arguments of the current invocation are reused.
       */
      List<String> restartArgs,
      Tls tls,
      String realName) {

    public Profile {
      if (address == null || address.isBlank()) address = "localhost:6667";
      if (nickname == null || nickname.isBlank()) nickname = "ircafe_bot";
      if (nickservPassword == null) nickservPassword = "";
      if (operPassword == null) operPassword = "";
      if (connectionPassword == null) connectionPassword = "";
      if (commandPrefix == null || commandPrefix.isEmpty()) commandPrefix = "!";
      whitelist = (whitelist == null) ? List.of() : List.copyOf(whitelist);
      channels = (channels == null) ? List.of() : List.copyOf(channels);
      restartArgs = (restartArgs == null) ? List.of() : List.copyOf(restartArgs);
      if (tls == null) tls = Tls.NONE;
      if (realName == null || realName.isBlank()) realName = nickname;
    }
  }

  /**
   * TLS material for the server connection.
   *
   * <p>TLS is active when {@code enabled} is set or a client certificate and key are configured.
   * {@code caPem} optionally replaces the JVM trust store with the given PEM bundle.
   */
  public record Tls(
      boolean enabled, String cert, String key, String caPem, boolean trustAllCertificates) {
    /** Plain TCP. */
    public static final Tls NONE = new Tls(false, null, null, null, false);

    public Tls {
      if (cert == null) cert = "";
      if (key == null) key = "";
      if (caPem == null) caPem = "";
    }

    public boolean active() {
      return enabled || hasClientCertificate();
    }

    public boolean hasClientCertificate() {
      return !cert.isBlank() && !key.isBlank();
    }
  }

  /**
   * Socket timing. Every successful read or write pushes the idle deadline {@code idleTimeout}
   * ahead; the watchdog checks it every {@code watchdogPeriod}.
   */
  public record Connection(Duration idleTimeout, Duration watchdogPeriod, Duration connectTimeout) {
    public Connection {
      if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
        idleTimeout = Duration.ofMinutes(10);
      }
      if (watchdogPeriod == null || watchdogPeriod.isNegative() || watchdogPeriod.isZero()) {
        watchdogPeriod = Duration.ofSeconds(15);
      }
      if (watchdogPeriod.compareTo(idleTimeout) > 0) watchdogPeriod = idleTimeout;
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
        connectTimeout = Duration.ofSeconds(30);
      }
    }
  }

  /**
   * Zero-downtime restart. {@code reloadSignal} names the OS signal (without {@code SIG}) that
   * starts a handoff; {@code quiesceTimeout} bounds the wait for the read loop to pause.
   */
  public record Handoff(
      Boolean enabled, Boolean forkOnFirstRun, String reloadSignal, Duration quiesceTimeout) {
    public Handoff {
      if (enabled == null) enabled = Boolean.TRUE;
      if (forkOnFirstRun == null) forkOnFirstRun = Boolean.TRUE;
      if (reloadSignal == null || reloadSignal.isBlank()) reloadSignal = "USR1";
      reloadSignal = reloadSignal.trim();
      if (reloadSignal.startsWith("SIG")) reloadSignal = reloadSignal.substring(3);
      if (quiesceTimeout == null || quiesceTimeout.isNegative() || quiesceTimeout.isZero()) {
        quiesceTimeout = Duration.ofSeconds(30);
      }
    }
  }
}
