package cafe.woden.ircbot.util;

import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;

/**
 * Lightweight build/version helper.
 *
 * <p>We try (in order):
 *
 * <ol>
 *   <li>Spring Boot build info: META-INF/build-info.properties (build.version)
 *   <li>Jar manifest: Implementation-Version
 *   <li>System property: ircbot.version
 * </ol>
 */
public final class AppVersion {

  public static final String APP_NAME = "IRCafe Bot";

  private static final Instant STARTED_AT =
      ProcessHandle.current().info().startInstant().orElseGet(Instant::now);

  private static volatile String cachedVersion;

  private AppVersion() {}

  /** Returns the build/version string, or null if unknown. */
  public static String version() {
    String v = cachedVersion;
    if (v != null) return v;

    v = readBuildInfoVersion();
    if (v == null || v.isBlank()) v = readManifestVersion();
    if (v == null || v.isBlank()) v = System.getProperty("ircbot.version");

    if (v != null) v = v.trim();
    cachedVersion = v;
    return v;
  }

  public static String appNameWithVersion() {
    String v = version();
    if (v == null || v.isBlank()) return APP_NAME;
    return APP_NAME + " " + v;
  }

  /** Time since this process (not the whole handoff chain) started. */
  public static Duration uptime() {
    return Duration.between(STARTED_AT, Instant.now());
  }

  private static String readBuildInfoVersion() {
    try (InputStream in =
        AppVersion.class.getClassLoader().getResourceAsStream("META-INF/build-info.properties")) {
      if (in == null) return null;

      Properties p = new Properties();
      p.load(in);
      String v = p.getProperty("build.version");
      return (v == null) ? null : v.trim();
    } catch (Exception ignored) {
      return null;
    }
  }

  private static String readManifestVersion() {
    Package pkg = AppVersion.class.getPackage();
    return pkg == null ? null : pkg.getImplementationVersion();
  }
}
