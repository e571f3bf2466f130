package cafe.woden.ircbot.handoff;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command line that starts this program again: java binary, JVM options, jar or class path with
 * main class, then the application arguments.
 */
public final class LaunchCommand {

  private final String javaBinary;
  private final List<String> jvmOptions;
  private final List<String> launchTarget;
  private final List<String> appArgs;

  LaunchCommand(
      String javaBinary, List<String> jvmOptions, List<String> launchTarget, List<String> appArgs) {
    this.javaBinary = Objects.requireNonNull(javaBinary, "javaBinary");
    this.jvmOptions = List.copyOf(jvmOptions);
    this.launchTarget = List.copyOf(launchTarget);
    this.appArgs = InheritedDescriptors.withoutForkOptions(appArgs);
  }

  /** The invocation of the running JVM with {@code appArgs} as program arguments. */
  public static LaunchCommand current(List<String> appArgs) {
    String java =
        ProcessHandle.current()
            .info()
            .command()
            .orElseGet(
                () -> Path.of(System.getProperty("java.home"), "bin", "java").toString());
    List<String> jvmOptions = ManagementFactory.getRuntimeMXBean().getInputArguments();
    return new LaunchCommand(java, jvmOptions, currentLaunchTarget(), appArgs);
  }

  static List<String> currentLaunchTarget() {
    String classPath = System.getProperty("java.class.path", "");
    String command = System.getProperty("sun.java.command", "").trim();
    String main = command.isEmpty() ? "" : command.split("\\s+")[0];

    if (!main.isEmpty()
        && main.endsWith(".jar")
        && !classPath.contains(File.pathSeparator)
        && Path.of(main).getFileName().equals(Path.of(classPath).getFileName())) {
      return List.of("-jar", classPath);
    }
    if (main.isEmpty()) {
      throw new IllegalStateException("cannot determine the main class of this JVM");
    }
    return List.of("-cp", classPath, main);
  }

  /** Full argv for a child inheriting {@code descriptorCount} descriptors. */
  public List<String> childArgv(int descriptorCount, byte[] bufferedInput) {
    List<String> argv = new ArrayList<>();
    argv.add(javaBinary);
    argv.addAll(jvmOptions);
    argv.addAll(launchTarget);
    argv.addAll(appArgs);
    argv.addAll(InheritedDescriptors.forkOptions(descriptorCount, bufferedInput));
    return argv;
  }

  @Override
  public String toString() {
    return String.join(" ", childArgv(0, null));
  }
}
