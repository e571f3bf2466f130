package cafe.woden.ircbot.handoff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import jnr.constants.platform.Fcntl;
import jnr.posix.POSIX;
import jnr.posix.SpawnFileAction;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Spawns the child with {@code posix_spawnp}, mapping the inherited descriptors to 3, 4, ...
 *
 * <p>Sources are first copied to scratch slots above every source and target so that placing one
 * descriptor never clobbers another that is still to be moved. The originals get close-on-exec,
 * leaving the child exactly one copy of each socket.
 */
@InfrastructureLayer
@Component
class JnrProcessLauncher implements ProcessLauncher {
  private static final Logger log = LoggerFactory.getLogger(JnrProcessLauncher.class);

  private static final int FD_CLOEXEC = 1;

  private final POSIX posix;

  JnrProcessLauncher(POSIX posix) {
    this.posix = Objects.requireNonNull(posix, "posix");
  }

  @Override
  public long spawn(HandoffRequest request) throws HandoffFailedException {
    if (!posix.isNative()) {
      throw new HandoffFailedException("native process support is unavailable");
    }
    List<Integer> sources = request.inheritedDescriptors();
    for (int fd : sources) {
      if (posix.fcntlInt(fd, Fcntl.F_SETFD, FD_CLOEXEC) < 0) {
        throw new HandoffFailedException(
            "descriptor " + fd + " is not usable (errno " + posix.errno() + ")");
      }
    }

    List<String> argv = request.childArgv();
    long pid = posix.posix_spawnp(argv.get(0), fileActions(sources), argv, environment());
    if (pid <= 0) {
      throw new HandoffFailedException(
          "posix_spawnp " + argv.get(0) + " failed (errno " + posix.errno() + ")");
    }
    log.debug("[ircbot] spawned {} as pid {}", argv, pid);
    return pid;
  }

  @Override
  public void stopParent() throws HandoffFailedException {
    ProcessHandle parent =
        ProcessHandle.current()
            .parent()
            .orElseThrow(() -> new HandoffFailedException("parent process is gone"));
    if (!parent.destroy()) {
      throw new HandoffFailedException("cannot signal parent process " + parent.pid());
    }
    log.info("[ircbot] asked parent process {} to stop", parent.pid());
  }

  static List<SpawnFileAction> fileActions(List<Integer> sources) {
    List<SpawnFileAction> actions = new ArrayList<>();
    if (sources.isEmpty()) return actions;

    int lastTarget = InheritedDescriptors.FIRST_SLOT + sources.size() - 1;
    int scratch = Math.max(Collections.max(sources), lastTarget) + 1;
    for (int i = 0; i < sources.size(); i++) {
      actions.add(SpawnFileAction.dup(sources.get(i), scratch + i));
    }
    for (int i = 0; i < sources.size(); i++) {
      actions.add(SpawnFileAction.dup(scratch + i, InheritedDescriptors.FIRST_SLOT + i));
      actions.add(SpawnFileAction.close(scratch + i));
    }
    return actions;
  }

  private static List<String> environment() {
    List<String> env = new ArrayList<>();
    for (Map.Entry<String, String> e : System.getenv().entrySet()) {
      env.add(e.getKey() + "=" + e.getValue());
    }
    return env;
  }
}
