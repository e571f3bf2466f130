package cafe.woden.ircbot.handoff;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** Starts child processes that inherit open descriptors, and retires the parent afterwards. */
@ApplicationLayer
public interface ProcessLauncher {

  /** @return the child's pid */
  long spawn(HandoffRequest request) throws HandoffFailedException;

  /** Asks the process that spawned this one to shut down gracefully. */
  void stopParent() throws HandoffFailedException;
}
