package cafe.woden.ircbot.handoff;

public enum HandoffState {
  RUNNING,
  HANDOFF_IN_PROGRESS,
  TERMINATED
}
