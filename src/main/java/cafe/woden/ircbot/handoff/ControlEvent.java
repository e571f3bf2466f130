package cafe.woden.ircbot.handoff;

/** Requests consumed by the {@link HandoffController} loop. */
public enum ControlEvent {
  /** Re-exec this program and pass it the connection. */
  RELOAD,
  /** Close the connection and exit. */
  STOP
}
