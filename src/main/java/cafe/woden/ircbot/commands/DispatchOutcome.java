package cafe.woden.ircbot.commands;

/** What {@link CommandRegistry#dispatchOutcome} did with an event. */
public enum DispatchOutcome {
  /** Not a command for this registry: wrong prefix, no name, or unknown command. */
  IGNORED,
  ACCESS_DENIED,
  MISSING_PARAMETERS,
  INVALID_PARAMETER,
  /** Handler submitted to the executor. */
  DISPATCHED
}
