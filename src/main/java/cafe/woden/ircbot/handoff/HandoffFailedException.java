package cafe.woden.ircbot.handoff;

/** A handoff attempt failed; the current process keeps serving the connection. */
public class HandoffFailedException extends Exception {

  public HandoffFailedException(String message) {
    super(message);
  }

  public HandoffFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
