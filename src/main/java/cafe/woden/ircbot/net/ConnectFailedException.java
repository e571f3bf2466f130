package cafe.woden.ircbot.net;

import java.io.IOException;

/** Dialing, adopting or securing a server connection failed. */
public class ConnectFailedException extends IOException {
  public ConnectFailedException(String message) {
    super(message);
  }

  public ConnectFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
