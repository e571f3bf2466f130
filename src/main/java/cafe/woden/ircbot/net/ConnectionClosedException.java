package cafe.woden.ircbot.net;

import java.io.IOException;

/**
 * The connection is gone: the peer closed it, it was closed locally, its idle deadline passed, or
 * it was handed off to another process.
 */
public class ConnectionClosedException extends IOException {
  public ConnectionClosedException(String message) {
    super(message);
  }

  public ConnectionClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
