package cafe.woden.ircbot.handoff;

import java.io.IOException;
import java.time.Duration;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** The connection owner as seen by the {@link HandoffController}. */
@ApplicationLayer
public interface HandoffSource {

  /** OS descriptor of the live socket. */
  int descriptor() throws IOException;

  /**
   * Stops reading at the next line boundary.
   *
   * @return bytes already read from the socket that no line was handed out for yet
   * @throws HandoffFailedException if the reader did not pause within {@code timeout}; reading
   *     continues in that case
   */
  byte[] quiesce(Duration timeout) throws HandoffFailedException;

  /** Undoes {@link #quiesce}, putting {@code unconsumedInput} back in front of the stream. */
  void resume(byte[] unconsumedInput);

  /** The socket now belongs to a child process. */
  void markHandedOff();

  /** Closes the connection for good. */
  void close();
}
