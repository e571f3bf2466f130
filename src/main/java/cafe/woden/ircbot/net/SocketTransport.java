package cafe.woden.ircbot.net;

import java.io.IOException;
import java.nio.channels.ByteChannel;

/**
 * A connected, blocking socket exposed as a byte channel.
 *
 * <p>{@link #close()} tears the socket down and wakes a thread blocked in {@link #read}. {@link
 * #release()} only gives up this process's descriptor and leaves the socket itself untouched, which
 * is what a process does after handing the socket to a child.
 */
public interface SocketTransport extends ByteChannel {

  /** OS descriptor number of the socket. */
  int descriptor() throws IOException;

  void release() throws IOException;
}
