package cafe.woden.ircbot.net;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;
import jnr.enxio.channels.NativeSocketChannel;

/**
 * {@link SocketTransport} over a descriptor inherited from a parent process.
 *
 * <p>The JDK cannot wrap a raw descriptor in a socket channel, so I/O goes straight to libc through
 * jnr-enxio.
 */
final class InheritedSocketTransport implements SocketTransport {

  private final NativeSocketChannel channel;
  private final AtomicBoolean released = new AtomicBoolean(false);

  InheritedSocketTransport(NativeSocketChannel channel) {
    this.channel = channel;
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    return channel.read(dst);
  }

  @Override
  public int write(ByteBuffer src) throws IOException {
    return channel.write(src);
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen() && !released.get();
  }

  /** Shuts the socket down first; a plain close(2) would not wake a blocked reader. */
  @Override
  public void close() throws IOException {
    try {
      channel.shutdownInput();
      channel.shutdownOutput();
    } finally {
      channel.close();
    }
  }

  @Override
  public void release() {
    released.set(true);
  }

  @Override
  public int descriptor() {
    return channel.getFD();
  }

  @Override
  public String toString() {
    return "InheritedSocketTransport[fd=" + channel.getFD() + "]";
  }
}
