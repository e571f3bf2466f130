package cafe.woden.ircbot.net;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SocketTransport} over a JDK {@link SocketChannel} in blocking mode.
 *
 * <p>Reading the descriptor number relies on the JDK-internal {@code sun.nio.ch.SelChImpl}; the
 * launcher has to open {@code java.base/sun.nio.ch} to this application (the executable jar's
 * manifest does so through {@code Add-Opens}).
 */
final class JdkSocketTransport implements SocketTransport {

  private final SocketChannel channel;
  private final AtomicBoolean released = new AtomicBoolean(false);

  JdkSocketTransport(SocketChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
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

  @Override
  public void close() throws IOException {
    channel.close();
  }

  /**
   * Forgets the channel without closing it.
   *
   * <p>Closing a JDK socket channel while another thread is still inside a blocking call shuts
   * down its output side, which would also hit the child holding the same socket. The descriptor
   * is left to be reclaimed when this process exits.
   */
  @Override
  public void release() {
    released.set(true);
  }

  @Override
  public int descriptor() throws IOException {
    try {
      Class<?> selectable = Class.forName("sun.nio.ch.SelChImpl");
      Method getFdVal = selectable.getMethod("getFDVal");
      return (Integer) getFdVal.invoke(channel);
    } catch (ClassNotFoundException | NoSuchMethodException e) {
      throw new IOException("socket descriptors are not available on this JDK", e);
    } catch (IllegalAccessException | RuntimeException e) {
      throw new IOException(
          "cannot read socket descriptor; start the JVM with "
              + "--add-opens java.base/sun.nio.ch=ALL-UNNAMED",
          e);
    } catch (InvocationTargetException e) {
      throw new IOException("cannot read socket descriptor", e.getCause());
    }
  }

  @Override
  public String toString() {
    try {
      return "JdkSocketTransport[" + channel.getRemoteAddress() + "]";
    } catch (IOException e) {
      return "JdkSocketTransport[closed]";
    }
  }
}
