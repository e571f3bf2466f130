package cafe.woden.ircbot.net;

import java.io.IOException;
import java.util.Objects;
import jnr.constants.platform.Fcntl;
import jnr.constants.platform.OpenFlags;
import jnr.enxio.channels.NativeSocketChannel;
import jnr.posix.POSIX;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link DescriptorSupport} backed by libc through jnr-posix and jnr-enxio.
 *
 * <p>The parent's JDK channel may have switched the socket to non-blocking mode, and that flag
 * travels with the open file description. It is cleared here so the blocking read loop works.
 */
@InfrastructureLayer
@Component
class JnrDescriptorSupport implements DescriptorSupport {
  private static final Logger log = LoggerFactory.getLogger(JnrDescriptorSupport.class);

  private final POSIX posix;

  JnrDescriptorSupport(POSIX posix) {
    this.posix = Objects.requireNonNull(posix, "posix");
  }

  @Override
  public SocketTransport adopt(int descriptor) throws IOException {
    if (descriptor < 0) throw new IOException("invalid descriptor " + descriptor);
    if (!posix.isNative()) {
      throw new IOException("cannot adopt descriptor " + descriptor + ": no native POSIX support");
    }

    int flags = posix.fcntl(descriptor, Fcntl.F_GETFL);
    if (flags < 0) {
      throw new IOException(
          "descriptor " + descriptor + " is not open (errno " + posix.errno() + ")");
    }
    int nonBlock = OpenFlags.O_NONBLOCK.intValue();
    if ((flags & nonBlock) != 0) {
      if (posix.fcntlInt(descriptor, Fcntl.F_SETFL, flags & ~nonBlock) < 0) {
        throw new IOException(
            "cannot switch descriptor " + descriptor + " to blocking mode (errno "
                + posix.errno() + ")");
      }
      log.debug("[ircbot] cleared O_NONBLOCK on inherited descriptor {}", descriptor);
    }

    return new InheritedSocketTransport(new NativeSocketChannel(descriptor));
  }
}
