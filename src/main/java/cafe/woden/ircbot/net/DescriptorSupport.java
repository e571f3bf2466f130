package cafe.woden.ircbot.net;

import java.io.IOException;

/** Turns a connected socket descriptor inherited from the parent process into a transport. */
public interface DescriptorSupport {

  SocketTransport adopt(int descriptor) throws IOException;
}
