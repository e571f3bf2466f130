package cafe.woden.ircbot.irc;

import java.io.IOException;

/**
 * Write side of a server connection as seen by command handlers and plugins.
 *
 * <p>Each call writes exactly one encoded line (as produced by {@link IrcCodec}); implementations
 * must never interleave two calls. An empty array is a no-op.
 */
@FunctionalInterface
public interface IrcWriter {
  void write(byte[] line) throws IOException;
}
