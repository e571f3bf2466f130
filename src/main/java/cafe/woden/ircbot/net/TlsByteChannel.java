package cafe.woden.ircbot.net;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLEngineResult;
import javax.net.ssl.SSLEngineResult.HandshakeStatus;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking TLS layer over another {@link SocketTransport}.
 *
 * <p>Buffers: {@code netIn} and {@code appIn} are kept in fill mode between calls; {@code netOut}
 * is only used under the write lock. A reader that has to answer the peer (key update, close
 * notify) takes the write lock for that, never the other way around.
 */
final class TlsByteChannel implements SocketTransport {
  private static final Logger log = LoggerFactory.getLogger(TlsByteChannel.class);

  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private final SocketTransport delegate;
  private final SSLEngine engine;

  private final Object readLock = new Object();
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ByteBuffer netIn;
  private ByteBuffer appIn;
  private ByteBuffer netOut;

  TlsByteChannel(SocketTransport delegate, SSLEngine engine) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.engine = Objects.requireNonNull(engine, "engine");
    int packet = engine.getSession().getPacketBufferSize();
    int app = engine.getSession().getApplicationBufferSize();
    this.netIn = ByteBuffer.allocate(packet);
    this.netOut = ByteBuffer.allocate(packet);
    this.appIn = ByteBuffer.allocate(app);
  }

  /** Runs the client handshake to completion. Must be called before the channel is shared. */
  void handshake() throws IOException {
    engine.beginHandshake();
    HandshakeStatus hs = engine.getHandshakeStatus();
    while (hs != HandshakeStatus.FINISHED && hs != HandshakeStatus.NOT_HANDSHAKING) {
      switch (hs) {
        case NEED_WRAP -> {
          writeLock.lock();
          try {
            hs = wrapAndFlush(EMPTY).getHandshakeStatus();
          } finally {
            writeLock.unlock();
          }
        }
        case NEED_UNWRAP, NEED_UNWRAP_AGAIN -> {
          SSLEngineResult r;
          synchronized (readLock) {
            r = unwrap();
          }
          if (r == null) throw new SSLException("connection closed during TLS handshake");
          if (r.getStatus() == SSLEngineResult.Status.CLOSED) {
            throw new SSLException("peer closed the session during TLS handshake");
          }
          hs = r.getHandshakeStatus();
        }
        case NEED_TASK -> {
          runDelegatedTasks();
          hs = engine.getHandshakeStatus();
        }
        default -> throw new SSLException("unexpected handshake status " + hs);
      }
      if (hs == HandshakeStatus.NEED_TASK) {
        runDelegatedTasks();
        hs = engine.getHandshakeStatus();
      }
    }
    log.debug(
        "[ircbot] TLS handshake done: {} {}",
        engine.getSession().getProtocol(),
        engine.getSession().getCipherSuite());
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    synchronized (readLock) {
      while (true) {
        if (appIn.position() > 0) {
          appIn.flip();
          int n = Math.min(appIn.remaining(), dst.remaining());
          ByteBuffer slice = appIn.slice();
          slice.limit(n);
          dst.put(slice);
          appIn.position(appIn.position() + n);
          appIn.compact();
          return n;
        }
        if (engine.isInboundDone()) return -1;

        SSLEngineResult r = unwrap();
        if (r == null) return -1;
        answerPeer(r.getHandshakeStatus());
        if (r.getStatus() == SSLEngineResult.Status.CLOSED && appIn.position() == 0) return -1;
      }
    }
  }

  @Override
  public int write(ByteBuffer src) throws IOException {
    writeLock.lock();
    try {
      int consumed = 0;
      while (src.hasRemaining()) {
        SSLEngineResult r = wrapAndFlush(src);
        consumed += r.bytesConsumed();
        HandshakeStatus hs = r.getHandshakeStatus();
        if (hs == HandshakeStatus.NEED_TASK) runDelegatedTasks();
        if (r.bytesConsumed() == 0 && hs == HandshakeStatus.NEED_UNWRAP) {
          throw new SSLException("TLS renegotiation is not supported");
        }
      }
      return consumed;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public boolean isOpen() {
    return !closed.get() && delegate.isOpen();
  }

  /** Sends close_notify when the writer is idle, then closes the socket. */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) return;
    try {
      engine.closeOutbound();
      if (writeLock.tryLock()) {
        try {
          while (!engine.isOutboundDone()) {
            wrapAndFlush(EMPTY);
          }
        } catch (IOException e) {
          log.debug("[ircbot] could not send TLS close_notify: {}", e.toString());
        } finally {
          writeLock.unlock();
        }
      }
    } finally {
      delegate.close();
    }
  }

  /** Drops the socket without close_notify; the TLS session is not usable by anyone else. */
  @Override
  public void release() throws IOException {
    closed.set(true);
    delegate.release();
  }

  @Override
  public int descriptor() throws IOException {
    return delegate.descriptor();
  }

  private void answerPeer(HandshakeStatus hs) throws IOException {
    while (true) {
      if (hs == HandshakeStatus.NEED_TASK) {
        runDelegatedTasks();
        hs = engine.getHandshakeStatus();
      } else if (hs == HandshakeStatus.NEED_WRAP) {
        writeLock.lock();
        try {
          hs = wrapAndFlush(EMPTY).getHandshakeStatus();
        } finally {
          writeLock.unlock();
        }
        if (engine.isOutboundDone()) return;
      } else {
        return;
      }
    }
  }

  /** Unwraps one record into {@code appIn}; null at end of stream. */
  private SSLEngineResult unwrap() throws IOException {
    while (true) {
      netIn.flip();
      SSLEngineResult r;
      try {
        r = engine.unwrap(netIn, appIn);
      } finally {
        netIn.compact();
      }
      switch (r.getStatus()) {
        case OK, CLOSED -> {
          return r;
        }
        case BUFFER_OVERFLOW -> appIn = grow(appIn, engine.getSession().getApplicationBufferSize());
        case BUFFER_UNDERFLOW -> {
          if (!netIn.hasRemaining()) {
            netIn = grow(netIn, engine.getSession().getPacketBufferSize());
          }
          int n = delegate.read(netIn);
          if (n < 0) {
            try {
              engine.closeInbound();
            } catch (SSLException e) {
              log.debug("[ircbot] TLS peer closed without close_notify");
            }
            return null;
          }
        }
      }
    }
  }

  private SSLEngineResult wrapAndFlush(ByteBuffer src) throws IOException {
    while (true) {
      netOut.clear();
      SSLEngineResult r = engine.wrap(src, netOut);
      switch (r.getStatus()) {
        case OK, CLOSED -> {
          netOut.flip();
          while (netOut.hasRemaining()) {
            if (delegate.write(netOut) < 0) throw new ConnectionClosedException("socket closed");
          }
          if (r.getStatus() == SSLEngineResult.Status.CLOSED && src.hasRemaining()) {
            throw new ConnectionClosedException("TLS session closed");
          }
          return r;
        }
        case BUFFER_OVERFLOW -> netOut = grow(netOut, engine.getSession().getPacketBufferSize());
        case BUFFER_UNDERFLOW -> throw new SSLException("unexpected underflow while wrapping");
      }
    }
  }

  private void runDelegatedTasks() {
    Runnable task;
    while ((task = engine.getDelegatedTask()) != null) {
      task.run();
    }
  }

  private static ByteBuffer grow(ByteBuffer buffer, int minExtra) {
    ByteBuffer bigger = ByteBuffer.allocate(buffer.capacity() + Math.max(minExtra, 1024));
    buffer.flip();
    bigger.put(buffer);
    return bigger;
  }
}
