package cafe.woden.ircbot.net;

import cafe.woden.ircbot.irc.IrcWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single live server connection of this process.
 *
 * <p>One thread reads lines; any thread may write. Every successful read or write moves the idle
 * deadline forward. Once the connection is {@linkplain #markHandedOff() handed off} to a child
 * process it refuses writes and closing it only drops this process's descriptor.
 */
@InfrastructureLayer
public final class IrcConnection implements IrcWriter, Closeable {
  private static final Logger log = LoggerFactory.getLogger(IrcConnection.class);

  private static final int INITIAL_BUFFER = 4096;
  /** Upper bound for one inbound line, tags included. */
  static final int MAX_INBOUND_LINE = 64 * 1024;

  private final SocketTransport transport;
  private final ServerAddress address;
  private final long idleTimeoutNanos;

  private final ReentrantLock readLock = new ReentrantLock();
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private volatile boolean handedOff;
  private volatile long deadlineNanos;
  private volatile String closeReason = "";

  // guarded by readLock; unread bytes are buf[start, end)
  private byte[] buf = new byte[INITIAL_BUFFER];
  private int start;
  private int end;

  IrcConnection(SocketTransport transport, ServerAddress address, Duration idleTimeout) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.address = Objects.requireNonNull(address, "address");
    this.idleTimeoutNanos = Objects.requireNonNull(idleTimeout, "idleTimeout").toNanos();
    touch();
  }

  public ServerAddress address() {
    return address;
  }

  /**
   * Blocks until a full line arrived and returns it trimmed.
   *
   * @throws ConnectionClosedException at end of stream, after {@link #close()}, or once the idle
   *     deadline has passed
   */
  public String readLine() throws IOException {
    readLock.lock();
    try {
      while (true) {
        checkUsable();
        for (int i = start; i < end; i++) {
          if (buf[i] == '\n') {
            String line = new String(buf, start, i - start, StandardCharsets.UTF_8);
            start = i + 1;
            if (start == end) start = end = 0;
            return line.strip();
          }
        }
        fill();
      }
    } finally {
      readLock.unlock();
    }
  }

  private void fill() throws IOException {
    if (start > 0) {
      System.arraycopy(buf, start, buf, 0, end - start);
      end -= start;
      start = 0;
    }
    if (end == buf.length) {
      if (buf.length >= MAX_INBOUND_LINE) {
        close("inbound line too long");
        throw new ConnectionClosedException("inbound line exceeds " + MAX_INBOUND_LINE + " bytes");
      }
      buf = Arrays.copyOf(buf, Math.min(buf.length * 2, MAX_INBOUND_LINE));
    }

    int n;
    try {
      n = transport.read(ByteBuffer.wrap(buf, end, buf.length - end));
    } catch (ClosedChannelException e) {
      throw closedException(e);
    } catch (IOException e) {
      if (closed.get()) throw closedException(e);
      throw e;
    }
    if (n < 0) {
      close("end of stream");
      throw new ConnectionClosedException("server closed the connection");
    }
    if (n > 0) {
      end += n;
      touch();
    }
  }

  /** Writes one encoded line fully. Empty input is ignored. */
  @Override
  public void write(byte[] line) throws IOException {
    if (line == null || line.length == 0) return;
    writeLock.lock();
    try {
      if (handedOff) throw new ConnectionClosedException("connection was handed off");
      checkUsable();
      ByteBuffer src = ByteBuffer.wrap(line);
      try {
        while (src.hasRemaining()) {
          transport.write(src);
        }
      } catch (ClosedChannelException e) {
        throw closedException(e);
      }
      touch();
    } finally {
      writeLock.unlock();
    }
  }

  /** Idempotent. */
  @Override
  public void close() {
    close("closed");
  }

  public void close(String reason) {
    if (!closed.compareAndSet(false, true)) return;
    closeReason = Objects.toString(reason, "closed");
    try {
      if (handedOff) {
        transport.release();
        log.info("[ircbot] released connection to {} ({})", address, closeReason);
      } else {
        transport.close();
        log.info("[ircbot] closed connection to {} ({})", address, closeReason);
      }
    } catch (IOException e) {
      log.warn("[ircbot] error while closing connection to {}", address, e);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** From now on the socket belongs to a child process. */
  public void markHandedOff() {
    handedOff = true;
  }

  public boolean isHandedOff() {
    return handedOff;
  }

  public int descriptor() throws IOException {
    return transport.descriptor();
  }

  /** True once no read or write succeeded for the whole idle timeout. */
  public boolean idleExpired() {
    return System.nanoTime() - deadlineNanos > 0;
  }

  /**
   * Removes and returns everything read from the socket but not yet returned as a line. Only
   * meaningful while no thread is inside {@link #readLine()}.
   */
  public byte[] takeBufferedInput() {
    readLock.lock();
    try {
      byte[] rest = Arrays.copyOfRange(buf, start, end);
      start = end = 0;
      return rest;
    } finally {
      readLock.unlock();
    }
  }

  /** Puts bytes back in front of the read buffer, e.g. input the parent process had read. */
  public void prependInput(byte[] data) {
    if (data == null || data.length == 0) return;
    readLock.lock();
    try {
      int pending = end - start;
      byte[] merged = new byte[Math.max(INITIAL_BUFFER, data.length + pending)];
      System.arraycopy(data, 0, merged, 0, data.length);
      System.arraycopy(buf, start, merged, data.length, pending);
      buf = merged;
      start = 0;
      end = data.length + pending;
    } finally {
      readLock.unlock();
    }
  }

  private void touch() {
    deadlineNanos = System.nanoTime() + idleTimeoutNanos;
  }

  private void checkUsable() throws ConnectionClosedException {
    if (closed.get()) throw new ConnectionClosedException("connection closed: " + closeReason);
    if (idleExpired()) {
      close("idle timeout");
      throw new ConnectionClosedException("connection idle timeout");
    }
  }

  private ConnectionClosedException closedException(IOException cause) {
    return new ConnectionClosedException("connection closed: " + closeReason, cause);
  }

  @Override
  public String toString() {
    return "IrcConnection[" + address + (handedOff ? ", handed off" : "") + "]";
  }
}
