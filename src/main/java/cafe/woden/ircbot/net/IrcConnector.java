package cafe.woden.ircbot.net;

import cafe.woden.ircbot.config.BotProperties;
import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Opens {@link IrcConnection}s, either by dialing or from an inherited descriptor. */
@InfrastructureLayer
@Component
public class IrcConnector {
  private static final Logger log = LoggerFactory.getLogger(IrcConnector.class);

  private final DescriptorSupport descriptors;
  private final Duration idleTimeout;
  private final Duration connectTimeout;

  public IrcConnector(DescriptorSupport descriptors, BotProperties properties) {
    this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
    BotProperties.Connection c = Objects.requireNonNull(properties, "properties").connection();
    this.idleTimeout = c.idleTimeout();
    this.connectTimeout = c.connectTimeout();
  }

  /** Dials {@code address}; with active TLS settings the handshake completes before returning. */
  public IrcConnection dial(ServerAddress address, BotProperties.Tls tls)
      throws ConnectFailedException {
    Objects.requireNonNull(address, "address");
    SocketChannel channel = null;
    try {
      channel = SocketChannel.open();
      channel.socket().connect(address.toSocketAddress(), (int) connectTimeout.toMillis());
      channel.socket().setKeepAlive(true);
      log.info("[ircbot] connected to {}", address);
      return open(new JdkSocketTransport(channel), address, tls);
    } catch (IOException e) {
      closeQuietly(channel, address);
      throw new ConnectFailedException("cannot connect to " + address + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      closeQuietly(channel, address);
      throw new ConnectFailedException("cannot connect to " + address, e);
    }
  }

  /**
   * Wraps a connected socket inherited at {@code descriptor}. {@code address} is the server the
   * parent process was talking to.
   */
  public IrcConnection adopt(int descriptor, ServerAddress address, BotProperties.Tls tls)
      throws ConnectFailedException {
    Objects.requireNonNull(address, "address");
    SocketTransport transport;
    try {
      transport = descriptors.adopt(descriptor);
    } catch (IOException e) {
      throw new ConnectFailedException("cannot adopt descriptor " + descriptor, e);
    }
    try {
      log.info("[ircbot] adopted descriptor {} for {}", descriptor, address);
      return open(transport, address, tls);
    } catch (IOException e) {
      try {
        transport.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw new ConnectFailedException("cannot use descriptor " + descriptor, e);
    }
  }

  private IrcConnection open(
      SocketTransport transport, ServerAddress address, BotProperties.Tls tls) throws IOException {
    if (tls == null || !tls.active()) {
      return new IrcConnection(transport, address, idleTimeout);
    }
    TlsByteChannel secured = new TlsByteChannel(transport, newEngine(address, tls));
    secured.handshake();
    return new IrcConnection(secured, address, idleTimeout);
  }

  private static SSLEngine newEngine(ServerAddress address, BotProperties.Tls tls)
      throws IOException {
    SSLContext ctx;
    try {
      ctx = TlsContextFactory.create(tls);
    } catch (GeneralSecurityException e) {
      throw new IOException("invalid TLS configuration: " + e.getMessage(), e);
    }
    SSLEngine engine = ctx.createSSLEngine(address.host(), address.port());
    engine.setUseClientMode(true);
    if (!tls.trustAllCertificates()) {
      SSLParameters params = engine.getSSLParameters();
      params.setEndpointIdentificationAlgorithm("HTTPS");
      engine.setSSLParameters(params);
    }
    return engine;
  }

  private static void closeQuietly(SocketChannel channel, ServerAddress address) {
    if (channel == null) return;
    try {
      channel.close();
    } catch (IOException e) {
      log.debug("[ircbot] error closing failed connection to {}", address, e);
    }
  }
}
