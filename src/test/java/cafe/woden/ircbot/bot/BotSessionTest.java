package cafe.woden.ircbot.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.ircbot.config.BotProfile;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.handoff.HandoffFailedException;
import cafe.woden.ircbot.handoff.InheritedDescriptors;
import cafe.woden.ircbot.net.ConnectFailedException;
import cafe.woden.ircbot.net.ConnectionClosedException;
import cafe.woden.ircbot.net.ConnectionWatchdog;
import cafe.woden.ircbot.net.IrcConnection;
import cafe.woden.ircbot.net.IrcConnector;
import cafe.woden.ircbot.net.ServerAddress;
import cafe.woden.ircbot.plugin.PluginHost;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.reactivex.rxjava3.disposables.Disposable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.LoggerFactory;

class BotSessionTest {

  private static final String EOF = "\u0000eof";
  private static final BotProperties.Tls PLAIN =
      new BotProperties.Tls(false, null, null, null, false);

  private final IrcConnector connector = mock(IrcConnector.class);
  private final ConnectionWatchdog watchdog = mock(ConnectionWatchdog.class);
  private final BotProfile profile = mock(BotProfile.class);
  private final PluginHost plugins = mock(PluginHost.class);
  private final IrcConnection connection = mock(IrcConnection.class);

  private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
  private final List<String> outbound = new CopyOnWriteArrayList<>();

  private BotSession session;

  @BeforeEach
  void setUp() throws Exception {
    when(profile.address()).thenReturn("irc.example.net:6667");
    when(profile.tls()).thenReturn(PLAIN);
    when(profile.nickname()).thenReturn("cafebot");
    when(profile.realName()).thenReturn("IRCafe Bot");
    when(profile.connectionPassword()).thenReturn("");
    when(profile.nickservPassword()).thenReturn("");
    when(profile.operPassword()).thenReturn("");
    when(profile.channels()).thenReturn(List.of());
    when(watchdog.watch(any(IrcConnection.class))).thenReturn(Disposable.empty());

    doAnswer(
            inv -> {
              String line = new String(inv.<byte[]>getArgument(0), StandardCharsets.UTF_8);
              outbound.add(line);
              if (line.startsWith("PING ")) inbound.offer("PONG " + line.substring(5).trim());
              return null;
            })
        .when(connection)
        .write(any(byte[].class));
    when(connection.readLine())
        .thenAnswer(
            inv -> {
              String line = inbound.take();
              if (EOF.equals(line)) throw new ConnectionClosedException("server closed");
              return line;
            });
    doAnswer(
            inv -> {
              inbound.offer(EOF);
              return null;
            })
        .when(connection)
        .close(anyString());
  }

  @AfterEach
  void tearDown() {
    if (session != null) session.close();
  }

  @Test
  void freshSessionDialsAndRegisters() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(InheritedDescriptors.NONE);

    assertThat(session.open()).isFalse();

    assertThat(outbound).containsExactly("USER cafebot 8 * :IRCafe Bot\r\n", "NICK cafebot\r\n");
    verify(connector, never()).adopt(anyInt(), any(), any());
  }

  @Test
  void registrationFailureClosesAndReportsConnectFailed() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    doAnswer(
            inv -> {
              throw new IOException("broken pipe");
            })
        .when(connection)
        .write(any(byte[].class));
    session = session(InheritedDescriptors.NONE);

    assertThatThrownBy(session::open).isInstanceOf(ConnectFailedException.class);
    verify(connection).close("registration failed");
  }

  @Test
  void inheritedSessionAdoptsSlotThreeAndReplaysParentInput() throws Exception {
    byte[] pending = "PING :x\r\n".getBytes(StandardCharsets.UTF_8);
    when(connector.adopt(eq(3), any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(new InheritedDescriptors(1, pending));

    assertThat(session.open()).isTrue();

    verify(connection).prependInput(pending);
    assertThat(outbound).isEmpty();
  }

  @Test
  void extraInheritedDescriptorsAreAdoptedInOrderAndClosed() throws Exception {
    IrcConnection extra = mock(IrcConnection.class);
    when(connector.adopt(eq(3), any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    when(connector.adopt(eq(4), any(ServerAddress.class), eq(PLAIN))).thenReturn(extra);
    session = session(new InheritedDescriptors(2, null));

    assertThat(session.open()).isTrue();

    InOrder order = inOrder(connector);
    order.verify(connector).adopt(eq(3), any(ServerAddress.class), eq(PLAIN));
    order.verify(connector).adopt(eq(4), any(ServerAddress.class), eq(PLAIN));
    verify(extra).close(anyString());
    verify(connection, never()).close(anyString());
    assertThat(session.connection()).isSameAs(connection);
  }

  @Test
  void unusableExtraDescriptorDoesNotFailStartup() throws Exception {
    when(connector.adopt(eq(3), any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    ConnectFailedException badFd =
        new ConnectFailedException("cannot adopt descriptor 4", new IOException("bad fd"));
    when(connector.adopt(eq(4), any(ServerAddress.class), eq(PLAIN))).thenThrow(badFd);
    session = session(new InheritedDescriptors(2, null));

    assertThat(session.open()).isTrue();
    assertThat(session.connection()).isSameAs(connection);
  }

  @Test
  void readLoopRoutesLinesUntilConnectionIsLost() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(InheritedDescriptors.NONE);
    session.open();
    AtomicInteger lost = new AtomicInteger();

    session.start(lost::incrementAndGet);
    inbound.offer("PING :irc.example.net");
    inbound.offer(EOF);

    verify(connection, timeout(2000)).close("read loop ended");
    assertThat(outbound).contains("PONG irc.example.net\r\n");
    awaitCount(lost, 1);
  }

  @Test
  void failedReplyIsLoggedAsWarning() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(BotSession.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
      session = session(InheritedDescriptors.NONE);
      session.open();
      doAnswer(
              inv -> {
                throw new IOException("broken pipe");
              })
          .when(connection)
          .write(any(byte[].class));

      session.start(() -> {});
      inbound.offer("PING :irc.example.net");

      long deadline = System.currentTimeMillis() + 2000;
      while (!loggedReplyFailure(appender) && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertThat(appender.list)
          .filteredOn(e -> e.getFormattedMessage().contains("PING :irc.example.net"))
          .singleElement()
          .extracting(ILoggingEvent::getLevel)
          .isEqualTo(Level.WARN);
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void quiescePausesReaderAndHandsOverBufferedInput() throws Exception {
    byte[] buffered = ":alice!a@h PRIVMSG #c :late\r\n".getBytes(StandardCharsets.UTF_8);
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    when(connection.takeBufferedInput()).thenReturn(buffered);
    session = session(InheritedDescriptors.NONE);
    session.open();
    session.start(() -> {});

    byte[] unconsumed = session.quiesce(Duration.ofSeconds(2));

    assertThat(unconsumed).isEqualTo(buffered);
    assertThat(outbound).contains("PING " + BotSession.QUIESCE_TOKEN + "\r\n");

    session.resume(unconsumed);
    verify(connection).prependInput(buffered);
    inbound.offer("PING :again");
    awaitOutbound("PONG again\r\n");
  }

  @Test
  void quiesceWithoutRunningReaderFails() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(InheritedDescriptors.NONE);
    session.open();

    assertThatThrownBy(() -> session.quiesce(Duration.ofMillis(100)))
        .isInstanceOf(HandoffFailedException.class)
        .hasMessageContaining("not running");
  }

  @Test
  void closeDoesNotReportConnectionLoss() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(InheritedDescriptors.NONE);
    session.open();
    AtomicInteger lost = new AtomicInteger();
    session.start(lost::incrementAndGet);

    session.close();

    verify(connection, timeout(2000)).close("shutting down");
    Thread.sleep(100);
    assertThat(lost.get()).isZero();
  }

  @Test
  void markHandedOffDelegatesToConnection() throws Exception {
    when(connector.dial(any(ServerAddress.class), eq(PLAIN))).thenReturn(connection);
    session = session(InheritedDescriptors.NONE);
    session.open();

    session.markHandedOff();

    verify(connection).markHandedOff();
  }

  private BotSession session(InheritedDescriptors inherited) {
    InboundRouter router = new InboundRouter(profile, plugins);
    return new BotSession(connector, watchdog, router, profile, inherited);
  }

  private static boolean loggedReplyFailure(ListAppender<ILoggingEvent> appender) {
    return appender.list.stream()
        .anyMatch(e -> e.getFormattedMessage().contains("PING :irc.example.net"));
  }

  private void awaitOutbound(String line) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 2000;
    while (!outbound.contains(line) && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertThat(outbound).contains(line);
  }

  private static void awaitCount(AtomicInteger counter, int expected) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 2000;
    while (counter.get() < expected && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertThat(counter.get()).isEqualTo(expected);
  }
}
