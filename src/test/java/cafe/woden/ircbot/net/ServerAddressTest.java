package cafe.woden.ircbot.net;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ServerAddressTest {

  @Test
  void parsesHostAndPort() {
    ServerAddress a = ServerAddress.parse(" irc.libera.chat:6697 ");

    assertThat(a.host()).isEqualTo("irc.libera.chat");
    assertThat(a.port()).isEqualTo(6697);
    assertThat(a).hasToString("irc.libera.chat:6697");
  }

  @Test
  void bracketedIpv6LiteralRoundTripsThroughToString() {
    ServerAddress a = ServerAddress.parse("[::1]:6667");

    assertThat(a.host()).isEqualTo("::1");
    assertThat(a).hasToString("[::1]:6667");
  }

  @Test
  void rejectsMissingOrInvalidPort() {
    assertThatThrownBy(() -> ServerAddress.parse("irc.example.net"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ServerAddress.parse("irc.example.net:"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ServerAddress.parse("irc.example.net:abc"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ServerAddress.parse("irc.example.net:70000"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
