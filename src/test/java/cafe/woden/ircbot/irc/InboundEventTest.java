package cafe.woden.ircbot.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class InboundEventTest {

  @Test
  void nullFieldsBecomeEmpty() {
    InboundEvent ev = new InboundEvent(null, null, null, null, null);

    assertEquals("", ev.senderNick());
    assertEquals("", ev.payload());
    assertFalse(ev.fromChannel());
  }

  @Test
  void channelTargetsAreRecognized() {
    assertTrue(event("#ircafe").fromChannel());
    assertTrue(event("&local").fromChannel());
    assertFalse(event("alice").fromChannel());
  }

  @Test
  void withTargetKeepsEverythingElse() {
    InboundEvent ev = new InboundEvent("alice", "a@h", "PRIVMSG", "ircafe_bot", "!help");

    InboundEvent rewritten = ev.withTarget("alice");

    assertEquals("alice", rewritten.target());
    assertEquals("!help", rewritten.payload());
    assertEquals("a@h", rewritten.senderHostmask());
  }

  @Test
  void fieldsSkipsLeadingWords() {
    InboundEvent ev = new InboundEvent("a", "a@h", "PRIVMSG", "#c", "  one two   three ");

    assertEquals(List.of("two", "three"), ev.fields(1));
    assertEquals(List.of(), ev.fields(3));
    assertEquals(List.of(), ev.fields(-1));
  }

  private static InboundEvent event(String target) {
    return new InboundEvent("alice", "a@h", "PRIVMSG", target, "hi");
  }
}
