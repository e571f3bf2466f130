package cafe.woden.ircbot.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.irc.InboundEvent;
import cafe.woden.ircbot.irc.IrcWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class CommandRegistryTest {

  private final List<String> sent = new ArrayList<>();
  private final IrcWriter writer = line -> sent.add(new String(line, StandardCharsets.UTF_8));

  @Test
  void dispatchRunsHandlerWithValidatedParams() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", mask -> true, Runnable::run);
    AtomicReference<ParamList> seen = new AtomicReference<>();
    registry
        .bind("join", false, (w, ev, params) -> seen.set(params))
        .addParam("channel", true, ParamPatterns.CHANNEL)
        .addParam("key", false);

    DispatchOutcome outcome = registry.dispatchOutcome(writer, event("!JOIN #ircafe"));

    assertEquals(DispatchOutcome.DISPATCHED, outcome);
    assertEquals(1, seen.get().size());
    assertEquals("#ircafe", seen.get().string(0));
    assertTrue(sent.isEmpty());
  }

  @Test
  void extraArgumentsBeyondDeclaredParamsAreDropped() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    AtomicReference<ParamList> seen = new AtomicReference<>();
    registry.bind("say", false, (w, ev, params) -> seen.set(params)).addParam("text", true);

    registry.dispatch(writer, event("!say \"hello world\" ignored"));

    assertEquals("hello world", seen.get().join());
  }

  @Test
  void restrictedCommandIsRefusedForUnknownHostmask() throws Exception {
    CommandRegistry registry =
        new CommandRegistry("!", "admin@host"::equals, Runnable::run);
    AtomicInteger calls = new AtomicInteger();
    registry.bind("reload", true, (w, ev, params) -> calls.incrementAndGet());

    DispatchOutcome outcome = registry.dispatchOutcome(writer, event("!reload"));

    assertEquals(DispatchOutcome.ACCESS_DENIED, outcome);
    assertEquals(0, calls.get());
    assertEquals(
        List.of(
            "PRIVMSG alice :Sorry, the command \"reload\" may only be used by administrators.\r\n"),
        sent);
  }

  @Test
  void restrictedCommandRunsForWhitelistedHostmask() throws Exception {
    CommandRegistry registry =
        new CommandRegistry("!", "~al@host.example"::equals, Runnable::run);
    AtomicInteger calls = new AtomicInteger();
    registry.bind("reload", true, (w, ev, params) -> calls.incrementAndGet());

    assertTrue(registry.dispatch(writer, event("!reload")));
    assertEquals(1, calls.get());
  }

  @Test
  void withoutAuthorizationRestrictedCommandsNeverRun() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry.bind("reload", true, (w, ev, params) -> {});

    assertEquals(DispatchOutcome.ACCESS_DENIED, registry.dispatchOutcome(writer, event("!reload")));
  }

  @Test
  void missingRequiredParameterIsReported() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry.bind("join", false, (w, ev, params) -> {}).addParam("channel", true);

    DispatchOutcome outcome = registry.dispatchOutcome(writer, event("!join"));

    assertEquals(DispatchOutcome.MISSING_PARAMETERS, outcome);
    assertEquals(List.of("PRIVMSG alice :Missing parameters for command: join\r\n"), sent);
  }

  @Test
  void invalidParameterIsReported() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry
        .bind("join", false, (w, ev, params) -> {})
        .addParam("channel", true, ParamPatterns.CHANNEL);

    DispatchOutcome outcome = registry.dispatchOutcome(writer, event("!join ircafe"));

    assertEquals(DispatchOutcome.INVALID_PARAMETER, outcome);
    assertEquals(
        List.of("PRIVMSG alice :Command join: invalid value for parameter \"channel\"\r\n"), sent);
  }

  @Test
  void unknownCommandsAndForeignPrefixesAreIgnored() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry.bind("help", false, (w, ev, params) -> {});

    assertEquals(DispatchOutcome.IGNORED, registry.dispatchOutcome(writer, event("!nope")));
    assertEquals(DispatchOutcome.IGNORED, registry.dispatchOutcome(writer, event("help")));
    assertEquals(DispatchOutcome.IGNORED, registry.dispatchOutcome(writer, event("!")));
    assertTrue(sent.isEmpty());
  }

  @Test
  void rebindingReplacesPreviousCommand() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    AtomicInteger first = new AtomicInteger();
    AtomicInteger second = new AtomicInteger();
    registry.bind("ping", false, (w, ev, params) -> first.incrementAndGet());
    Command replacement = registry.bind("PING", false, (w, ev, params) -> second.incrementAndGet());

    registry.dispatch(writer, event("!ping"));

    assertEquals(1, registry.commands().size());
    assertSame(replacement, registry.find("ping"));
    assertEquals(0, first.get());
    assertEquals(1, second.get());
  }

  @Test
  void unbindAndClearRemoveCommands() {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry.bind("a", false, (w, ev, params) -> {});
    registry.bind("b", false, (w, ev, params) -> {});

    registry.unbind("A");
    assertNull(registry.find("a"));
    assertEquals(1, registry.commands().size());

    registry.clear();
    assertTrue(registry.commands().isEmpty());
  }

  @Test
  void failingHandlerDoesNotAffectLaterDispatches() throws Exception {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    AtomicInteger calls = new AtomicInteger();
    registry.bind(
        "boom",
        false,
        (w, ev, params) -> {
          calls.incrementAndGet();
          throw new IllegalStateException("boom");
        });

    assertTrue(registry.dispatch(writer, event("!boom")));
    assertTrue(registry.dispatch(writer, event("!boom")));
    assertEquals(2, calls.get());
  }

  @Test
  void helpLinesAreSortedAndMarkRestrictedCommands() {
    CommandRegistry registry = new CommandRegistry("!", null, Runnable::run);
    registry.bind("version", false, (w, ev, params) -> {});
    registry
        .bind("join", true, (w, ev, params) -> {})
        .addParam("channel", true)
        .addParam("key", false);

    assertEquals(List.of("!join* <channel> [key]", "!version"), registry.helpLines());
  }

  @Test
  void multiCharacterPrefixIsHonored() throws Exception {
    CommandRegistry registry = new CommandRegistry("bot: ", null, Runnable::run);
    AtomicInteger calls = new AtomicInteger();
    registry.bind("ping", false, (w, ev, params) -> calls.incrementAndGet());

    assertTrue(registry.dispatch(writer, event("bot: ping")));
    assertEquals(1, calls.get());
  }

  private static InboundEvent event(String payload) {
    return new InboundEvent("alice", "~al@host.example", "PRIVMSG", "#ircafe", payload);
  }
}
