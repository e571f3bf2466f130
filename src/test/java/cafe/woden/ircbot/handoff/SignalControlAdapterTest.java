package cafe.woden.ircbot.handoff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;

import cafe.woden.ircbot.config.BotProperties;
import org.junit.jupiter.api.Test;

class SignalControlAdapterTest {

  private final HandoffController controller = mock(HandoffController.class);

  @Test
  void defaultBindingsMapUsr1ToReloadAndTerminationToStop() {
    SignalControlAdapter adapter =
        new SignalControlAdapter(controller, new BotProperties(null, null, null));

    assertThat(adapter.bindings())
        .containsExactly(
            entry("USR1", ControlEvent.RELOAD),
            entry("INT", ControlEvent.STOP),
            entry("TERM", ControlEvent.STOP));
  }

  @Test
  void configuredReloadSignalWinsOverStopMapping() {
    SignalControlAdapter adapter =
        new SignalControlAdapter(
            controller,
            new BotProperties(null, null, new BotProperties.Handoff(null, null, "SIGTERM", null)));

    assertThat(adapter.bindings()).containsEntry("TERM", ControlEvent.RELOAD);
    assertThat(adapter.bindings()).containsEntry("INT", ControlEvent.STOP);
  }
}
