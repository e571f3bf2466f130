package cafe.woden.ircbot.handoff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import jnr.constants.platform.Fcntl;
import jnr.posix.POSIX;
import org.junit.jupiter.api.Test;

class JnrProcessLauncherTest {

  private final POSIX posix = mock(POSIX.class);
  private final JnrProcessLauncher launcher = new JnrProcessLauncher(posix);
  private final HandoffRequest request =
      new HandoffRequest(List.of("/usr/bin/java", "-jar", "bot.jar", "--fork=1"), List.of(9));

  @Test
  void fileActionsCopyThroughScratchSlots() {
    assertThat(JnrProcessLauncher.fileActions(List.of())).isEmpty();
    // one dup to scratch, then dup to target and close scratch
    assertThat(JnrProcessLauncher.fileActions(List.of(9))).hasSize(3);
    assertThat(JnrProcessLauncher.fileActions(List.of(4, 3))).hasSize(6);
  }

  @Test
  void spawnMarksSourcesCloseOnExecAndReturnsPid() throws Exception {
    when(posix.isNative()).thenReturn(true);
    when(posix.fcntlInt(anyInt(), any(Fcntl.class), anyInt())).thenReturn(0);
    when(posix.posix_spawnp(eq("/usr/bin/java"), anyCollection(), anyCollection(), anyCollection()))
        .thenReturn(4321L);

    assertThat(launcher.spawn(request)).isEqualTo(4321L);
    verify(posix).fcntlInt(9, Fcntl.F_SETFD, 1);
  }

  @Test
  void unusableDescriptorFailsBeforeSpawning() {
    when(posix.isNative()).thenReturn(true);
    when(posix.fcntlInt(anyInt(), any(Fcntl.class), anyInt())).thenReturn(-1);
    when(posix.errno()).thenReturn(9);

    assertThatThrownBy(() -> launcher.spawn(request))
        .isInstanceOf(HandoffFailedException.class)
        .hasMessageContaining("descriptor 9");
    verify(posix, never())
        .posix_spawnp(any(String.class), anyCollection(), anyCollection(), anyCollection());
  }

  @Test
  void spawnFailureIsReported() {
    when(posix.isNative()).thenReturn(true);
    when(posix.posix_spawnp(any(String.class), anyCollection(), anyCollection(), anyCollection()))
        .thenReturn(-1L);
    when(posix.errno()).thenReturn(2);

    assertThatThrownBy(() -> launcher.spawn(request))
        .isInstanceOf(HandoffFailedException.class)
        .hasMessageContaining("errno 2");
  }

  @Test
  void javaOnlyFallbackRefusesToSpawn() {
    when(posix.isNative()).thenReturn(false);

    assertThatThrownBy(() -> launcher.spawn(request))
        .isInstanceOf(HandoffFailedException.class)
        .hasMessageContaining("native");
  }
}
