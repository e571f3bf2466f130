package cafe.woden.ircbot.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class NamedThreadsTest {

  @Test
  void poolThreadsAreNamedDaemons() throws Exception {
    ExecutorService exec = NamedThreads.newCachedThreadPool("ircbot-test");
    try {
      Future<Thread> worker = exec.submit(Thread::currentThread);

      Thread t = worker.get();
      assertThat(t.getName()).isEqualTo("ircbot-test-1");
      assertThat(t.isDaemon()).isTrue();
    } finally {
      exec.shutdownNow();
    }
  }

  @Test
  void blankNameFallsBackToDefault() {
    Thread t = NamedThreads.unstarted("  ", () -> {});

    assertThat(t.getName()).isEqualTo("ircbot-thread");
    assertThat(t.isAlive()).isFalse();
  }
}
