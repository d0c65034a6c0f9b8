package cafe.woden.logbrowser.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class NamedThreadsTest {

  @Test
  void factoryNumbersDaemonThreads() {
    ThreadFactory factory = NamedThreads.namedFactory("loader");
    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertEquals("loader-1", first.getName());
    assertEquals("loader-2", second.getName());
    assertTrue(first.isDaemon());
  }

  @Test
  void blankBaseNameFallsBackToDefault() {
    assertEquals("logbrowser-worker-1", NamedThreads.namedFactory("  ").newThread(() -> {}).getName());
  }

  @Test
  void singleThreadExecutorRunsOnNamedThread() throws Exception {
    ExecutorService exec = NamedThreads.newSingleThreadExecutor("io");
    try {
      String name = exec.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertEquals("io-1", name);
    } finally {
      exec.shutdownNow();
    }
  }
}
