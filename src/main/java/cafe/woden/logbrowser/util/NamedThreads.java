package cafe.woden.logbrowser.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {

  private NamedThreads() {}

  /** Daemon threads named {@code base-1}, {@code base-2}, ... */
  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger counter = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "logbrowser-worker" : s;
  }
}
