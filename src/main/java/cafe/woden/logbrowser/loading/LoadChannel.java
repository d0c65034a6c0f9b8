package cafe.woden.logbrowser.loading;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Non-blocking hand-off from the loader thread to the thread that owns the session.
 *
 * <p>One producer, one consumer. Events come out in the order they went in.
 */
public final class LoadChannel {

  private final Queue<LoadEvent> queue = new ConcurrentLinkedQueue<>();

  public void offer(LoadEvent event) {
    if (event != null) queue.offer(event);
  }

  /** Next event, or null when nothing has arrived. */
  public LoadEvent poll() {
    return queue.poll();
  }

  /** Hands every event that has arrived so far to {@code consumer}; returns how many. */
  public int drain(Consumer<? super LoadEvent> consumer) {
    int n = 0;
    LoadEvent e;
    while ((e = queue.poll()) != null) {
      consumer.accept(e);
      n++;
    }
    return n;
  }

  public List<LoadEvent> drainAll() {
    List<LoadEvent> out = new ArrayList<>();
    drain(out::add);
    return out;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}
