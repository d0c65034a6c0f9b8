package cafe.woden.logbrowser.filter;

import cafe.woden.logbrowser.storage.LineView;
import cafe.woden.logbrowser.storage.LogStore;
import java.util.Arrays;
import java.util.Objects;

/**
 * One recomputation of a {@link FilteredView}, runnable in bounded steps.
 *
 * <p>A host loop can call {@link #advance(int)} once per tick to keep very large stores off the
 * latency-sensitive path. The finished result is identical to {@link FilteredView#compute}.
 */
public final class FilterPass {

  private final LogStore store;
  private final FilterList filters;
  private int[] kept;
  private int keptCount;
  private int next;

  public FilterPass(LogStore store, FilterList filters) {
    this.store = Objects.requireNonNullElse(store, LogStore.empty());
    this.filters = Objects.requireNonNullElseGet(filters, FilterList::new);
    this.kept = new int[Math.max(16, Math.min(this.store.size(), 1 << 16))];
  }

  /**
   * Tests up to {@code maxLines} more lines.
   *
   * @return true when the pass has covered the whole store
   */
  public boolean advance(int maxLines) {
    int total = store.size();
    int end = (int) Math.min((long) next + Math.max(0, maxLines), total);
    boolean all = filters.isEmpty();
    for (int i = next; i < end; i++) {
      if (all) {
        keep(i);
        continue;
      }
      LineView line = store.lineOrNull(i);
      if (line != null && filters.matches(line)) keep(i);
    }
    next = end;
    return isDone();
  }

  private void keep(int lineIndex) {
    if (keptCount == kept.length) {
      kept = Arrays.copyOf(kept, kept.length + (kept.length >> 1) + 1);
    }
    kept[keptCount++] = lineIndex;
  }

  public boolean isDone() {
    return next >= store.size();
  }

  /** Lines tested so far. */
  public int processed() {
    return next;
  }

  /** The finished view. */
  public FilteredView result() {
    if (!isDone()) {
      throw new IllegalStateException("Filter pass stopped at " + next + " of " + store.size());
    }
    return new FilteredView(Arrays.copyOf(kept, keptCount), keptCount);
  }
}
