package cafe.woden.logbrowser.filter;

import cafe.woden.logbrowser.storage.LineView;
import cafe.woden.logbrowser.storage.LogStore;
import java.util.Arrays;
import java.util.Optional;

/**
 * Ascending store line indices that currently pass a {@link FilterList}.
 *
 * <p>Immutable. Lookups past either end return {@code -1} or empty instead of throwing, because
 * callers often hold a filtered index computed against an older view.
 */
public final class FilteredView {

  private static final FilteredView EMPTY = new FilteredView(new int[0], 0);

  private final int[] indices;
  private final int size;

  FilteredView(int[] indices, int size) {
    this.indices = indices;
    this.size = size;
  }

  public static FilteredView empty() {
    return EMPTY;
  }

  /** Tests every line of {@code store} in order and keeps the ones {@code filters} accept. */
  public static FilteredView compute(LogStore store, FilterList filters) {
    FilterPass pass = new FilterPass(store, filters);
    pass.advance(Integer.MAX_VALUE);
    return pass.result();
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Store line index of filtered entry {@code filteredIdx}, or {@code -1}. */
  public int lineIndexAt(int filteredIdx) {
    if (filteredIdx < 0 || filteredIdx >= size) return -1;
    return indices[filteredIdx];
  }

  public Optional<LineView> line(LogStore store, int filteredIdx) {
    int idx = lineIndexAt(filteredIdx);
    if (idx < 0 || store == null) return Optional.empty();
    return store.getLine(idx);
  }

  public int[] toArray() {
    return Arrays.copyOf(indices, size);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FilteredView other)) return false;
    return Arrays.equals(indices, 0, size, other.indices, 0, other.size);
  }

  @Override
  public int hashCode() {
    int h = 1;
    for (int i = 0; i < size; i++) h = 31 * h + indices[i];
    return h;
  }

  @Override
  public String toString() {
    return "FilteredView[size=" + size + "]";
  }
}
