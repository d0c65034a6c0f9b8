package cafe.woden.logbrowser.search;

import cafe.woden.logbrowser.match.MatchSpan;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LRU cache of per-line match spans keyed by filtered-view index.
 */
final class LineMatchCache {

  static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final LinkedHashMap<Integer, List<MatchSpan>> cache;

  LineMatchCache(int capacity) {
    this.capacity = capacity > 0 ? capacity : DEFAULT_CAPACITY;
    this.cache =
        new LinkedHashMap<>(Math.min(this.capacity, 64) * 2, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<Integer, List<MatchSpan>> eldest) {
            return size() > LineMatchCache.this.capacity;
          }
        };
  }

  /** Cached spans, refreshing the entry's recency; null on a miss. */
  List<MatchSpan> get(int filteredIndex) {
    return cache.get(filteredIndex);
  }

  void put(int filteredIndex, List<MatchSpan> spans) {
    cache.put(filteredIndex, List.copyOf(spans));
  }

  boolean contains(int filteredIndex) {
    return cache.containsKey(filteredIndex);
  }

  int size() {
    return cache.size();
  }

  int capacity() {
    return capacity;
  }

  void clear() {
    cache.clear();
  }
}
