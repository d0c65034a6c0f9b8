package cafe.woden.logbrowser.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logbrowser.match.MatchSpan;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineMatchCacheTest {

  @Test
  void evictsLeastRecentlyUsedBeyondCapacity() {
    LineMatchCache cache = new LineMatchCache(2);
    cache.put(0, List.of(new MatchSpan(0, 1)));
    cache.put(1, List.of());
    cache.get(0);

    cache.put(2, List.of(new MatchSpan(3, 4)));

    assertEquals(2, cache.size());
    assertTrue(cache.contains(0));
    assertFalse(cache.contains(1));
    assertTrue(cache.contains(2));
  }

  @Test
  void missReturnsNullAndNonPositiveCapacityFallsBackToDefault() {
    LineMatchCache cache = new LineMatchCache(0);

    assertNull(cache.get(5));
    assertEquals(LineMatchCache.DEFAULT_CAPACITY, cache.capacity());
  }

  @Test
  void holdsAtMostDefaultCapacity() {
    LineMatchCache cache = new LineMatchCache(LineMatchCache.DEFAULT_CAPACITY);
    for (int i = 0; i < 250; i++) cache.put(i, List.of());

    assertEquals(100, cache.size());
    assertTrue(cache.contains(249));
    assertFalse(cache.contains(0));

    cache.clear();
    assertEquals(0, cache.size());
  }
}
