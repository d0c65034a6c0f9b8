package cafe.woden.logbrowser.search;

import cafe.woden.logbrowser.filter.FilteredView;
import cafe.woden.logbrowser.match.AsciiLowercaseBuffer;
import cafe.woden.logbrowser.match.BmhMatcher;
import cafe.woden.logbrowser.match.MatchSpan;
import cafe.woden.logbrowser.storage.LineView;
import cafe.woden.logbrowser.storage.LogStore;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Case-insensitive literal search over one {@link FilteredView}.
 *
 * <p>Matches are enumerated in (filtered index, byte offset) order and numbered from zero. The
 * session is bound to the view it was started on; a host must discard it when the view changes.
 *
 * <p>Navigation resolves an ordinal through a table of cumulative counts per matching line built
 * during {@link #start}. It never reads or fills the per-line span cache, which only
 * {@link #lineMatches(int)} populates.
 *
 * <p>Not thread-safe.
 */
public final class SearchSession {

  private static final Logger log = LoggerFactory.getLogger(SearchSession.class);

  private final String query;
  private final BmhMatcher matcher;
  private final LogStore store;
  private final FilteredView view;
  private final LineMatchCache cache;
  private final AsciiLowercaseBuffer scratch = new AsciiLowercaseBuffer();

  // filtered indices of lines with at least one hit, and the number of hits before each
  private final int[] matchLines;
  private final long[] matchesBefore;
  private final long totalMatches;

  private long currentOrdinal;
  private MatchPosition currentPosition;

  private SearchSession(
      String query,
      BmhMatcher matcher,
      LogStore store,
      FilteredView view,
      int cacheCapacity,
      int[] matchLines,
      long[] matchesBefore,
      long totalMatches) {
    this.query = query;
    this.matcher = matcher;
    this.store = store;
    this.view = view;
    this.cache = new LineMatchCache(cacheCapacity);
    this.matchLines = matchLines;
    this.matchesBefore = matchesBefore;
    this.totalMatches = totalMatches;
  }

  public static Optional<SearchSession> start(String query, LogStore store, FilteredView view) {
    return start(query, store, view, LineMatchCache.DEFAULT_CAPACITY);
  }

  /**
   * Scans {@code view} once, counting every hit of {@code query}.
   *
   * @return empty for a null or empty query; otherwise a session whose current match is the first
   *     hit, or none when there are no hits
   */
  public static Optional<SearchSession> start(
      String query, LogStore store, FilteredView view, int cacheCapacity) {
    if (query == null || query.isEmpty()) return Optional.empty();
    LogStore s = Objects.requireNonNullElse(store, LogStore.empty());
    FilteredView v = Objects.requireNonNullElse(view, FilteredView.empty());
    BmhMatcher matcher = BmhMatcher.forText(query);
    AsciiLowercaseBuffer scratch = new AsciiLowercaseBuffer();

    long started = System.nanoTime();
    int[] lines = new int[16];
    long[] before = new long[16];
    int lineCount = 0;
    long total = 0;
    MatchPosition first = null;
    for (int f = 0; f < v.size(); f++) {
      LineView line = v.line(s, f).orElse(null);
      if (line == null) continue;
      int n = scratch.fill(line.bytes());
      List<MatchSpan> spans = matcher.findAll(scratch.array(), n);
      if (spans.isEmpty()) continue;
      if (first == null) first = MatchPosition.of(f, spans.get(0));
      if (lineCount == lines.length) {
        lines = Arrays.copyOf(lines, lineCount * 2);
        before = Arrays.copyOf(before, lineCount * 2);
      }
      lines[lineCount] = f;
      before[lineCount] = total;
      lineCount++;
      total += spans.size();
    }

    SearchSession session =
        new SearchSession(
            query,
            matcher,
            s,
            v,
            cacheCapacity,
            Arrays.copyOf(lines, lineCount),
            Arrays.copyOf(before, lineCount),
            total);
    session.currentPosition = first;
    if (log.isDebugEnabled()) {
      log.debug(
          "Search '{}' found {} matches on {} of {} lines in {} ms",
          query,
          total,
          lineCount,
          v.size(),
          (System.nanoTime() - started) / 1_000_000L);
    }
    return Optional.of(session);
  }

  public String query() {
    return query;
  }

  public long totalMatches() {
    return totalMatches;
  }

  public boolean hasMatches() {
    return totalMatches > 0;
  }

  /** Zero-based ordinal of the current match; meaningful only when there are matches. */
  public long currentOrdinal() {
    return currentOrdinal;
  }

  public Optional<MatchPosition> currentPosition() {
    return Optional.ofNullable(currentPosition);
  }

  /** {@code "{current+1}/{total}"}, or empty when nothing matched. */
  public Optional<String> displayOrdinal() {
    if (totalMatches == 0) return Optional.empty();
    return Optional.of((currentOrdinal + 1) + "/" + totalMatches);
  }

  /** Whether the current match starts at {@code byteOffset} on filtered line {@code filteredIdx}. */
  public boolean isCurrent(int filteredIdx, int byteOffset) {
    MatchPosition p = currentPosition;
    return p != null && p.filteredIndex() == filteredIdx && p.byteOffset() == byteOffset;
  }

  /** Spans on filtered line {@code filteredIdx}, served from an LRU cache; empty when out of range. */
  public List<MatchSpan> lineMatches(int filteredIdx) {
    List<MatchSpan> cached = cache.get(filteredIdx);
    if (cached != null) return cached;
    LineView line = view.line(store, filteredIdx).orElse(null);
    if (line == null) return List.of();
    List<MatchSpan> spans = spansOf(line);
    cache.put(filteredIdx, spans);
    return cache.get(filteredIdx);
  }

  int cachedLineCount() {
    return cache.size();
  }

  boolean isCached(int filteredIdx) {
    return cache.contains(filteredIdx);
  }

  /** Moves to the following match, wrapping from the last to the first. */
  public Optional<MatchPosition> nextMatch() {
    if (totalMatches == 0) return Optional.empty();
    return jumpTo((currentOrdinal + 1) % totalMatches);
  }

  /** Moves to the preceding match, wrapping from the first to the last. */
  public Optional<MatchPosition> prevMatch() {
    if (totalMatches == 0) return Optional.empty();
    return jumpTo(currentOrdinal == 0 ? totalMatches - 1 : currentOrdinal - 1);
  }

  /** Makes match {@code ordinal} current; out-of-range ordinals change nothing. */
  public Optional<MatchPosition> jumpTo(long ordinal) {
    if (ordinal < 0 || ordinal >= totalMatches) return Optional.empty();
    MatchPosition p = resolve(ordinal);
    if (p == null) return Optional.empty();
    currentOrdinal = ordinal;
    currentPosition = p;
    return Optional.of(p);
  }

  private MatchPosition resolve(long ordinal) {
    int k = Arrays.binarySearch(matchesBefore, ordinal);
    if (k < 0) k = -k - 2;
    // matchesBefore is strictly increasing: every listed line has at least one hit
    int filteredIdx = matchLines[k];
    LineView line = view.line(store, filteredIdx).orElse(null);
    if (line == null) return null;
    List<MatchSpan> spans = spansOf(line);
    int within = (int) (ordinal - matchesBefore[k]);
    if (within >= spans.size()) return null;
    return MatchPosition.of(filteredIdx, spans.get(within));
  }

  private List<MatchSpan> spansOf(LineView line) {
    int n = scratch.fill(line.bytes());
    return matcher.findAll(scratch.array(), n);
  }

  @Override
  public String toString() {
    return "SearchSession['" + query + "', " + totalMatches + " matches]";
  }
}
