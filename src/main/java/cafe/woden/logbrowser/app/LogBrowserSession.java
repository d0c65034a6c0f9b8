package cafe.woden.logbrowser.app;

import cafe.woden.logbrowser.config.LogBrowserProperties;
import cafe.woden.logbrowser.filter.FilterKind;
import cafe.woden.logbrowser.filter.FilterList;
import cafe.woden.logbrowser.filter.FilteredView;
import cafe.woden.logbrowser.loading.LoadChannel;
import cafe.woden.logbrowser.loading.LoadEvent;
import cafe.woden.logbrowser.loading.LoadReport;
import cafe.woden.logbrowser.match.MatchSpan;
import cafe.woden.logbrowser.search.MatchPosition;
import cafe.woden.logbrowser.search.MatchScroller;
import cafe.woden.logbrowser.search.SearchSession;
import cafe.woden.logbrowser.storage.LineView;
import cafe.woden.logbrowser.storage.LogStore;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Viewer state owned by a single thread: the store, its filters and filtered view, the search,
 * selection and scroll positions, and the status line.
 *
 * <p>Every filter change recomputes the filtered view and discards the search, since the search
 * was bound to the old view's indices. Query methods accept stale indices and answer with empty
 * results.
 */
public final class LogBrowserSession {
  private static final Logger log = LoggerFactory.getLogger(LogBrowserSession.class);

  private static final int HORIZONTAL_STEP = 4;

  private final ViewerCommandParser parser;
  private final FilteredViewWriter writer;
  private final int cacheCapacity;
  private final int scrollMargin;

  private final FilterList filters = new FilterList();
  private LogStore store = LogStore.empty();
  private FilteredView view = FilteredView.empty();
  private SearchSession search;
  private String searchQuery;

  private int selectedLine;
  private final LineSelection selection = new LineSelection();
  private int scrollOffset;
  private int horizontalScroll;
  private int viewportWidth;
  private int viewportHeight;
  private boolean wrapMode = true;

  private boolean filterListOpen;
  private int filterListSelected;
  private boolean quitRequested;
  private String statusMessage = "";
  private LoadingStatus loadingStatus = new LoadingStatus.Idle();
  private final List<String> loadWarnings = new ArrayList<>();

  public LogBrowserSession(
      ViewerCommandParser parser, FilteredViewWriter writer, LogBrowserProperties props) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.writer = Objects.requireNonNull(writer, "writer");
    LogBrowserProperties p =
        props != null
            ? props
            : new LogBrowserProperties(null, null, null, null, null, null, null, null);
    this.cacheCapacity = p.search().cacheCapacity();
    this.scrollMargin = p.search().scrollMargin();
    this.viewportWidth = p.viewport().width();
    this.viewportHeight = p.viewport().height();
  }

  // ---- store ----

  /** Replaces the store with {@code next}. */
  public void installStore(LogStore next) {
    store = next == null ? LogStore.empty() : next;
    refilter();
  }

  /** Appends a newly loaded batch after the lines already present. */
  public void appendStore(LogStore batch) {
    if (batch == null) return;
    store = store.fileCount() == 0 ? batch : LogStore.merge(List.of(store, batch));
    refilter();
  }

  /** Marks a load of {@code totalFiles} files as started. */
  public void startLoading(int totalFiles) {
    loadingStatus = new LoadingStatus.Loading(0, totalFiles);
    loadWarnings.clear();
  }

  /**
   * Installs whatever the loader has published since the last call, without blocking.
   *
   * @return number of events handled
   */
  public int poll(LoadChannel channel) {
    if (channel == null) return 0;
    return channel.drain(this::onLoadEvent);
  }

  private void onLoadEvent(LoadEvent event) {
    if (event instanceof LoadEvent.Batch batch) {
      appendStore(batch.store());
      if (loadingStatus instanceof LoadingStatus.Loading l) {
        loadingStatus = new LoadingStatus.Loading(l.current() + batch.files().size(), l.total());
      }
    } else if (event instanceof LoadEvent.Failed failed) {
      loadWarnings.add(failed.message());
      statusMessage = failed.message();
    } else if (event instanceof LoadEvent.Completed completed) {
      LoadReport report = completed.report();
      if (report.totalFiles() > 0 && report.loadedFiles() == 0) {
        loadingStatus = new LoadingStatus.Error("No log files could be loaded");
      } else {
        loadingStatus = new LoadingStatus.Complete();
      }
      if (report.hasFailures()) statusMessage = report.summary();
    }
  }

  public LoadingStatus loadingStatus() {
    return loadingStatus;
  }

  public List<String> loadWarnings() {
    return List.copyOf(loadWarnings);
  }

  public LogStore store() {
    return store;
  }

  public int totalLines() {
    return store.size();
  }

  // ---- filters ----

  public void addInclude(String pattern) {
    filters.addInclude(pattern);
    refilter();
  }

  public void addExclude(String pattern) {
    filters.addExclude(pattern);
    refilter();
  }

  public boolean removeInclude(int idx) {
    boolean removed = filters.removeInclude(idx);
    if (removed) refilter();
    return removed;
  }

  public boolean removeExclude(int idx) {
    boolean removed = filters.removeExclude(idx);
    if (removed) refilter();
    return removed;
  }

  /** Removes by position in {@link #describeFilters()}: includes first, then excludes. */
  public boolean removeFilter(int flatIndex) {
    boolean removed = filters.remove(flatIndex);
    if (!removed) return false;
    int total = filters.size();
    if (filterListSelected >= total && total > 0) filterListSelected = total - 1;
    if (filters.isEmpty()) filterListOpen = false;
    refilter();
    return true;
  }

  public void clearFilters() {
    filters.clear();
    refilter();
  }

  public List<String> describeFilters() {
    return filters.describe();
  }

  public FilterList filters() {
    return filters;
  }

  public boolean isFilterListOpen() {
    return filterListOpen;
  }

  public void closeFilterList() {
    filterListOpen = false;
  }

  public int filterListSelected() {
    return filterListSelected;
  }

  public void filterListDown() {
    if (filterListSelected + 1 < filters.size()) filterListSelected++;
  }

  public void filterListUp() {
    if (filterListSelected > 0) filterListSelected--;
  }

  /** Removes the rule under the filter-list cursor; the list closes once it is empty. */
  public boolean deleteSelectedFilter() {
    return removeFilter(filterListSelected);
  }

  private void refilter() {
    view = FilteredView.compute(store, filters);
    clearSearch();
    selection.clear();
    if (view.isEmpty()) {
      selectedLine = 0;
      scrollOffset = 0;
    } else {
      clampScroll();
    }
  }

  // ---- filtered view ----

  public FilteredView view() {
    return view;
  }

  public int filteredSize() {
    return view.size();
  }

  public Optional<LineView> filteredLine(int filteredIdx) {
    return view.line(store, filteredIdx);
  }

  public Optional<Instant> filteredTimestamp(int filteredIdx) {
    int idx = view.lineIndexAt(filteredIdx);
    return idx < 0 ? Optional.empty() : store.timestamp(idx);
  }

  // ---- search ----

  /** Starts a search for {@code query}; a blank query clears the current one. */
  public void submitSearch(String query) {
    String q = query == null ? "" : query.trim();
    if (q.isEmpty()) {
      clearSearch();
      return;
    }
    searchQuery = q;
    search = SearchSession.start(q, store, view, cacheCapacity).orElse(null);
    if (search != null && search.hasMatches()) {
      search.jumpTo(0).ifPresent(this::reveal);
    }
  }

  public void clearSearch() {
    search = null;
    searchQuery = null;
  }

  public boolean hasSearch() {
    return search != null;
  }

  public Optional<String> searchQuery() {
    return Optional.ofNullable(searchQuery);
  }

  public long totalMatches() {
    return search == null ? 0 : search.totalMatches();
  }

  /** {@code "3/42"} style position of the current match. */
  public Optional<String> currentMatchDisplay() {
    return search == null ? Optional.empty() : search.displayOrdinal();
  }

  public boolean isCurrentMatch(int filteredIdx, int byteOffset) {
    return search != null && search.isCurrent(filteredIdx, byteOffset);
  }

  public List<MatchSpan> lineMatches(int filteredIdx) {
    return search == null ? List.of() : search.lineMatches(filteredIdx);
  }

  public void nextMatch() {
    if (search != null) search.nextMatch().ifPresent(this::reveal);
  }

  public void prevMatch() {
    if (search != null) search.prevMatch().ifPresent(this::reveal);
  }

  /** Selects the match's line and scrolls both ways until it is comfortably visible. */
  private void reveal(MatchPosition p) {
    selectedLine = p.filteredIndex();
    clampScroll();
    LineView line = filteredLine(p.filteredIndex()).orElse(null);
    if (line == null) return;
    int startChar = MatchScroller.charOffset(line.bytes(), p.byteOffset());
    int endChar = MatchScroller.charOffset(line.bytes(), p.endOffset());
    horizontalScroll =
        MatchScroller.adjust(horizontalScroll, viewportWidth, startChar, endChar, scrollMargin);
  }

  // ---- viewport and scrolling ----

  public void setViewport(int width, int height) {
    viewportWidth = Math.max(1, width);
    viewportHeight = Math.max(1, height);
    clampScroll();
  }

  public void scrollDown() {
    statusMessage = "";
    if (selectedLine < view.size() - 1) {
      selectedLine++;
      selection.extend(LineSelection.Direction.DOWN);
    }
    clampScroll();
  }

  public void scrollUp() {
    statusMessage = "";
    if (selectedLine > 0) {
      selectedLine--;
      selection.extend(LineSelection.Direction.UP);
    }
    clampScroll();
  }

  public void scrollRight() {
    horizontalScroll += HORIZONTAL_STEP;
  }

  public void scrollLeft() {
    horizontalScroll = Math.max(0, horizontalScroll - HORIZONTAL_STEP);
  }

  public void goToTop() {
    selectedLine = 0;
    scrollOffset = 0;
  }

  public void goToBottom() {
    selectedLine = Math.max(0, view.size() - 1);
    clampScroll();
  }

  public void toggleWrap() {
    wrapMode = !wrapMode;
    statusMessage = wrapMode ? "Wrap mode enabled" : "Wrap mode disabled";
    clampScroll();
  }

  private void clampScroll() {
    if (view.isEmpty()) return;
    selectedLine = Math.min(selectedLine, view.size() - 1);
    int page = effectivePageHeight();
    if (selectedLine < scrollOffset) {
      scrollOffset = selectedLine;
    } else if (selectedLine >= scrollOffset + page) {
      scrollOffset = Math.max(0, selectedLine - (page - 1));
    }
  }

  /** Lines per page; wrapped lines are assumed to take two rows. */
  int effectivePageHeight() {
    return wrapMode ? Math.max(1, viewportHeight / 2) : viewportHeight;
  }

  public int selectedLine() {
    return selectedLine;
  }

  public int scrollOffset() {
    return scrollOffset;
  }

  public int horizontalScroll() {
    return horizontalScroll;
  }

  public int viewportWidth() {
    return viewportWidth;
  }

  public int viewportHeight() {
    return viewportHeight;
  }

  public boolean isWrapMode() {
    return wrapMode;
  }

  // ---- selection ----

  /** Starts a selection at the cursor, or marks an active one as extended toward the cursor. */
  public void toggleSelection() {
    if (!selection.isActive()) {
      selection.start(selectedLine);
      return;
    }
    selection
        .range(selectedLine)
        .ifPresent(
            r ->
                selection.extend(
                    selectedLine > r.start()
                        ? LineSelection.Direction.DOWN
                        : LineSelection.Direction.UP));
  }

  public void clearSelection() {
    selection.clear();
    statusMessage = "";
  }

  public boolean hasSelection() {
    return selection.isActive();
  }

  public Optional<LineSelection.Range> selectionRange() {
    return selection.range(selectedLine);
  }

  public boolean isSelected(int filteredIdx) {
    return selection.contains(filteredIdx, selectedLine);
  }

  /** Selected lines as lossy UTF-8 text joined by {@code \n}, or empty without a selection. */
  public Optional<String> selectedText() {
    LineSelection.Range range = selection.range(selectedLine).orElse(null);
    if (range == null) return Optional.empty();
    List<String> lines = new ArrayList<>(range.size());
    for (int i = range.start(); i <= range.end(); i++) {
      filteredLine(i).ifPresent(line -> lines.add(line.text()));
    }
    return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", lines));
  }

  // ---- commands ----

  /** Parses and runs one command line; the outcome is left in {@link #statusMessage()}. */
  public void execute(String commandLine) {
    ViewerCommand cmd = parser.parse(commandLine);
    if (cmd instanceof ViewerCommand.AddFilter add) {
      if (add.kind() == FilterKind.EXCLUDE) {
        addExclude(add.pattern());
        statusMessage = "Added filter-out: " + add.pattern();
      } else {
        addInclude(add.pattern());
        statusMessage = "Added filter: " + add.pattern();
      }
    } else if (cmd instanceof ViewerCommand.ClearFilters) {
      clearFilters();
      statusMessage = "Filters cleared";
    } else if (cmd instanceof ViewerCommand.ListFilters) {
      filterListSelected = 0;
      filterListOpen = true;
      statusMessage = "";
    } else if (cmd instanceof ViewerCommand.Write w) {
      statusMessage = writeFiltered(w.file());
    } else if (cmd instanceof ViewerCommand.Quit) {
      quitRequested = true;
      statusMessage = "";
    } else if (cmd instanceof ViewerCommand.Error err) {
      statusMessage = err.message();
    } else {
      statusMessage = "";
    }
  }

  private String writeFiltered(String file) {
    Path target;
    try {
      target = Path.of(file);
    } catch (InvalidPathException e) {
      return "Error: " + e.getMessage();
    }
    try {
      int count = writer.write(store, view, target);
      return "Saved " + count + " lines to " + file;
    } catch (IOException e) {
      log.warn("Could not write filtered view to {}", target, e);
      return "Error: " + e.getMessage();
    }
  }

  public ViewerCommandParser parser() {
    return parser;
  }

  public boolean isQuitRequested() {
    return quitRequested;
  }

  public String statusMessage() {
    return statusMessage;
  }
}
