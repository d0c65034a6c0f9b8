package cafe.woden.logbrowser.filter;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logbrowser.storage.LogStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilteredViewTest {

  @TempDir Path dir;

  private LogStore store;

  @BeforeEach
  void setUp() throws IOException {
    String content =
        String.join(
            "\n",
            "INFO boot",
            "ERROR disk full",
            "DEBUG cache miss",
            "ERROR debug dump written",
            "WARN slow request",
            "error retry scheduled");
    Path p = Files.write(dir.resolve("app.log"), content.getBytes(StandardCharsets.UTF_8));
    store = LogStore.fromFile(p);
  }

  @Test
  void keepsPassingLinesInStoreOrder() {
    FilterList filters = new FilterList();
    filters.addInclude("error");
    filters.addExclude("debug");

    FilteredView view = FilteredView.compute(store, filters);

    assertArrayEquals(new int[] {1, 5}, view.toArray());
    assertEquals("ERROR disk full", view.line(store, 0).orElseThrow().text());
  }

  @Test
  void noFiltersKeepsEveryLine() {
    FilteredView view = FilteredView.compute(store, new FilterList());

    assertEquals(store.size(), view.size());
    for (int i = 0; i < view.size(); i++) assertEquals(i, view.lineIndexAt(i));
  }

  @Test
  void recomputingWithUnchangedFiltersIsIdempotent() {
    FilterList filters = new FilterList();
    filters.addInclude("e");

    FilteredView first = FilteredView.compute(store, filters);
    FilteredView second = FilteredView.compute(store, filters);

    assertArrayEquals(first.toArray(), second.toArray());
    assertEquals(first, second);
  }

  @Test
  void staleIndicesAreAbsentNotErrors() {
    FilteredView view = FilteredView.compute(store, new FilterList());

    assertEquals(-1, view.lineIndexAt(-1));
    assertEquals(-1, view.lineIndexAt(view.size()));
    assertTrue(view.line(store, 100).isEmpty());
    assertTrue(FilteredView.empty().line(store, 0).isEmpty());
  }

  @Test
  void steppedPassEqualsFullCompute() {
    FilterList filters = new FilterList();
    filters.addExclude("debug");
    FilterPass pass = new FilterPass(store, filters);

    assertFalse(pass.advance(2));
    assertEquals(2, pass.processed());
    assertThrows(IllegalStateException.class, pass::result);
    assertFalse(pass.advance(2));
    assertTrue(pass.advance(2));

    assertEquals(FilteredView.compute(store, filters), pass.result());
  }

  @Test
  void emptyStoreGivesEmptyView() {
    FilteredView view = FilteredView.compute(LogStore.empty(), new FilterList());

    assertTrue(view.isEmpty());
  }
}
