package cafe.woden.logbrowser.app;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.logbrowser.filter.FilterList;
import cafe.woden.logbrowser.filter.FilteredView;
import cafe.woden.logbrowser.storage.LogStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilteredViewWriterTest {

  @TempDir Path dir;

  @Test
  void writesOnlyFilteredLinesEachTerminated() throws IOException {
    Path in =
        Files.write(
            dir.resolve("in.log"), "keep 1\ndrop\nkeep 2".getBytes(StandardCharsets.UTF_8));
    LogStore store = LogStore.fromFile(in);
    FilterList filters = new FilterList();
    filters.addInclude("keep");
    FilteredView view = FilteredView.compute(store, filters);
    Path out = dir.resolve("out.log");

    int count = new FilteredViewWriter().write(store, view, out);

    assertEquals(2, count);
    assertEquals("keep 1\nkeep 2\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void invalidUtf8IsWrittenLossily() throws IOException {
    Path in = Files.write(dir.resolve("bin.log"), new byte[] {'o', 'k', (byte) 0xff, '\n'});
    LogStore store = LogStore.fromFile(in);
    Path out = dir.resolve("out.log");

    new FilteredViewWriter().write(store, FilteredView.compute(store, new FilterList()), out);

    assertEquals("ok\uFFFD\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void nothingLoadedWritesAnEmptyFile() throws IOException {
    Path out = dir.resolve("empty.log");

    assertEquals(0, new FilteredViewWriter().write(null, null, out));
    assertEquals("", Files.readString(out));
  }
}
