package cafe.woden.logbrowser.app;

import cafe.woden.logbrowser.filter.FilteredView;
import cafe.woden.logbrowser.storage.LineView;
import cafe.woden.logbrowser.storage.LogStore;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Saves the lines of a filtered view as UTF-8 text, one per line. */
@Component
public class FilteredViewWriter {
  private static final Logger log = LoggerFactory.getLogger(FilteredViewWriter.class);

  /**
   * Writes every line of {@code view}, decoded lossily and followed by {@code \n}, replacing
   * {@code path}.
   *
   * @return number of lines written
   */
  public int write(LogStore store, FilteredView view, Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (store == null || view == null) {
      Files.writeString(path, "", StandardCharsets.UTF_8);
      return 0;
    }
    int count = 0;
    try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (int i = 0; i < view.size(); i++) {
        LineView line = view.line(store, i).orElse(null);
        if (line == null) continue;
        out.write(line.text());
        out.write('\n');
        count++;
      }
    }
    log.info("Saved {} lines to {}", count, path);
    return count;
  }
}
