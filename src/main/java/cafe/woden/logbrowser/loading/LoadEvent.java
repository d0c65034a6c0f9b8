package cafe.woden.logbrowser.loading;

import cafe.woden.logbrowser.storage.LogStore;
import cafe.woden.logbrowser.storage.LogStoreException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** What the background loader hands to the host, in load order. */
public sealed interface LoadEvent permits LoadEvent.Batch, LoadEvent.Failed, LoadEvent.Completed {

  /** One or more freshly loaded files merged into a single store. */
  record Batch(LogStore store, List<Path> files) implements LoadEvent {
    public Batch {
      Objects.requireNonNull(store, "store");
      files = files == null ? List.of() : List.copyOf(files);
    }
  }

  /** A file that could not be loaded after every allowed attempt. */
  record Failed(Path path, LogStoreException error) implements LoadEvent {
    public Failed {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(error, "error");
    }

    public String message() {
      return "Failed to load " + path + ": " + error.getMessage();
    }
  }

  /** Always the last event of a run. */
  record Completed(LoadReport report) implements LoadEvent {
    public Completed {
      Objects.requireNonNull(report, "report");
    }
  }
}
