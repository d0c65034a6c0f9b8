package cafe.woden.logbrowser.loading;

import java.nio.file.Path;
import java.util.List;

/** Outcome of one load run. */
public record LoadReport(int totalFiles, int loadedFiles, long totalLines, List<Path> failedFiles) {

  public LoadReport {
    failedFiles = failedFiles == null ? List.of() : List.copyOf(failedFiles);
  }

  public boolean hasFailures() {
    return !failedFiles.isEmpty();
  }

  public String summary() {
    String base = "Loaded " + loadedFiles + " of " + totalFiles + " files (" + totalLines + " lines)";
    return hasFailures() ? base + ", " + failedFiles.size() + " failed" : base;
  }
}
