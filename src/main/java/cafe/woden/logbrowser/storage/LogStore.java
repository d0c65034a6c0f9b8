package cafe.woden.logbrowser.storage;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, line-indexed view over one or more memory-mapped log files.
 *
 * <p>Line indices run from {@code 0} to {@code size() - 1} in file-load order, then physical line
 * order inside each file. A store is immutable; {@link #merge(List)} builds a new one.
 */
public final class LogStore {

  private static final Logger log = LoggerFactory.getLogger(LogStore.class);

  private static final LogStore EMPTY = new LogStore(List.of(), LineIndex.empty());

  private final List<MappedLogFile> files;
  private final LineIndex lines;

  private LogStore(List<MappedLogFile> files, LineIndex lines) {
    this.files = files;
    this.lines = lines;
  }

  /** A store with no files and no lines. */
  public static LogStore empty() {
    return EMPTY;
  }

  /**
   * Maps {@code path} and indexes its lines.
   *
   * @throws LogStoreException when the file is missing, unreadable, or the host is out of file
   *     descriptors; see {@link LogStoreException#reason()}
   */
  public static LogStore fromFile(Path path) throws LogStoreException {
    return fromFile(path, MappedLogFile.DEFAULT_SEGMENT_SIZE);
  }

  static LogStore fromFile(Path path, long segmentSize) throws LogStoreException {
    long started = System.nanoTime();
    MappedLogFile file = MappedLogFile.map(path, segmentSize);
    LineIndex index = LineIndexer.index(file, 0);
    if (log.isDebugEnabled()) {
      log.debug(
          "Indexed {} ({} bytes, {} lines) in {} ms",
          path,
          file.size(),
          index.size(),
          (System.nanoTime() - started) / 1_000_000L);
    }
    return new LogStore(List.of(file), index);
  }

  /**
   * Concatenates stores in order. File ids of each input are shifted by the number of files that
   * precede it, so every line keeps pointing at its own mapping.
   */
  public static LogStore merge(List<LogStore> stores) {
    if (stores == null || stores.isEmpty()) return EMPTY;
    if (stores.size() == 1 && stores.get(0) != null) return stores.get(0);

    List<MappedLogFile> files = new ArrayList<>();
    List<LineIndex> parts = new ArrayList<>(stores.size());
    int[] bases = new int[stores.size()];
    for (int k = 0; k < stores.size(); k++) {
      LogStore s = stores.get(k) == null ? EMPTY : stores.get(k);
      bases[k] = files.size();
      files.addAll(s.files);
      parts.add(s.lines);
    }
    return new LogStore(List.copyOf(files), LineIndex.concat(parts, bases));
  }

  /** Number of lines. */
  public int size() {
    return lines.size();
  }

  public boolean isEmpty() {
    return lines.size() == 0;
  }

  public int fileCount() {
    return files.size();
  }

  /** Paths of the mapped files in load order. */
  public List<Path> paths() {
    List<Path> out = new ArrayList<>(files.size());
    for (MappedLogFile f : files) out.add(f.path());
    return out;
  }

  /** The mapped file with the given id, if any. */
  public Optional<MappedLogFile> file(int fileId) {
    if (fileId < 0 || fileId >= files.size()) return Optional.empty();
    return Optional.of(files.get(fileId));
  }

  /** Zero-copy view of line {@code idx}; empty when {@code idx} is out of range. */
  public Optional<LineView> getLine(int idx) {
    return Optional.ofNullable(lineOrNull(idx));
  }

  /** Same as {@link #getLine(int)} without the {@code Optional} wrapper, for scan loops. */
  public LineView lineOrNull(int idx) {
    if (idx < 0 || idx >= lines.size()) return null;
    int fileId = lines.fileId(idx);
    if (fileId < 0 || fileId >= files.size()) return null;
    MappedLogFile file = files.get(fileId);
    long offset = lines.offset(idx);
    int length = lines.length(idx);
    if (offset + length > file.size()) return null;
    return new LineView(file, file.slice(offset, length));
  }

  public Optional<LineRecord> lineRecord(int idx) {
    if (idx < 0 || idx >= lines.size()) return Optional.empty();
    return Optional.of(lines.record(idx));
  }

  /** Detected timestamp of line {@code idx}, truncated to milliseconds. */
  public Optional<Instant> timestamp(int idx) {
    if (idx < 0 || idx >= lines.size()) return Optional.empty();
    long ts = lines.timestampMillis(idx);
    return ts == LineIndex.NO_TIMESTAMP ? Optional.empty() : Optional.of(Instant.ofEpochMilli(ts));
  }

  /** Visits every line in store order. */
  public void forEachLine(LineVisitor visitor) {
    int n = lines.size();
    for (int i = 0; i < n; i++) {
      LineView view = lineOrNull(i);
      if (view != null) visitor.visit(i, view);
    }
  }

  /** Callback for {@link #forEachLine(LineVisitor)}. */
  @FunctionalInterface
  public interface LineVisitor {
    void visit(int lineIndex, LineView line);
  }

  @Override
  public String toString() {
    return "LogStore[files=" + files.size() + ", lines=" + lines.size() + "]";
  }
}
