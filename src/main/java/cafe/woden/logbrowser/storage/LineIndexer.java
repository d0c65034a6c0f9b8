package cafe.woden.logbrowser.storage;

import cafe.woden.logbrowser.timestamp.TimestampDetector;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** Builds the {@link LineIndex} of one mapped file in a single linear pass. */
final class LineIndexer {

  static final byte DELIMITER = '\n';

  private LineIndexer() {}

  static LineIndex index(MappedLogFile file, int fileId) throws LogStoreException {
    LineIndex out = new LineIndex(estimateLines(file.size()));
    long lineStart = 0;
    long base = 0;
    for (int s = 0; s < file.segmentCount(); s++) {
      ByteBuffer seg = file.segment(s);
      int limit = seg.limit();
      for (int i = 0; i < limit; i++) {
        if (seg.get(i) == DELIMITER) {
          long end = base + i;
          addLine(out, file, fileId, lineStart, end);
          lineStart = end + 1;
        }
      }
      base += limit;
    }

    // unterminated last line
    if (lineStart < file.size()) {
      addLine(out, file, fileId, lineStart, file.size());
    }
    return out;
  }

  private static void addLine(LineIndex out, MappedLogFile file, int fileId, long start, long end)
      throws LogStoreException {
    long len = end - start;
    if (len > Integer.MAX_VALUE) {
      throw new LogStoreException(
          file.path(),
          LogStoreException.Reason.UNREADABLE,
          "Line at offset " + start + " of " + file.path() + " exceeds 2 GiB");
    }
    out.add(start, (int) len, fileId, detectTimestamp(file, start, (int) len));
  }

  private static long detectTimestamp(MappedLogFile file, long start, int length) {
    if (length == 0 || !TimestampDetector.mayStartTimestamp(file.byteAt(start))) {
      return LineIndex.NO_TIMESTAMP;
    }
    int probe = Math.min(length, TimestampDetector.MAX_PROBE_BYTES);
    String text = StandardCharsets.UTF_8.decode(file.slice(start, probe)).toString();
    Instant ts = TimestampDetector.detect(text).orElse(null);
    return ts == null ? LineIndex.NO_TIMESTAMP : ts.toEpochMilli();
  }

  private static int estimateLines(long size) {
    // ~100 bytes per line is typical for application logs.
    return (int) Math.min(1 << 20, Math.max(16, size / 100));
  }
}
