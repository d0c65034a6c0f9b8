package cafe.woden.logbrowser.storage;

import java.time.Instant;

/**
 * Indexed metadata for one line: where its bytes live, without the bytes themselves.
 *
 * @param offset byte offset of the first byte of the line within its file
 * @param length line length in bytes, excluding the {@code \n} delimiter
 * @param fileId position of the owning {@link MappedLogFile} inside its {@link LogStore}
 * @param timestamp timestamp detected at the start of the line, or {@code null}; kept at millisecond
 *     precision, so sub-millisecond digits of the source text are truncated
 */
public record LineRecord(long offset, int length, int fileId, Instant timestamp) {

  public LineRecord {
    if (offset < 0) throw new IllegalArgumentException("offset < 0");
    if (length < 0) throw new IllegalArgumentException("length < 0");
    if (fileId < 0) throw new IllegalArgumentException("fileId < 0");
  }

  public long endOffset() {
    return offset + length;
  }

  public boolean hasTimestamp() {
    return timestamp != null;
  }
}
