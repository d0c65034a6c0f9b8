package cafe.woden.logbrowser.storage;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Column-wise line records: one slot per line in offset, length, file id and timestamp arrays.
 *
 * <p>Timestamps are epoch milliseconds. Filled once while indexing, then treated as immutable.
 */
final class LineIndex {

  static final long NO_TIMESTAMP = Long.MIN_VALUE;

  private static final LineIndex EMPTY = new LineIndex(0);

  private long[] offsets;
  private int[] lengths;
  private int[] fileIds;
  private long[] timestamps;
  private int size;

  LineIndex(int initialCapacity) {
    int cap = Math.max(0, initialCapacity);
    this.offsets = new long[cap];
    this.lengths = new int[cap];
    this.fileIds = new int[cap];
    this.timestamps = new long[cap];
  }

  static LineIndex empty() {
    return EMPTY;
  }

  void add(long offset, int length, int fileId, long timestampMillis) {
    if (size == offsets.length) grow();
    offsets[size] = offset;
    lengths[size] = length;
    fileIds[size] = fileId;
    timestamps[size] = timestampMillis;
    size++;
  }

  private void grow() {
    int next = Math.max(16, offsets.length + (offsets.length >> 1));
    offsets = Arrays.copyOf(offsets, next);
    lengths = Arrays.copyOf(lengths, next);
    fileIds = Arrays.copyOf(fileIds, next);
    timestamps = Arrays.copyOf(timestamps, next);
  }

  int size() {
    return size;
  }

  long offset(int i) {
    return offsets[i];
  }

  int length(int i) {
    return lengths[i];
  }

  int fileId(int i) {
    return fileIds[i];
  }

  long timestampMillis(int i) {
    return timestamps[i];
  }

  LineRecord record(int i) {
    long ts = timestamps[i];
    return new LineRecord(
        offsets[i], lengths[i], fileIds[i], ts == NO_TIMESTAMP ? null : Instant.ofEpochMilli(ts));
  }

  /**
   * Concatenates indexes in order, adding {@code fileIdBases[k]} to every file id of part k.
   */
  static LineIndex concat(List<LineIndex> parts, int[] fileIdBases) {
    int total = 0;
    for (LineIndex p : parts) total += p.size;
    LineIndex out = new LineIndex(total);
    int at = 0;
    for (int k = 0; k < parts.size(); k++) {
      LineIndex p = parts.get(k);
      System.arraycopy(p.offsets, 0, out.offsets, at, p.size);
      System.arraycopy(p.lengths, 0, out.lengths, at, p.size);
      System.arraycopy(p.timestamps, 0, out.timestamps, at, p.size);
      int base = fileIdBases[k];
      for (int i = 0; i < p.size; i++) {
        out.fileIds[at + i] = p.fileIds[i] + base;
      }
      at += p.size;
    }
    out.size = total;
    return out;
  }
}
