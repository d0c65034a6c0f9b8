package cafe.woden.logbrowser.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * One input file mapped read-only into memory.
 *
 * <p>A single JVM mapping is capped at 2 GiB, so the file is mapped as consecutive segments of
 * {@code segmentSize} bytes. The mapped bytes are never written. The mapping stays valid for as
 * long as this object is reachable, which is why every {@link LineView} keeps a reference to its
 * file.
 */
public final class MappedLogFile {

  static final long DEFAULT_SEGMENT_SIZE = 1L << 30;

  private final Path path;
  private final long size;
  private final long segmentSize;
  private final ByteBuffer[] segments;

  private MappedLogFile(Path path, long size, long segmentSize, ByteBuffer[] segments) {
    this.path = path;
    this.size = size;
    this.segmentSize = segmentSize;
    this.segments = segments;
  }

  /** Maps {@code path} read-only. */
  public static MappedLogFile map(Path path) throws LogStoreException {
    return map(path, DEFAULT_SEGMENT_SIZE);
  }

  static MappedLogFile map(Path path, long segmentSize) throws LogStoreException {
    Objects.requireNonNull(path, "path");
    if (segmentSize <= 0 || segmentSize > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("segmentSize out of range: " + segmentSize);
    }
    if (Files.isDirectory(path)) {
      throw new LogStoreException(
          path, LogStoreException.Reason.UNREADABLE, "Not a regular file: " + path);
    }

    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      long size = channel.size();
      int count = (int) ((size + segmentSize - 1) / segmentSize);
      ByteBuffer[] segments = new ByteBuffer[count];
      for (int i = 0; i < count; i++) {
        long start = i * segmentSize;
        long len = Math.min(segmentSize, size - start);
        segments[i] = channel.map(FileChannel.MapMode.READ_ONLY, start, len);
      }
      return new MappedLogFile(path, size, segmentSize, segments);
    } catch (IOException e) {
      throw LogStoreException.from(path, e);
    }
  }

  public Path path() {
    return path;
  }

  /** File length in bytes at mapping time. */
  public long size() {
    return size;
  }

  int segmentCount() {
    return segments.length;
  }

  long segmentSize() {
    return segmentSize;
  }

  /** Absolute-indexed view of segment {@code i}; callers must not move its position. */
  ByteBuffer segment(int i) {
    return segments[i];
  }

  public byte byteAt(long offset) {
    Objects.checkIndex(offset, size);
    return segments[(int) (offset / segmentSize)].get((int) (offset % segmentSize));
  }

  /**
   * Returns a read-only buffer over {@code [offset, offset + length)}.
   *
   * <p>Ranges inside one segment are zero-copy slices of the mapping. A range that straddles a
   * segment boundary is assembled into a heap buffer.
   */
  public ByteBuffer slice(long offset, int length) {
    Objects.checkFromIndexSize(offset, length, size);
    if (length == 0) {
      return ByteBuffer.allocate(0).asReadOnlyBuffer();
    }
    int first = (int) (offset / segmentSize);
    int last = (int) ((offset + length - 1) / segmentSize);
    int pos = (int) (offset % segmentSize);
    if (first == last) {
      return segments[first].slice(pos, length).asReadOnlyBuffer();
    }

    byte[] joined = new byte[length];
    int written = 0;
    for (int s = first; s <= last; s++) {
      ByteBuffer seg = segments[s];
      int from = (s == first) ? pos : 0;
      int n = Math.min(seg.limit() - from, length - written);
      seg.get(from, joined, written, n);
      written += n;
    }
    return ByteBuffer.wrap(joined).asReadOnlyBuffer();
  }

  @Override
  public String toString() {
    return "MappedLogFile[" + path + ", " + size + " bytes]";
  }
}
