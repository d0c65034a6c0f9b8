package cafe.woden.logbrowser.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Read-only window over one line's bytes inside a {@link MappedLogFile}.
 *
 * <p>Views are only handed out by {@link LogStore}; each one holds its file so the mapping
 * outlives the view.
 */
public final class LineView {

  private final MappedLogFile file;
  private final ByteBuffer bytes;

  LineView(MappedLogFile file, ByteBuffer bytes) {
    this.file = file;
    this.bytes = bytes;
  }

  /** Line length in bytes. */
  public int length() {
    return bytes.limit();
  }

  public boolean isEmpty() {
    return bytes.limit() == 0;
  }

  public byte byteAt(int index) {
    return bytes.get(index);
  }

  /** A fresh read-only buffer positioned at the start of the line. */
  public ByteBuffer bytes() {
    return bytes.duplicate();
  }

  public byte[] toByteArray() {
    byte[] out = new byte[bytes.limit()];
    bytes.get(0, out);
    return out;
  }

  /**
   * Lossy UTF-8 projection: malformed sequences become U+FFFD, so the character length can
   * differ from {@link #length()}.
   */
  public String text() {
    return StandardCharsets.UTF_8.decode(bytes.duplicate()).toString();
  }

  /** Lossy UTF-8 projection of the first {@code byteCount} bytes. */
  public String textPrefix(int byteCount) {
    int n = Math.max(0, Math.min(byteCount, bytes.limit()));
    return StandardCharsets.UTF_8.decode(bytes.slice(0, n)).toString();
  }

  MappedLogFile file() {
    return file;
  }

  @Override
  public String toString() {
    return text();
  }
}
