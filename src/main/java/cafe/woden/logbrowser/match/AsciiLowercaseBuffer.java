package cafe.woden.logbrowser.match;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reusable scratch buffer holding an ASCII-lowercased copy of one line.
 *
 * <p>Only {@code A-Z} are folded; every other byte, including UTF-8 multi-byte sequences, is
 * copied unchanged. Each {@code fill} overwrites the buffer and resets {@link #length()}, so
 * bytes from an earlier line are never visible. Not thread-safe: give each owner its own.
 */
public final class AsciiLowercaseBuffer {

  private byte[] data;
  private int length;

  public AsciiLowercaseBuffer() {
    this(256);
  }

  public AsciiLowercaseBuffer(int initialCapacity) {
    this.data = new byte[Math.max(16, initialCapacity)];
  }

  /** Copies and lowercases the remaining bytes of {@code src} without moving its position. */
  public int fill(ByteBuffer src) {
    int n = src.remaining();
    ensureCapacity(n);
    src.get(src.position(), data, 0, n);
    lowercaseInPlace(data, n);
    length = n;
    return n;
  }

  public int fill(byte[] src, int srcLength) {
    ensureCapacity(srcLength);
    System.arraycopy(src, 0, data, 0, srcLength);
    lowercaseInPlace(data, srcLength);
    length = srcLength;
    return srcLength;
  }

  /** Backing array; only {@code [0, length())} is meaningful. */
  public byte[] array() {
    return data;
  }

  public int length() {
    return length;
  }

  private void ensureCapacity(int n) {
    if (n > data.length) {
      data = Arrays.copyOf(data, Math.max(n, data.length * 2));
    }
  }

  public static byte toLower(byte b) {
    return (b >= 'A' && b <= 'Z') ? (byte) (b + ('a' - 'A')) : b;
  }

  private static void lowercaseInPlace(byte[] bytes, int n) {
    for (int i = 0; i < n; i++) {
      bytes[i] = toLower(bytes[i]);
    }
  }

  /** UTF-8 bytes of {@code text} with ASCII letters lowercased. */
  public static byte[] lowercaseUtf8(String text) {
    byte[] bytes = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
    lowercaseInPlace(bytes, bytes.length);
    return bytes;
  }
}
