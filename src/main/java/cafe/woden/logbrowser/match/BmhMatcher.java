package cafe.woden.logbrowser.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Boyer-Moore-Horspool substring search over bytes.
 *
 * <p>Matching is byte-exact; callers fold case before building the matcher and before handing in
 * a haystack. After a hit the window moves by one byte, so overlapping occurrences are all
 * reported. Instances are immutable and safe to share.
 */
public final class BmhMatcher {

  private static final int ALPHABET = 256;

  private final byte[] pattern;
  private final int[] skip;

  public BmhMatcher(byte[] pattern) {
    this.pattern = pattern == null ? new byte[0] : pattern.clone();
    this.skip = buildSkipTable(this.pattern);
  }

  /** Matcher for the ASCII-lowercased UTF-8 bytes of {@code text}. */
  public static BmhMatcher forText(String text) {
    return new BmhMatcher(AsciiLowercaseBuffer.lowercaseUtf8(text));
  }

  private static int[] buildSkipTable(byte[] pattern) {
    int m = pattern.length;
    int[] table = new int[ALPHABET];
    Arrays.fill(table, Math.max(1, m));
    // the last byte keeps the default so a full match never yields a zero skip
    for (int i = 0; i < m - 1; i++) {
      table[pattern[i] & 0xff] = m - 1 - i;
    }
    return table;
  }

  public boolean isEmpty() {
    return pattern.length == 0;
  }

  public int patternLength() {
    return pattern.length;
  }

  int skipFor(byte b) {
    return skip[b & 0xff];
  }

  public List<MatchSpan> findAll(byte[] haystack) {
    return findAll(haystack, haystack == null ? 0 : haystack.length);
  }

  /** All hits within {@code haystack[0, length)}, ordered by start. */
  public List<MatchSpan> findAll(byte[] haystack, int length) {
    int m = pattern.length;
    if (m == 0 || haystack == null || m > length) return List.of();

    List<MatchSpan> out = new ArrayList<>();
    if (m == 1) {
      byte b = pattern[0];
      for (int i = 0; i < length; i++) {
        if (haystack[i] == b) out.add(new MatchSpan(i, i + 1));
      }
      return out;
    }

    int pos = 0;
    int last = length - m;
    while (pos <= last) {
      if (matchesAt(haystack, pos)) {
        out.add(new MatchSpan(pos, pos + m));
        pos++;
      } else {
        pos += skip[haystack[pos + m - 1] & 0xff];
      }
    }
    return out;
  }

  public boolean contains(byte[] haystack) {
    return contains(haystack, haystack == null ? 0 : haystack.length);
  }

  /** Whether {@code haystack[0, length)} holds at least one hit. */
  public boolean contains(byte[] haystack, int length) {
    int m = pattern.length;
    if (m == 0 || haystack == null || m > length) return false;
    if (m == 1) {
      byte b = pattern[0];
      for (int i = 0; i < length; i++) {
        if (haystack[i] == b) return true;
      }
      return false;
    }

    int pos = 0;
    int last = length - m;
    while (pos <= last) {
      if (matchesAt(haystack, pos)) return true;
      pos += skip[haystack[pos + m - 1] & 0xff];
    }
    return false;
  }

  /** Compares right to left; a mismatch at any position, the first included, rejects the window. */
  private boolean matchesAt(byte[] haystack, int pos) {
    for (int j = pattern.length - 1; j >= 0; j--) {
      if (haystack[pos + j] != pattern[j]) return false;
    }
    return true;
  }
}
