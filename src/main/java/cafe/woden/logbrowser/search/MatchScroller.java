package cafe.woden.logbrowser.search;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** Horizontal scroll rule that keeps a freshly selected match away from the viewport edges. */
public final class MatchScroller {

  public static final int DEFAULT_MARGIN = 10;

  private MatchScroller() {}

  /**
   * New horizontal scroll offset, in characters.
   *
   * <p>A match left of {@code scroll} moves the view to {@code start - margin}. A match ending
   * past {@code scroll + width - margin} moves it to {@code end + margin - width}. Both clamp at
   * zero; a match already inside leaves {@code scroll} unchanged.
   */
  public static int adjust(
      int scroll, int viewportWidth, int matchStartChar, int matchEndChar, int margin) {
    int current = Math.max(0, scroll);
    if (matchStartChar < current) {
      return Math.max(0, matchStartChar - margin);
    }
    int rightEdge = current + Math.max(0, viewportWidth - margin);
    if (matchEndChar > rightEdge) {
      return Math.max(0, matchEndChar + margin - viewportWidth);
    }
    return current;
  }

  /**
   * Character count of the first {@code byteCount} bytes of {@code line}, decoded as UTF-8 with
   * malformed input replaced. The buffer's position is not moved.
   */
  public static int charOffset(ByteBuffer line, int byteCount) {
    int n = Math.max(0, Math.min(byteCount, line.remaining()));
    ByteBuffer prefix = line.slice(line.position(), n);
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      CharSequence text = decoder.decode(prefix);
      return Character.codePointCount(text, 0, text.length());
    } catch (CharacterCodingException e) {
      // REPLACE never reports; fall back to bytes
      return n;
    }
  }
}
