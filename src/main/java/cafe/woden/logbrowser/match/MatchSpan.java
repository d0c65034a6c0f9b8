package cafe.woden.logbrowser.match;

/** A {@code [start, end)} byte range of one hit within a line. */
public record MatchSpan(int start, int end) {

  public MatchSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }
}
