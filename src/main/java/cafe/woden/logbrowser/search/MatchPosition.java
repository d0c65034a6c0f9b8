package cafe.woden.logbrowser.search;

import cafe.woden.logbrowser.match.MatchSpan;

/** One search hit: the filtered-view line it sits on and its byte range within that line. */
public record MatchPosition(int filteredIndex, int byteOffset, int length) {

  public static MatchPosition of(int filteredIndex, MatchSpan span) {
    return new MatchPosition(filteredIndex, span.start(), span.length());
  }

  public int endOffset() {
    return byteOffset + length;
  }

  public MatchSpan span() {
    return new MatchSpan(byteOffset, endOffset());
  }
}
