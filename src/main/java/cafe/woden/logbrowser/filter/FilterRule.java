package cafe.woden.logbrowser.filter;

import cafe.woden.logbrowser.match.BmhMatcher;
import java.util.Objects;

/**
 * One literal, case-insensitive filter rule.
 *
 * <p>The pattern is lowercased once and compiled to a single {@link BmhMatcher}. A rule with an
 * empty pattern never takes part in a decision.
 */
public record FilterRule(String pattern, FilterKind kind, BmhMatcher matcher) {

  public FilterRule {
    pattern = Objects.toString(pattern, "");
    kind = Objects.requireNonNullElse(kind, FilterKind.INCLUDE);
    if (matcher == null) matcher = BmhMatcher.forText(pattern);
  }

  public static FilterRule include(String pattern) {
    return new FilterRule(pattern, FilterKind.INCLUDE, null);
  }

  public static FilterRule exclude(String pattern) {
    return new FilterRule(pattern, FilterKind.EXCLUDE, null);
  }

  public boolean isNeutral() {
    return matcher.isEmpty();
  }

  /** Whether the already-lowercased {@code line[0, length)} contains the pattern. */
  boolean hits(byte[] lowercasedLine, int length) {
    return matcher.contains(lowercasedLine, length);
  }

  @Override
  public String toString() {
    return kind + " " + pattern;
  }
}
