package cafe.woden.logbrowser.filter;

import cafe.woden.logbrowser.match.AsciiLowercaseBuffer;
import cafe.woden.logbrowser.storage.LineView;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered include and exclude rules combined with AND / AND-NOT.
 *
 * <p>A line passes when every include rule is found in it and no exclude rule is. With no rules
 * every line passes, including the empty one. Comparison is case-insensitive for ASCII only.
 *
 * <p>Not thread-safe: the list owns a scratch buffer reused by every {@code matches} call.
 */
public final class FilterList {

  private final List<FilterRule> includes = new ArrayList<>();
  private final List<FilterRule> excludes = new ArrayList<>();
  private final AsciiLowercaseBuffer scratch = new AsciiLowercaseBuffer();

  public void addInclude(String pattern) {
    includes.add(FilterRule.include(pattern));
  }

  public void addExclude(String pattern) {
    excludes.add(FilterRule.exclude(pattern));
  }

  public void add(FilterKind kind, String pattern) {
    if (kind == FilterKind.EXCLUDE) {
      addExclude(pattern);
    } else {
      addInclude(pattern);
    }
  }

  /** Removes the include rule at {@code idx}; returns false when there is none. */
  public boolean removeInclude(int idx) {
    if (idx < 0 || idx >= includes.size()) return false;
    includes.remove(idx);
    return true;
  }

  public boolean removeExclude(int idx) {
    if (idx < 0 || idx >= excludes.size()) return false;
    excludes.remove(idx);
    return true;
  }

  /** Removes by position in {@link #describe()}: includes first, then excludes. */
  public boolean remove(int flatIndex) {
    if (flatIndex < includes.size()) return removeInclude(flatIndex);
    return removeExclude(flatIndex - includes.size());
  }

  public void clear() {
    includes.clear();
    excludes.clear();
  }

  public boolean matches(LineView line) {
    if (line == null) return isEmpty();
    return matches(line.bytes());
  }

  public boolean matches(ByteBuffer line) {
    if (isEmpty()) return true;
    int n = scratch.fill(line);
    return decide(scratch.array(), n);
  }

  public boolean matches(byte[] line, int length) {
    if (isEmpty()) return true;
    int n = scratch.fill(line, length);
    return decide(scratch.array(), n);
  }

  private boolean decide(byte[] lowered, int length) {
    for (FilterRule rule : includes) {
      if (!rule.isNeutral() && !rule.hits(lowered, length)) return false;
    }
    for (FilterRule rule : excludes) {
      if (!rule.isNeutral() && rule.hits(lowered, length)) return false;
    }
    return true;
  }

  public int size() {
    return includes.size() + excludes.size();
  }

  public boolean isEmpty() {
    return includes.isEmpty() && excludes.isEmpty();
  }

  public List<FilterRule> includes() {
    return List.copyOf(includes);
  }

  public List<FilterRule> excludes() {
    return List.copyOf(excludes);
  }

  /** Rules in flat order, one per entry, formatted as {@code "INCLUDE: text"}. */
  public List<String> describe() {
    List<String> out = new ArrayList<>(size());
    for (FilterRule r : includes) out.add(label(r));
    for (FilterRule r : excludes) out.add(label(r));
    return out;
  }

  private static String label(FilterRule r) {
    return r.kind().name().toUpperCase(Locale.ROOT) + ": " + r.pattern();
  }

  @Override
  public String toString() {
    return "FilterList" + describe();
  }
}
