package cafe.woden.logbrowser.timestamp;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes the timestamp a log line starts with.
 *
 * <p>Layouts are tried in order and the first match wins:
 *
 * <ol>
 *   <li>the whole text against ISO-8601 with offset, ISO-8601 with {@code Z}, {@code yyyy-MM-dd
 *       HH:mm:ss}, web-log {@code dd/MMM/yyyy:HH:mm:ss +HHMM} and {@code yyyy/MM/dd HH:mm:ss}
 *       (fractional seconds optional where ISO allows them);
 *   <li>the text inside a leading {@code [...]} against the same layouts;
 *   <li>prefixes ending at the first {@code Z}, the first space, or a trailing UTC offset;
 *   <li>fixed-width ISO prefixes, the width taken from each layout.
 * </ol>
 *
 * <p>Layouts without an offset are read as UTC. Text that matches nothing yields empty.
 */
public final class TimestampDetector {

  /** Only this many leading bytes of a line are ever inspected. */
  public static final int MAX_PROBE_BYTES = 64;

  private record Layout(DateTimeFormatter formatter, boolean zoned) {}

  private record FixedWidth(Layout layout, int width) {}

  private static final Layout ISO_OFFSET =
      zoned(isoDateTime('T').appendOffset("+HH:MM", "+00:00"));
  private static final Layout ISO_UTC = local(isoDateTime('T').appendLiteral('Z'));
  private static final Layout ISO_LOCAL = local(isoDateTime('T'));
  private static final Layout SPACED = local(isoDateTime(' '));
  private static final Layout WEB_LOG =
      zoned(builder().appendPattern("dd/MMM/uuuu:HH:mm:ss").appendLiteral(' ')
          .appendOffset("+HHMM", "+0000"));
  private static final Layout SLASHED = local(builder().appendPattern("uuuu/MM/dd HH:mm:ss"));

  private static final List<Layout> FULL = List.of(ISO_OFFSET, ISO_UTC, SPACED, WEB_LOG, SLASHED);

  private static final List<FixedWidth> PREFIXES =
      List.of(
          new FixedWidth(ISO_UTC, expectedWidth("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")),
          new FixedWidth(ISO_UTC, expectedWidth("uuuu-MM-dd'T'HH:mm:ss'Z'")),
          new FixedWidth(ISO_LOCAL, expectedWidth("uuuu-MM-dd'T'HH:mm:ss.SSS")),
          new FixedWidth(ISO_LOCAL, expectedWidth("uuuu-MM-dd'T'HH:mm:ss")),
          new FixedWidth(SPACED, expectedWidth("uuuu-MM-dd HH:mm:ss.SSS")),
          new FixedWidth(SPACED, expectedWidth("uuuu-MM-dd HH:mm:ss")));

  private TimestampDetector() {}

  /** Cheap pre-check on a line's first byte: every recognized layout starts this way. */
  public static boolean mayStartTimestamp(byte first) {
    return (first >= '0' && first <= '9') || first == '[';
  }

  public static Optional<Instant> detect(String line) {
    if (line == null || line.isEmpty()) return Optional.empty();
    char first = line.charAt(0);
    if (first > 0x7f || !mayStartTimestamp((byte) first)) return Optional.empty();

    Instant ts = matchFull(line);
    if (ts == null && line.charAt(0) == '[') {
      int close = line.indexOf(']');
      if (close > 1) ts = matchFull(line.substring(1, close));
    }
    if (ts == null) ts = matchDelimitedPrefix(line);
    if (ts == null) ts = matchFixedWidthPrefix(line);
    return Optional.ofNullable(ts);
  }

  private static Instant matchFull(String text) {
    for (Layout layout : FULL) {
      Instant ts = parse(layout, text);
      if (ts != null) return ts;
    }
    return null;
  }

  private static Instant matchDelimitedPrefix(String line) {
    int z = line.indexOf('Z');
    if (z > 0) {
      Instant ts = matchFull(line.substring(0, z + 1));
      if (ts != null) return ts;
    }
    int space = line.indexOf(' ');
    if (space > 0) {
      Instant ts = matchFull(line.substring(0, space));
      if (ts != null) return ts;
    }
    Instant ts = matchOffsetTerminated(line, line.indexOf('+'));
    if (ts != null) return ts;
    // last dash only; a dash inside the date itself never starts an offset
    int dash = line.lastIndexOf('-');
    return dash > 10 ? matchOffsetTerminated(line, dash) : null;
  }

  private static Instant matchOffsetTerminated(String line, int sign) {
    if (sign <= 0) return null;
    // +HH:MM or +HHMM
    for (int width : new int[] {6, 5}) {
      int end = sign + width;
      if (end > line.length()) continue;
      Instant ts = matchFull(line.substring(0, end));
      if (ts != null) return ts;
    }
    return null;
  }

  private static Instant matchFixedWidthPrefix(String line) {
    for (FixedWidth p : PREFIXES) {
      if (line.length() < p.width()) continue;
      Instant ts = parse(p.layout(), line.substring(0, p.width()));
      if (ts != null) return ts;
    }
    return null;
  }

  private static Instant parse(Layout layout, String text) {
    ParsePosition pos = new ParsePosition(0);
    TemporalAccessor unresolved = layout.formatter().parseUnresolved(text, pos);
    if (unresolved == null || pos.getErrorIndex() >= 0 || pos.getIndex() != text.length()) {
      return null;
    }
    try {
      TemporalAccessor parsed = layout.formatter().parse(text);
      if (layout.zoned()) return OffsetDateTime.from(parsed).toInstant();
      return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeException e) {
      // shape matched but the values did not (e.g. month 13)
      return null;
    }
  }

  /** Character width of a pattern, with literal quotes removed. */
  static int expectedWidth(String pattern) {
    return pattern.replace("'", "").length();
  }

  private static DateTimeFormatterBuilder builder() {
    return new DateTimeFormatterBuilder().parseCaseInsensitive();
  }

  private static DateTimeFormatterBuilder isoDateTime(char separator) {
    return builder()
        .appendPattern("uuuu-MM-dd")
        .appendLiteral(separator)
        .appendPattern("HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true);
  }

  private static Layout zoned(DateTimeFormatterBuilder b) {
    return new Layout(finish(b), true);
  }

  private static Layout local(DateTimeFormatterBuilder b) {
    return new Layout(finish(b), false);
  }

  private static DateTimeFormatter finish(DateTimeFormatterBuilder b) {
    return b.toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT)
        .withChronology(IsoChronology.INSTANCE);
  }
}
