package cafe.woden.logbrowser.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logbrowser.filter.FilterKind;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ViewerCommandParserTest {

  private final ViewerCommandParser parser =
      new ViewerCommandParser(Clock.fixed(Instant.parse("2026-02-13T10:30:45Z"), ZoneOffset.UTC));

  @Test
  void parsesIncludeAndExcludeFilters() {
    assertEquals(
        new ViewerCommand.AddFilter(FilterKind.INCLUDE, "connection reset"),
        parser.parse("filter connection reset"));
    assertEquals(
        new ViewerCommand.AddFilter(FilterKind.EXCLUDE, "debug"), parser.parse("  filter-out   debug "));
  }

  @Test
  void missingPatternGivesUsage() {
    assertEquals(new ViewerCommand.Error("Usage: filter <pattern>"), parser.parse("filter"));
    assertEquals(new ViewerCommand.Error("Usage: filter-out <pattern>"), parser.parse("filter-out   "));
  }

  @Test
  void writeUsesGivenOrTimestampedName() {
    assertEquals(new ViewerCommand.Write("out.log"), parser.parse("w out.log"));
    assertEquals(
        new ViewerCommand.Write("filtered-logs-20260213-103045.log"), parser.parse("write"));
  }

  @Test
  void simpleCommands() {
    assertInstanceOf(ViewerCommand.Quit.class, parser.parse("q"));
    assertInstanceOf(ViewerCommand.Quit.class, parser.parse("quit"));
    assertInstanceOf(ViewerCommand.ClearFilters.class, parser.parse("filter-clear"));
    assertInstanceOf(ViewerCommand.ListFilters.class, parser.parse("list-filters"));
    assertInstanceOf(ViewerCommand.Empty.class, parser.parse("   "));
    assertInstanceOf(ViewerCommand.Empty.class, parser.parse(null));
  }

  @Test
  void unknownCommand() {
    assertEquals(new ViewerCommand.Error("Unknown command: frobnicate"), parser.parse("frobnicate now"));
  }

  @Test
  void completionCyclesThroughMatchingCommands() {
    assertEquals("filter", parser.complete("", 0).orElseThrow().command());
    assertEquals("filter", parser.complete("fi", 0).orElseThrow().command());
    assertEquals("filter-clear", parser.complete("fi", 1).orElseThrow().command());
    assertEquals("filter-out", parser.complete("FI", 2).orElseThrow().command());

    ViewerCommandParser.Completion wrapped = parser.complete("fi", 3).orElseThrow();
    assertEquals("filter", wrapped.command());
    assertEquals(0, wrapped.index());

    assertEquals("write", parser.complete("w", 0).orElseThrow().command());
    assertTrue(parser.complete("zzz", 0).isEmpty());
  }
}
