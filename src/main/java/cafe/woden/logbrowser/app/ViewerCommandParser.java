package cafe.woden.logbrowser.app;

import cafe.woden.logbrowser.filter.FilterKind;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Parses viewer command lines ({@code filter}, {@code write}, {@code quit}, ...). */
@Component
public class ViewerCommandParser {

  /** Command names offered by completion, in cycling order. */
  public static final List<String> COMMANDS =
      List.of("filter", "filter-clear", "filter-out", "list-filters", "quit", "write");

  private static final DateTimeFormatter EXPORT_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT);

  private final Clock clock;

  public ViewerCommandParser() {
    this(Clock.systemDefaultZone());
  }

  ViewerCommandParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ViewerCommand parse(String raw) {
    String line = raw == null ? "" : raw.trim();
    int space = line.indexOf(' ');
    String cmd = space < 0 ? line : line.substring(0, space);
    String arg = space < 0 ? "" : line.substring(space + 1).trim();

    switch (cmd) {
      case "" -> {
        return new ViewerCommand.Empty();
      }
      case "q", "quit" -> {
        return new ViewerCommand.Quit();
      }
      case "w", "write" -> {
        return new ViewerCommand.Write(arg.isEmpty() ? defaultExportName() : arg);
      }
      case "filter" -> {
        if (arg.isEmpty()) return new ViewerCommand.Error("Usage: filter <pattern>");
        return new ViewerCommand.AddFilter(FilterKind.INCLUDE, arg);
      }
      case "filter-out" -> {
        if (arg.isEmpty()) return new ViewerCommand.Error("Usage: filter-out <pattern>");
        return new ViewerCommand.AddFilter(FilterKind.EXCLUDE, arg);
      }
      case "filter-clear" -> {
        return new ViewerCommand.ClearFilters();
      }
      case "list-filters" -> {
        return new ViewerCommand.ListFilters();
      }
      default -> {
        return new ViewerCommand.Error("Unknown command: " + cmd);
      }
    }
  }

  /** {@code filtered-logs-yyyyMMdd-HHmmss.log} in local time. */
  public String defaultExportName() {
    return "filtered-logs-" + LocalDateTime.now(clock).format(EXPORT_STAMP) + ".log";
  }

  /**
   * The {@code index}-th command starting with {@code prefix} (case-insensitive), cycling through
   * the candidates.
   *
   * @return the completed name and the effective index, or empty when nothing starts that way
   */
  public Optional<Completion> complete(String prefix, int index) {
    String p = Objects.toString(prefix, "").toLowerCase(Locale.ROOT);
    List<String> matches = new ArrayList<>();
    for (String c : COMMANDS) {
      if (c.startsWith(p)) matches.add(c);
    }
    if (matches.isEmpty()) return Optional.empty();
    int i = Math.floorMod(index, matches.size());
    return Optional.of(new Completion(matches.get(i), i));
  }

  /** One completion candidate and its position among all candidates for the prefix. */
  public record Completion(String command, int index) {}
}
