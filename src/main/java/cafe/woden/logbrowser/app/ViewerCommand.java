package cafe.woden.logbrowser.app;

import cafe.woden.logbrowser.filter.FilterKind;
import java.util.Objects;

/** Parsed representation of a viewer command line. */
public sealed interface ViewerCommand permits
    ViewerCommand.AddFilter,
    ViewerCommand.ClearFilters,
    ViewerCommand.ListFilters,
    ViewerCommand.Write,
    ViewerCommand.Quit,
    ViewerCommand.Empty,
    ViewerCommand.Error {

  record AddFilter(FilterKind kind, String pattern) implements ViewerCommand {
    public AddFilter {
      kind = Objects.requireNonNullElse(kind, FilterKind.INCLUDE);
      pattern = Objects.toString(pattern, "");
    }
  }

  record ClearFilters() implements ViewerCommand {}

  record ListFilters() implements ViewerCommand {}

  /** Save the filtered view; {@code file} is already defaulted when none was given. */
  record Write(String file) implements ViewerCommand {}

  record Quit() implements ViewerCommand {}

  /** Blank input. */
  record Empty() implements ViewerCommand {}

  /** Unknown command or missing argument, with the message to show. */
  record Error(String message) implements ViewerCommand {}
}
