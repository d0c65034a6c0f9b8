package cafe.woden.logbrowser.app;

import java.util.Optional;

/**
 * Multi-line selection over filtered-view indices.
 *
 * <p>The anchor stays where the selection started; the other end is always the cursor, so the
 * selected range grows and shrinks as the cursor moves.
 */
public final class LineSelection {

  /** Which way the selection was last extended. */
  public enum Direction {
    UP,
    DOWN
  }

  /** Inclusive range of selected filtered-view indices. */
  public record Range(int start, int end) {
    public int size() {
      return end - start + 1;
    }
  }

  private int anchor = -1;
  private Direction direction;

  public boolean isActive() {
    return anchor >= 0;
  }

  /** Starts a selection anchored at {@code cursor}. */
  public void start(int cursor) {
    anchor = Math.max(0, cursor);
    direction = null;
  }

  public void extend(Direction toward) {
    if (isActive()) direction = toward;
  }

  public void clear() {
    anchor = -1;
    direction = null;
  }

  public Optional<Direction> direction() {
    return Optional.ofNullable(direction);
  }

  public Optional<Range> range(int cursor) {
    if (!isActive()) return Optional.empty();
    return Optional.of(new Range(Math.min(anchor, cursor), Math.max(anchor, cursor)));
  }

  public boolean contains(int idx, int cursor) {
    return range(cursor).map(r -> idx >= r.start() && idx <= r.end()).orElse(false);
  }
}
