package cafe.woden.logbrowser.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Log browser configuration.
 */
@ConfigurationProperties(prefix = "logbrowser")
public record LogBrowserProperties(
    /** Log files to load at startup, in order. */
    List<String> files,

    /** Include rules applied before the first filter pass. */
    List<String> include,

    /** Exclude rules applied before the first filter pass. */
    List<String> exclude,

    /** Optional search submitted once loading finishes. Blank means none. */
    String searchQuery,

    /** Optional file the filtered view is written to after loading. */
    String exportPath,

    Search search,
    Viewport viewport,
    Loader loader
) {

  /** Search session tuning. */
  public record Search(
      /** Per-line span cache entries. Default: 100. */
      Integer cacheCapacity,

      /** Characters kept between a jumped-to match and the viewport edge. Default: 10. */
      Integer scrollMargin
  ) {
    public Search {
      if (cacheCapacity == null || cacheCapacity <= 0) cacheCapacity = 100;
      if (scrollMargin == null || scrollMargin < 0) scrollMargin = 10;
    }
  }

  /** Initial viewport size in character cells. */
  public record Viewport(Integer width, Integer height) {
    public Viewport {
      if (width == null || width <= 0) width = 80;
      if (height == null || height <= 0) height = 20;
    }
  }

  /** Background loader retry and batching. */
  public record Loader(
      /** Attempts per file when the host is out of file descriptors. Default: 5. */
      Integer maxAttempts,

      /** Delay before the second attempt; doubled for every further one. Default: 50ms. */
      Duration initialBackoff,

      /** Upper bound for a single retry delay. Default: 2s. */
      Duration maxBackoff,

      /** Loaded files merged into one published batch. Default: 1. */
      Integer batchFiles,

      /** How often the headless host drains the load channel. Default: 50ms. */
      Duration pollInterval
  ) {
    public Loader {
      if (maxAttempts == null || maxAttempts <= 0) maxAttempts = 5;
      if (initialBackoff == null || initialBackoff.isNegative()) {
        initialBackoff = Duration.ofMillis(50);
      }
      if (maxBackoff == null || maxBackoff.isNegative()) maxBackoff = Duration.ofSeconds(2);
      if (maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
      if (batchFiles == null || batchFiles <= 0) batchFiles = 1;
      if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
        pollInterval = Duration.ofMillis(50);
      }
    }

    /** Delay before attempt {@code attempt + 1}, given {@code attempt} failures so far. */
    public Duration backoffAfter(int attempt) {
      int shift = Math.min(30, Math.max(0, attempt - 1));
      long millis = initialBackoff.toMillis() << shift;
      if (millis < 0 || millis > maxBackoff.toMillis()) millis = maxBackoff.toMillis();
      return Duration.ofMillis(millis);
    }
  }

  public LogBrowserProperties {
    files = files == null ? List.of() : List.copyOf(files);
    include = include == null ? List.of() : List.copyOf(include);
    exclude = exclude == null ? List.of() : List.copyOf(exclude);
    if (searchQuery != null && searchQuery.isBlank()) searchQuery = null;
    if (exportPath != null && exportPath.isBlank()) exportPath = null;
    if (search == null) search = new Search(null, null);
    if (viewport == null) viewport = new Viewport(null, null);
    if (loader == null) loader = new Loader(null, null, null, null, null);
  }
}
