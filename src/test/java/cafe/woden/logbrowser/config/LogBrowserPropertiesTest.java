package cafe.woden.logbrowser.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class LogBrowserPropertiesTest {

  @Test
  void missingValuesFallBackToDefaults() {
    LogBrowserProperties props =
        new LogBrowserProperties(null, null, null, "  ", "", null, null, null);

    assertTrue(props.files().isEmpty());
    assertNull(props.searchQuery());
    assertNull(props.exportPath());
    assertEquals(100, props.search().cacheCapacity());
    assertEquals(10, props.search().scrollMargin());
    assertEquals(80, props.viewport().width());
    assertEquals(20, props.viewport().height());
    assertEquals(5, props.loader().maxAttempts());
    assertEquals(Duration.ofMillis(50), props.loader().initialBackoff());
    assertEquals(Duration.ofSeconds(2), props.loader().maxBackoff());
    assertEquals(1, props.loader().batchFiles());
    assertEquals(Duration.ofMillis(50), props.loader().pollInterval());
  }

  @Test
  void backoffDoublesUpToTheCap() {
    LogBrowserProperties.Loader loader =
        new LogBrowserProperties.Loader(
            10, Duration.ofMillis(50), Duration.ofMillis(300), null, null);

    assertEquals(Duration.ofMillis(50), loader.backoffAfter(1));
    assertEquals(Duration.ofMillis(100), loader.backoffAfter(2));
    assertEquals(Duration.ofMillis(200), loader.backoffAfter(3));
    assertEquals(Duration.ofMillis(300), loader.backoffAfter(4));
    assertEquals(Duration.ofMillis(300), loader.backoffAfter(60));
  }

  @Test
  void bindsFromRelaxedPropertyNames() {
    Map<String, Object> source =
        Map.of(
            "logbrowser.files[0]", "/var/log/app.log",
            "logbrowser.files[1]", "/var/log/worker.log",
            "logbrowser.include[0]", "error",
            "logbrowser.search-query", "timeout",
            "logbrowser.search.cache-capacity", "250",
            "logbrowser.loader.initial-backoff", "10ms",
            "logbrowser.loader.batch-files", "4");

    LogBrowserProperties props =
        new Binder(new MapConfigurationPropertySource(source))
            .bind("logbrowser", LogBrowserProperties.class)
            .get();

    assertEquals(List.of("/var/log/app.log", "/var/log/worker.log"), props.files());
    assertEquals(List.of("error"), props.include());
    assertEquals("timeout", props.searchQuery());
    assertEquals(250, props.search().cacheCapacity());
    assertEquals(10, props.search().scrollMargin());
    assertEquals(Duration.ofMillis(10), props.loader().initialBackoff());
    assertEquals(4, props.loader().batchFiles());
  }
}
