package cafe.woden.logbrowser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import cafe.woden.logbrowser.app.FilteredViewWriter;
import cafe.woden.logbrowser.app.ViewerCommandParser;
import cafe.woden.logbrowser.config.LogBrowserProperties;
import cafe.woden.logbrowser.loading.LogFileLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class LogBrowserAppTest {

  @TempDir Path dir;

  @Autowired LogBrowserProperties props;
  @Autowired LogFileLoader loader;
  @Autowired ViewerCommandParser parser;

  @Test
  void contextStartsWithNoFilesConfigured() {
    assertNotNull(loader);
    assertEquals(List.of(), props.files());
    assertEquals(100, props.search().cacheCapacity());
  }

  @Test
  void headlessRunFiltersAndExportsLoadedFiles() throws Exception {
    Path a = write("a.log", "INFO boot\nERROR disk full\nDEBUG error dump\n");
    Path b = write("b.log", "ERROR retry failed\nINFO done\n");
    Path out = dir.resolve("export.log");
    LogBrowserProperties config =
        new LogBrowserProperties(
            List.of(a.toString()),
            List.of("error"),
            List.of("debug"),
            "disk",
            out.toString(),
            null,
            null,
            new LogBrowserProperties.Loader(null, null, null, null, Duration.ofMillis(5)));
    ExecutorService exec = Executors.newSingleThreadExecutor();
    try {
      new LogBrowserApp()
          .run(config, new LogFileLoader(config, exec), parser, new FilteredViewWriter())
          .run(new DefaultApplicationArguments(b.toString(), dir.resolve("missing.log").toString()));
    } finally {
      exec.shutdownNow();
    }

    assertEquals(
        "ERROR disk full\nERROR retry failed\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  private Path write(String name, String content) throws IOException {
    return Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
  }
}
