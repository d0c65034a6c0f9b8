package cafe.woden.logbrowser;

import cafe.woden.logbrowser.app.FilteredViewWriter;
import cafe.woden.logbrowser.app.LogBrowserSession;
import cafe.woden.logbrowser.app.ViewerCommandParser;
import cafe.woden.logbrowser.config.LogBrowserProperties;
import cafe.woden.logbrowser.loading.LoadChannel;
import cafe.woden.logbrowser.loading.LogFileLoader;
import io.reactivex.rxjava3.disposables.Disposable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "LogBrowser",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(LogBrowserProperties.class)
public class LogBrowserApp {
  private static final Logger log = LoggerFactory.getLogger(LogBrowserApp.class);

  public static void main(String[] args) {
    SpringApplication.run(LogBrowserApp.class, args);
  }

  /**
   * Headless host: loads the configured files (plus any paths given as arguments), applies the
   * startup filters, runs the startup search and export, and logs a summary.
   */
  @Bean
  public ApplicationRunner run(
      LogBrowserProperties props,
      LogFileLoader loader,
      ViewerCommandParser parser,
      FilteredViewWriter writer) {
    return args -> {
      List<Path> files = inputFiles(props, args);
      if (files.isEmpty()) {
        log.info("No log files given; set logbrowser.files or pass paths as arguments");
        return;
      }

      LogBrowserSession session = new LogBrowserSession(parser, writer, props);
      for (String p : props.include()) {
        if (!p.isBlank()) session.addInclude(p);
      }
      for (String p : props.exclude()) {
        if (!p.isBlank()) session.addExclude(p);
      }

      LoadChannel channel = new LoadChannel();
      session.startLoading(files.size());
      Disposable loading = loader.start(files, channel);
      long pollMillis = props.loader().pollInterval().toMillis();
      try {
        while (session.loadingStatus().isLoading()) {
          session.poll(channel);
          if (!session.loadingStatus().isLoading()) break;
          if (loading.isDisposed() && channel.isEmpty()) break;
          Thread.sleep(pollMillis);
        }
      } finally {
        loading.dispose();
      }

      log.info(
          "{} of {} lines pass {} filter rule(s)",
          session.filteredSize(),
          session.totalLines(),
          session.filters().size());

      if (props.searchQuery() != null) {
        session.submitSearch(props.searchQuery());
        log.info(
            "Search '{}': {} matches{}",
            props.searchQuery(),
            session.totalMatches(),
            session.currentMatchDisplay().map(d -> ", current " + d).orElse(""));
      }

      if (props.exportPath() != null) {
        session.execute("write " + props.exportPath());
        log.info(session.statusMessage());
      }
    };
  }

  private static List<Path> inputFiles(LogBrowserProperties props, ApplicationArguments args) {
    List<Path> files = new ArrayList<>();
    for (String f : props.files()) {
      if (!f.isBlank()) files.add(Path.of(f.trim()));
    }
    for (String f : args.getNonOptionArgs()) {
      if (!f.isBlank()) files.add(Path.of(f.trim()));
    }
    return files;
  }
}
