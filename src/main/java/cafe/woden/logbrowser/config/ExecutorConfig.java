package cafe.woden.logbrowser.config;

import cafe.woden.logbrowser.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>File loading gets a single dedicated thread so files are opened in order and the host thread
 * never blocks on I/O.
 */
@Configuration
public class ExecutorConfig {
  public static final String LOG_LOADER_EXECUTOR = "logLoaderExecutor";

  @Bean(name = LOG_LOADER_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService logLoaderExecutor() {
    return NamedThreads.newSingleThreadExecutor("logbrowser-loader");
  }
}
