package cafe.woden.logbrowser.loading;

import cafe.woden.logbrowser.config.ExecutorConfig;
import cafe.woden.logbrowser.config.LogBrowserProperties;
import cafe.woden.logbrowser.storage.LogStore;
import cafe.woden.logbrowser.storage.LogStoreException;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Opens log files in order on the loader thread and publishes them as {@link LoadEvent}s.
 *
 * <p>A file whose open fails because the host ran out of file descriptors is retried with
 * exponential backoff; any other failure is reported once and loading moves on to the next file.
 * One failed file never stops the others.
 */
@Component
public class LogFileLoader {
  private static final Logger log = LoggerFactory.getLogger(LogFileLoader.class);

  private final LogBrowserProperties.Loader policy;
  private final LogStoreOpener opener;
  private final Scheduler loadScheduler;
  private final Scheduler delayScheduler;

  @Autowired
  public LogFileLoader(
      LogBrowserProperties props,
      @Qualifier(ExecutorConfig.LOG_LOADER_EXECUTOR) ExecutorService loaderExecutor) {
    this(
        props == null ? null : props.loader(),
        LogStoreOpener.MAPPED,
        Schedulers.from(loaderExecutor),
        Schedulers.computation());
  }

  LogFileLoader(
      LogBrowserProperties.Loader policy,
      LogStoreOpener opener,
      Scheduler loadScheduler,
      Scheduler delayScheduler) {
    this.policy =
        policy != null ? policy : new LogBrowserProperties.Loader(null, null, null, null, null);
    this.opener = Objects.requireNonNull(opener, "opener");
    this.loadScheduler = Objects.requireNonNull(loadScheduler, "loadScheduler");
    this.delayScheduler = Objects.requireNonNull(delayScheduler, "delayScheduler");
  }

  /**
   * Cold stream of load events for {@code paths}: batches and failures in file order, then one
   * {@link LoadEvent.Completed}. Never signals an error.
   */
  public Flowable<LoadEvent> events(List<Path> paths) {
    List<Path> files = paths == null ? List.of() : List.copyOf(paths);
    return Flowable.defer(
            () -> {
              BatchAssembler batches = new BatchAssembler(files.size(), policy.batchFiles());
              return Flowable.fromIterable(files)
                  .concatMapSingle(this::open)
                  .concatMapIterable(batches::accept)
                  .concatWith(Flowable.defer(() -> Flowable.fromIterable(batches.finish())));
            })
        .subscribeOn(loadScheduler);
  }

  /** Starts loading {@code paths}, offering every event to {@code channel}. */
  public Disposable start(List<Path> paths, LoadChannel channel) {
    Objects.requireNonNull(channel, "channel");
    return events(paths)
        .subscribe(
            channel::offer,
            err -> log.error("Log loading stopped unexpectedly", err));
  }

  private Single<Opened> open(Path path) {
    return Single.fromCallable(() -> opener.open(path))
        .retryWhen(errors -> retryOnDescriptorExhaustion(path, errors))
        .map(store -> Opened.loaded(path, store))
        .onErrorReturn(err -> Opened.failed(path, asStoreException(path, err)));
  }

  private Flowable<Long> retryOnDescriptorExhaustion(Path path, Flowable<Throwable> errors) {
    AtomicInteger attempts = new AtomicInteger();
    return errors.concatMap(
        err -> {
          int attempt = attempts.incrementAndGet();
          boolean retryable = err instanceof LogStoreException lse && lse.isRetryable();
          if (!retryable || attempt >= policy.maxAttempts()) {
            return Flowable.error(err);
          }
          Duration delay = policy.backoffAfter(attempt);
          log.debug(
              "Out of file descriptors opening {} (attempt {}/{}), retrying in {} ms",
              path,
              attempt,
              policy.maxAttempts(),
              delay.toMillis());
          return Flowable.timer(delay.toMillis(), TimeUnit.MILLISECONDS, delayScheduler);
        });
  }

  private static LogStoreException asStoreException(Path path, Throwable err) {
    if (err instanceof LogStoreException lse) return lse;
    if (err instanceof IOException io) return LogStoreException.from(path, io);
    return new LogStoreException(
        path,
        LogStoreException.Reason.UNREADABLE,
        "Cannot load " + path + ": " + err.getMessage(),
        err);
  }

  private record Opened(Path path, LogStore store, LogStoreException error) {
    static Opened loaded(Path path, LogStore store) {
      return new Opened(path, store, null);
    }

    static Opened failed(Path path, LogStoreException error) {
      return new Opened(path, null, error);
    }
  }

  /** Groups loaded stores into batches and tallies the report; one instance per subscription. */
  private static final class BatchAssembler {
    private final int totalFiles;
    private final int batchFiles;
    private final List<LogStore> pending = new ArrayList<>();
    private final List<Path> pendingPaths = new ArrayList<>();
    private final List<Path> failed = new ArrayList<>();
    private int loaded;
    private long lines;

    BatchAssembler(int totalFiles, int batchFiles) {
      this.totalFiles = totalFiles;
      this.batchFiles = Math.max(1, batchFiles);
    }

    List<LoadEvent> accept(Opened opened) {
      if (opened.error() != null) {
        failed.add(opened.path());
        log.warn("Failed to load {}: {}", opened.path(), opened.error().getMessage());
        return List.of(new LoadEvent.Failed(opened.path(), opened.error()));
      }
      loaded++;
      lines += opened.store().size();
      pending.add(opened.store());
      pendingPaths.add(opened.path());
      if (pending.size() < batchFiles) return List.of();
      return List.of(flush());
    }

    List<LoadEvent> finish() {
      List<LoadEvent> out = new ArrayList<>(2);
      if (!pending.isEmpty()) out.add(flush());
      LoadReport report = new LoadReport(totalFiles, loaded, lines, failed);
      if (report.hasFailures()) {
        log.warn(report.summary());
      } else {
        log.info(report.summary());
      }
      out.add(new LoadEvent.Completed(report));
      return out;
    }

    private LoadEvent flush() {
      LoadEvent batch = new LoadEvent.Batch(LogStore.merge(pending), pendingPaths);
      pending.clear();
      pendingPaths.clear();
      return batch;
    }
  }
}
