package cafe.woden.logbrowser.app;

/** Progress of the background load as the session sees it. */
public sealed interface LoadingStatus
    permits LoadingStatus.Idle, LoadingStatus.Loading, LoadingStatus.Complete, LoadingStatus.Error {

  record Idle() implements LoadingStatus {}

  /** {@code current} of {@code total} requested files installed so far. */
  record Loading(int current, int total) implements LoadingStatus {}

  record Complete() implements LoadingStatus {}

  record Error(String message) implements LoadingStatus {}

  default boolean isLoading() {
    return this instanceof Loading;
  }
}
