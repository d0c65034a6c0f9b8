package cafe.woden.logbrowser.storage;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Failure to build a {@link LogStore} for one input file.
 *
 * <p>The {@link Reason} lets the loading layer tell a missing or unreadable file apart from a
 * host that has temporarily run out of file descriptors (the only retryable case).
 */
public class LogStoreException extends IOException {

  /** Why the file could not be mapped. */
  public enum Reason {
    NOT_FOUND,
    UNREADABLE,
    DESCRIPTOR_EXHAUSTED
  }

  private static final String TOO_MANY_OPEN_FILES = "too many open files";

  private final Path path;
  private final Reason reason;

  public LogStoreException(Path path, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public LogStoreException(Path path, Reason reason, String message) {
    this(path, reason, message, null);
  }

  /** Classifies a low-level I/O failure raised while opening or mapping {@code path}. */
  public static LogStoreException from(Path path, IOException cause) {
    if (cause instanceof LogStoreException lse) return lse;
    Reason reason = classify(cause);
    String detail = Objects.toString(cause == null ? null : cause.getMessage(), "").trim();
    String message =
        switch (reason) {
          case NOT_FOUND -> "File not found: " + path;
          case DESCRIPTOR_EXHAUSTED -> "Out of file descriptors while opening " + path;
          case UNREADABLE -> detail.isEmpty()
              ? "Cannot read " + path
              : "Cannot read " + path + ": " + detail;
        };
    return new LogStoreException(path, reason, message, cause);
  }

  static Reason classify(IOException cause) {
    if (cause == null) return Reason.UNREADABLE;
    if (mentionsDescriptorExhaustion(cause)) return Reason.DESCRIPTOR_EXHAUSTED;
    if (cause instanceof NoSuchFileException) return Reason.NOT_FOUND;
    if (cause instanceof AccessDeniedException) return Reason.UNREADABLE;
    if (cause instanceof FileNotFoundException) return Reason.NOT_FOUND;
    return Reason.UNREADABLE;
  }

  private static boolean mentionsDescriptorExhaustion(IOException cause) {
    String text = Objects.toString(cause.getMessage(), "");
    if (cause instanceof FileSystemException fse) {
      text = text + " " + Objects.toString(fse.getReason(), "");
    }
    return text.toLowerCase(Locale.ROOT).contains(TOO_MANY_OPEN_FILES);
  }

  public Path path() {
    return path;
  }

  public Reason reason() {
    return reason;
  }

  /** True when retrying later may succeed. */
  public boolean isRetryable() {
    return reason == Reason.DESCRIPTOR_EXHAUSTED;
  }
}
