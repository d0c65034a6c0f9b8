package cafe.woden.logbrowser.loading;

import cafe.woden.logbrowser.storage.LogStore;
import cafe.woden.logbrowser.storage.LogStoreException;
import java.nio.file.Path;

/** Builds the store for one file. */
@FunctionalInterface
public interface LogStoreOpener {

  LogStoreOpener MAPPED = LogStore::fromFile;

  LogStore open(Path path) throws LogStoreException;
}
