// file: storage/src/main/java/io/hybriddb/storage/StorageSelector.java
package io.hybriddb.storage;

import java.util.List;
import java.util.logging.Logger;

/**
 * Picks the storage provider for a local database: the first candidate whose
 * probe succeeds, or an in-memory provider when none does.
 */
public final class StorageSelector {
    private static final Logger log = Logger.getLogger(StorageSelector.class.getName());

    private StorageSelector() {}

    public static StorageProvider select(List<? extends StorageProvider> candidates) {
        for (StorageProvider p : candidates) {
            if (p.isAvailable()) {
                log.fine(() -> "selected storage provider " + p.name());
                return p;
            }
            log.info("storage provider " + p.name() + " unavailable, trying next");
        }
        log.info("no storage provider available, falling back to " + MemoryStorageProvider.NAME);
        return new MemoryStorageProvider();
    }
}
