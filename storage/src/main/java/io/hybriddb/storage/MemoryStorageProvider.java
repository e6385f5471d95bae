// file: storage/src/main/java/io/hybriddb/storage/MemoryStorageProvider.java
package io.hybriddb.storage;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps one {@link MemoryStorageAdapter} per collection name, so reopening a
 * collection within the same provider sees its earlier data.
 */
public final class MemoryStorageProvider implements StorageProvider {
    public static final String NAME = "memory";

    private final Map<String, MemoryStorageAdapter> adapters = new HashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized StorageAdapter open(String collection) {
        return adapters.computeIfAbsent(collection, k -> new MemoryStorageAdapter());
    }

    @Override
    public synchronized void drop(String collection) {
        adapters.remove(collection);
    }
}
