// file: storage/src/main/java/io/hybriddb/storage/MemoryStorageAdapter.java
package io.hybriddb.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Volatile adapter; data lives as long as the instance. */
public final class MemoryStorageAdapter implements StorageAdapter {
    private final Map<String, CollectionEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized List<CollectionEntry> loadAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized void persist(List<CollectionEntry> puts, List<String> removedIds) {
        for (CollectionEntry e : puts) entries.put(e.id(), e);
        for (String id : removedIds) entries.remove(id);
    }

    @Override
    public void close() {
    }
}
