// file: storage/src/main/java/io/hybriddb/storage/DurableDatabase.java
package io.hybriddb.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * {@link LocalDatabase} whose collections are {@link DurableCollection}s opened
 * through a {@link StorageProvider}.
 */
public final class DurableDatabase implements LocalDatabase {
    private static final Logger log = Logger.getLogger(DurableDatabase.class.getName());

    private final StorageProvider provider;
    private final Map<String, DurableCollection> collections = new LinkedHashMap<>();

    public DurableDatabase(StorageProvider provider) {
        this.provider = provider;
    }

    public static DurableDatabase inMemory() {
        return new DurableDatabase(new MemoryStorageProvider());
    }

    public StorageProvider provider() {
        return provider;
    }

    @Override
    public synchronized CompletableFuture<LocalCollection> addCollection(String name) {
        DurableCollection open = collections.get(name);
        if (open != null) return CompletableFuture.completedFuture(open);
        try {
            DurableCollection col = DurableCollection.open(name, provider.open(name));
            collections.put(name, col);
            log.fine(() -> "collection " + name + " added on " + provider.name() + " storage");
            return CompletableFuture.completedFuture(col);
        } catch (IOException | RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public synchronized CompletableFuture<Void> removeCollection(String name) {
        DurableCollection col = collections.remove(name);
        try {
            if (col != null) col.close();
            provider.drop(name);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public synchronized List<String> getCollectionNames() {
        return new ArrayList<>(collections.keySet());
    }

    @Override
    public synchronized LocalCollection collection(String name) {
        return collections.get(name);
    }

    @Override
    public synchronized void close() throws IOException {
        IOException first = null;
        for (DurableCollection col : collections.values()) {
            try {
                col.close();
            } catch (IOException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        collections.clear();
        if (first != null) throw first;
    }
}
