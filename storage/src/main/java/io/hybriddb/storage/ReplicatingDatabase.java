// file: storage/src/main/java/io/hybriddb/storage/ReplicatingDatabase.java
package io.hybriddb.storage;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Local database that keeps a replica in step with a master.
 * Collection names come from master; adding and removing applies to both.
 */
public final class ReplicatingDatabase implements LocalDatabase {
    private final LocalDatabase master;
    private final LocalDatabase replica;
    private final Map<String, ReplicatingCollection> collections = new LinkedHashMap<>();

    public ReplicatingDatabase(LocalDatabase master, LocalDatabase replica) {
        this.master = master;
        this.replica = replica;
    }

    @Override
    public CompletableFuture<LocalCollection> addCollection(String name) {
        return master.addCollection(name)
                .thenCompose(m -> replica.addCollection(name).thenApply(r -> register(name, m, r)));
    }

    @Override
    public CompletableFuture<Void> removeCollection(String name) {
        synchronized (this) {
            collections.remove(name);
        }
        return master.removeCollection(name).thenCompose(ignored -> replica.removeCollection(name));
    }

    @Override
    public List<String> getCollectionNames() {
        return master.getCollectionNames();
    }

    @Override
    public synchronized LocalCollection collection(String name) {
        return collections.get(name);
    }

    @Override
    public void close() throws IOException {
        try {
            master.close();
        } finally {
            replica.close();
        }
    }

    private synchronized LocalCollection register(String name, LocalCollection m, LocalCollection r) {
        return collections.computeIfAbsent(name, k -> new ReplicatingCollection(m, r));
    }
}
