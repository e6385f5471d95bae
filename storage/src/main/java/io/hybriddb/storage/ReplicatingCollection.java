// file: storage/src/main/java/io/hybriddb/storage/ReplicatingCollection.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;
import io.hybriddb.core.query.FindOptions;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Mirrors every change to a replica collection.
 * <p>
 *  - mutations run on master first, then on the replica; the replica is not
 *    touched when master fails, and a replica failure fails the call,
 *  - upserts reach the replica with master's id-assigned documents,
 *  - reads go to master only.
 */
public final class ReplicatingCollection implements LocalCollection {
    private final LocalCollection master;
    private final LocalCollection replica;

    public ReplicatingCollection(LocalCollection master, LocalCollection replica) {
        this.master = master;
        this.replica = replica;
    }

    @Override
    public String name() {
        return master.name();
    }

    @Override
    public Query find(Map<String, ?> selector, FindOptions options) {
        return master.find(selector, options);
    }

    @Override
    public CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions options) {
        return master.findOne(selector, options);
    }

    @Override
    public CompletableFuture<List<PendingUpsert>> pendingUpserts() {
        return master.pendingUpserts();
    }

    @Override
    public CompletableFuture<List<String>> pendingRemoves() {
        return master.pendingRemoves();
    }

    @Override
    public CompletableFuture<List<Document>> upsert(List<Document> docs, List<Document> bases) {
        return master.upsert(docs, bases)
                .thenCompose(stored -> replica.upsert(stored, bases).thenApply(ignored -> stored));
    }

    @Override
    public CompletableFuture<Void> remove(String id) {
        return both(c -> c.remove(id));
    }

    @Override
    public CompletableFuture<Void> cache(List<Document> docs, Map<String, ?> selector, FindOptions options) {
        return both(c -> c.cache(docs, selector, options));
    }

    @Override
    public CompletableFuture<Void> cacheOne(Document doc) {
        return both(c -> c.cacheOne(doc));
    }

    @Override
    public CompletableFuture<Void> cacheList(List<Document> docs) {
        return both(c -> c.cacheList(docs));
    }

    @Override
    public CompletableFuture<Void> uncache(Map<String, ?> selector) {
        return both(c -> c.uncache(selector));
    }

    @Override
    public CompletableFuture<Void> uncacheList(List<String> ids) {
        return both(c -> c.uncacheList(ids));
    }

    @Override
    public CompletableFuture<Void> resolveUpserts(List<UpsertResolution> resolutions) {
        return both(c -> c.resolveUpserts(resolutions));
    }

    @Override
    public CompletableFuture<Void> resolveRemove(String id) {
        return both(c -> c.resolveRemove(id));
    }

    @Override
    public CompletableFuture<Void> seed(List<Document> docs) {
        return both(c -> c.seed(docs));
    }

    private CompletableFuture<Void> both(Function<LocalCollection, CompletableFuture<Void>> op) {
        return op.apply(master).thenCompose(ignored -> op.apply(replica));
    }
}
