// file: storage/src/main/java/io/hybriddb/storage/LocalStores.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Copies or moves local state between databases, e.g. to build a replica or
 * to move to another storage provider.
 */
public final class LocalStores {

    private LocalStores() {}

    /** Create missing collections in {@code to}, then clone each collection in parallel. */
    public static CompletableFuture<Void> cloneDatabase(LocalDatabase from, LocalDatabase to) {
        List<String> names = from.getCollectionNames();
        CompletableFuture<Void> created = CompletableFuture.completedFuture(null);
        for (String name : names) {
            if (to.collection(name) == null) {
                created = created.thenCompose(ignored -> to.addCollection(name).thenApply(c -> (Void) null));
            }
        }
        return created.thenCompose(ignored -> {
            List<CompletableFuture<Void>> clones = new ArrayList<>(names.size());
            for (String name : names) clones.add(cloneCollection(from.collection(name), to.collection(name)));
            return CompletableFuture.allOf(clones.toArray(new CompletableFuture[0]));
        });
    }

    /**
     * Seed the server-side documents, then replay pending upserts with their
     * bases, then pending removes. Documents with a pending upsert are not
     * seeded, so their bases arrive exactly as they were.
     */
    public static CompletableFuture<Void> cloneCollection(LocalCollection from, LocalCollection to) {
        CompletableFuture<List<Document>> all = from.find(Map.of()).fetch();
        CompletableFuture<List<PendingUpsert>> upserts = from.pendingUpserts();
        CompletableFuture<List<String>> removes = from.pendingRemoves();

        return all.thenCombine(upserts, (docs, ups) -> {
            Set<String> pending = new HashSet<>();
            for (PendingUpsert u : ups) pending.add(u.doc().id());
            List<Document> seeds = new ArrayList<>();
            for (Document d : docs) {
                if (!pending.contains(d.id())) seeds.add(d);
            }
            return seeds;
        }).thenCompose(to::seed)
                .thenCompose(ignored -> upserts)
                .thenCompose(ups -> {
                    if (ups.isEmpty()) return CompletableFuture.<Void>completedFuture(null);
                    List<Document> docs = new ArrayList<>(ups.size());
                    List<Document> bases = new ArrayList<>(ups.size());
                    for (PendingUpsert u : ups) {
                        docs.add(u.doc());
                        bases.add(u.base());
                    }
                    return to.upsert(docs, bases).thenApply(stored -> (Void) null);
                })
                .thenCompose(ignored -> removes)
                .thenCompose(ids -> {
                    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
                    for (String id : ids) chain = chain.thenCompose(v -> to.remove(id));
                    return chain;
                });
    }

    /**
     * Move pending changes of every collection that exists in both databases
     * from {@code from} to {@code to}. Collections are handled one at a time.
     */
    public static CompletableFuture<Void> migrateDatabase(LocalDatabase from, LocalDatabase to) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String name : from.getCollectionNames()) {
            LocalCollection target = to.collection(name);
            if (target == null) continue;
            LocalCollection source = from.collection(name);
            chain = chain.thenCompose(ignored -> migrateCollection(source, target));
        }
        return chain;
    }

    /**
     * Replay pending upserts (with their bases) into {@code to} and resolve them
     * in {@code from}, then do the same for pending removes. Cached documents
     * stay where they are.
     */
    public static CompletableFuture<Void> migrateCollection(LocalCollection from, LocalCollection to) {
        return from.pendingUpserts()
                .thenCompose(ups -> {
                    if (ups.isEmpty()) return CompletableFuture.<Void>completedFuture(null);
                    List<Document> docs = new ArrayList<>(ups.size());
                    List<Document> bases = new ArrayList<>(ups.size());
                    for (PendingUpsert u : ups) {
                        docs.add(u.doc());
                        bases.add(u.base());
                    }
                    return to.upsert(docs, bases).thenCompose(stored -> {
                        List<UpsertResolution> resolved = new ArrayList<>(ups.size());
                        for (int i = 0; i < ups.size(); i++) resolved.add(new UpsertResolution(ups.get(i), stored.get(i)));
                        return from.resolveUpserts(resolved);
                    });
                })
                .thenCompose(ignored -> from.pendingRemoves())
                .thenCompose(ids -> {
                    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
                    for (String id : ids) {
                        chain = chain.thenCompose(v -> to.remove(id)).thenCompose(v -> from.resolveRemove(id));
                    }
                    return chain;
                });
    }
}
