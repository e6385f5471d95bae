// file: storage/src/main/java/io/hybriddb/storage/LocalCollection.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;
import io.hybriddb.core.query.FindOptions;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A local collection: cached server documents plus pending local changes.
 * <p>
 * Every id is in exactly one state (see {@link CollectionEntry}):
 *  - cached:   server copy, replaced by cache() unless a newer _rev is held,
 *  - upserted: pending upload with the base it was derived from,
 *  - removed:  pending tombstone.
 * <p>
 * Queries see cached and upserted documents. Input validation errors are
 * thrown synchronously; storage failures complete the returned future
 * exceptionally with the adapter's {@link java.io.IOException} as cause.
 */
public interface LocalCollection {

    String name();

    Query find(Map<String, ?> selector, FindOptions options);

    default Query find(Map<String, ?> selector) {
        return find(selector, null);
    }

    /** First match in query order, or null. */
    CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions options);

    /**
     * Record local changes. Documents without an id get a generated one.
     *
     * @param bases per-document bases aligned with {@code docs}; null or a
     *              shorter list leaves the remaining bases implicit
     * @return the stored documents, ids assigned
     * @throws io.hybriddb.core.BaseIdMismatchException when a base has no id or a different id
     */
    CompletableFuture<List<Document>> upsert(List<Document> docs, List<Document> bases);

    default CompletableFuture<List<Document>> upsert(List<Document> docs) {
        return upsert(docs, null);
    }

    default CompletableFuture<Document> upsert(Document doc) {
        return upsert(doc, null);
    }

    default CompletableFuture<Document> upsert(Document doc, Document base) {
        return upsert(List.of(doc), Collections.singletonList(base)).thenApply(stored -> stored.get(0));
    }

    CompletableFuture<Void> remove(String id);

    /**
     * Cache the result of a remote query and evict cached entries the query
     * should have returned but did not.
     */
    CompletableFuture<Void> cache(List<Document> docs, Map<String, ?> selector, FindOptions options);

    CompletableFuture<Void> cacheOne(Document doc);

    CompletableFuture<Void> cacheList(List<Document> docs);

    /** Drop cached entries matching the selector; pending entries are kept. */
    CompletableFuture<Void> uncache(Map<String, ?> selector);

    CompletableFuture<Void> uncacheList(List<String> ids);

    CompletableFuture<List<PendingUpsert>> pendingUpserts();

    CompletableFuture<List<String>> pendingRemoves();

    CompletableFuture<Void> resolveUpserts(List<UpsertResolution> resolutions);

    CompletableFuture<Void> resolveRemove(String id);

    /** Insert documents as cached, only for ids that have no entry at all. */
    CompletableFuture<Void> seed(List<Document> docs);
}
