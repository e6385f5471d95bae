// file: client/src/main/java/io/hybriddb/client/HybridDatabase.java
package io.hybriddb.client;

import io.hybriddb.client.remote.RemoteCollection;
import io.hybriddb.client.transport.Transport;
import io.hybriddb.storage.LocalDatabase;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Hybrid database: a local database paired with a remote endpoint.
 *
 * Responsibilities:
 *  - Open hybrid collections on top of local ones, with layered options.
 *  - Run upload passes over every collection, in the order they were added.
 */
public final class HybridDatabase implements Closeable {
    private static final Logger log = Logger.getLogger(HybridDatabase.class.getName());

    private final LocalDatabase local;
    private final Transport transport;
    private final HybridConfig config;
    private final Map<String, HybridCollection> collections = new LinkedHashMap<>();

    public HybridDatabase(LocalDatabase local, Transport transport, HybridConfig config) {
        this.local = Objects.requireNonNull(local, "local");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
    }

    public LocalDatabase local() {
        return local;
    }

    /**
     * Open (or return the already open) hybrid collection.
     *
     * @param options collection options, layered over the configured collection
     *                options and the global defaults; null to inherit
     */
    public CompletableFuture<HybridCollection> addCollection(String name, HybridOptions options) {
        synchronized (collections) {
            HybridCollection existing = collections.get(name);
            if (existing != null) return CompletableFuture.completedFuture(existing);
        }
        HybridOptions resolved = config.defaults()
                .overlay(config.collections().get(name))
                .overlay(options);
        return local.addCollection(name).thenApply(lc -> {
            synchronized (collections) {
                return collections.computeIfAbsent(name, n -> new HybridCollection(
                        lc,
                        new RemoteCollection(n, transport, config.usePostFind(), config.maxUrlLength()),
                        resolved,
                        config.uploadBatchSize(),
                        config.quickfindShards()));
            }
        });
    }

    public CompletableFuture<HybridCollection> addCollection(String name) {
        return addCollection(name, null);
    }

    /** Close the collection and drop its local data. */
    public CompletableFuture<Void> removeCollection(String name) {
        synchronized (collections) {
            collections.remove(name);
        }
        return local.removeCollection(name);
    }

    /** @return the open collection, or null */
    public HybridCollection collection(String name) {
        synchronized (collections) {
            return collections.get(name);
        }
    }

    public List<String> getCollectionNames() {
        synchronized (collections) {
            return List.copyOf(collections.keySet());
        }
    }

    /**
     * Upload every collection's pending changes, one collection after the other.
     * <p>
     * A failing collection does not stop the pass. If any failed, the future
     * fails with an {@link UploadFailedException} whose report covers all
     * collections and whose cause is the first error.
     */
    public CompletableFuture<UploadReport> upload() {
        List<HybridCollection> snapshot;
        synchronized (collections) {
            snapshot = new ArrayList<>(collections.values());
        }

        UploadReport[] total = {UploadReport.EMPTY};
        Throwable[] first = {null};
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (HybridCollection c : snapshot) {
            chain = chain.thenCompose(v -> c.upload().handle((report, err) -> {
                if (err == null) {
                    total[0] = total[0].plus(report);
                    return null;
                }
                Throwable cause = HybridCollection.unwrap(err);
                if (cause instanceof UploadFailedException) {
                    total[0] = total[0].plus(((UploadFailedException) cause).report());
                    cause = cause.getCause();
                }
                if (first[0] == null) first[0] = cause;
                return null;
            }));
        }
        return chain.thenCompose(v -> {
            if (first[0] != null) {
                return CompletableFuture.<UploadReport>failedFuture(new UploadFailedException(total[0], first[0]));
            }
            log.fine(() -> "upload finished: " + total[0]);
            return CompletableFuture.completedFuture(total[0]);
        });
    }

    @Override
    public void close() throws IOException {
        synchronized (collections) {
            collections.clear();
        }
        local.close();
    }
}
