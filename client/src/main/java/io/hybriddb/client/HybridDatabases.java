// file: client/src/main/java/io/hybriddb/client/HybridDatabases.java
package io.hybriddb.client;

import io.hybriddb.client.transport.HttpTransport;
import io.hybriddb.storage.DurableDatabase;
import io.hybriddb.storage.FileLogStorageProvider;
import io.hybriddb.storage.MemoryStorageProvider;
import io.hybriddb.storage.StorageProvider;
import io.hybriddb.storage.StorageSelector;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Builds a {@link HybridDatabase} from a {@link HybridConfig}.
 */
public final class HybridDatabases {
    private static final Logger log = Logger.getLogger(HybridDatabases.class.getName());

    private HybridDatabases() {
        // utility
    }

    /**
     * Pick storage (file, falling back to memory when the directory is unusable),
     * connect the HTTP transport and open every configured collection.
     */
    public static CompletableFuture<HybridDatabase> open(HybridConfig config) {
        StorageProvider provider = HybridConfig.STORAGE_FILE.equals(config.storage())
                ? StorageSelector.select(List.of(new FileLogStorageProvider(config.storageDir())))
                : new MemoryStorageProvider();
        log.info(() -> String.format("opening hybrid database: remote=%s storage=%s",
                config.baseUrl(), provider.name()));

        HttpTransport transport = new HttpTransport(
                config.baseUrl(), config.clientId(), Duration.ofMillis(config.timeoutMillis()));
        HybridDatabase db = new HybridDatabase(new DurableDatabase(provider), transport, config);

        // one after the other, so uploads follow the configured order
        CompletableFuture<HybridCollection> chain = CompletableFuture.completedFuture(null);
        for (String name : config.collections().keySet()) {
            chain = chain.thenCompose(c -> db.addCollection(name));
        }
        return chain.thenApply(c -> db);
    }
}
