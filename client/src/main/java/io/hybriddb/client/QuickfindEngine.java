// file: client/src/main/java/io/hybriddb/client/QuickfindEngine.java
package io.hybriddb.client;

import io.hybriddb.client.remote.RemoteCollection;
import io.hybriddb.core.Document;
import io.hybriddb.core.query.FindOptions;
import io.hybriddb.core.quickfind.QuickfindProtocol;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Client half of quickfind: send per-shard hashes of the local result and
 * patch it with the shards the server reports as different.
 */
public final class QuickfindEngine {
    private static final Logger log = Logger.getLogger(QuickfindEngine.class.getName());

    private final RemoteCollection remote;
    private final int shardCount;

    public QuickfindEngine(RemoteCollection remote, int shardCount) {
        if (shardCount <= 0 || Integer.bitCount(shardCount) != 1) {
            throw new IllegalArgumentException("shardCount must be a power of two: " + shardCount);
        }
        this.remote = remote;
        this.shardCount = shardCount;
    }

    /** Only whole, unwindowed results can be compared shard by shard. */
    public static boolean eligible(FindOptions options) {
        FindOptions o = FindOptions.orNone(options);
        return o.fields() == null && !o.hasLimit() && !o.hasSkip();
    }

    /**
     * @param clientRows the local result of the same query
     * @return the server's result, rebuilt from unchanged local shards and the changed server shards
     */
    public CompletableFuture<List<Document>> find(Map<String, ?> selector, Object sort, List<Document> clientRows) {
        List<String> hashes = QuickfindProtocol.encodeRequest(clientRows, shardCount);
        return remote.quickfind(selector, sort, hashes).thenApply(changed -> {
            QuickfindProtocol.MergeResult merged = QuickfindProtocol.merge(clientRows, changed, shardCount, sort);
            log.fine(() -> String.format("quickfind %s: %d/%d shards changed, %d removed",
                    remote.name(), changed.size(), shardCount, merged.removedIds().size()));
            return merged.rows();
        });
    }
}
