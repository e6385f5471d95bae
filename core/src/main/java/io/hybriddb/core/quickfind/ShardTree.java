// file: core/src/main/java/io/hybriddb/core/quickfind/ShardTree.java
package io.hybriddb.core.quickfind;

import java.util.List;

/**
 * Binary hash tree over a fixed number of id shards.
 * <p>
 * At a high level:
 *  - ids are mapped to 64-bit tokens and partitioned into shards by the top bits,
 *  - each shard holds a manifest of (token, id, digest) rows,
 *  - each shard is hashed into a single leaf hash,
 *  - internal nodes hash their two child hashes.
 * <p>
 *  - root():       quick equality check between two sides,
 *  - children():   recursive descent towards the differing shards,
 *  - shardHash():  the per-shard hash exchanged on the wire.
 */
public interface ShardTree {

    /** Root hash bytes (SHA-256). Identical roots imply identical shard contents. */
    byte[] root();

    /**
     * Child hashes for the given node id in the implicit binary layout:
     *  - root has id 0,
     *  - children of node n are 2n+1 and 2n+2,
     *  - leaves (one per shard) form the last level.
     * Leaves return an empty array.
     */
    byte[][] children(int nodeId);

    int shardCount();

    byte[] shardHash(int shard);

    /**
     * Rows that landed in the given shard. Trees rebuilt from bare shard
     * hashes have empty manifests.
     */
    ShardManifest manifest(int shard);

    /**
     * Build from row digests. The shard count must be a power of two.
     * Input order does not matter; rows are ordered by (token, id) per shard.
     */
    static ShardTree build(Iterable<RowDigest> rows, int shardCount) {
        return SimpleShardTree.fromRows(rows, shardCount);
    }

    /** Rebuild the tree shape from shard hashes received from the other side. */
    static ShardTree fromShardHashes(List<byte[]> shardHashes) {
        return SimpleShardTree.fromLeafHashes(shardHashes);
    }

    /**
     * Per-document digest entry.
     * - token:  64-bit hash of the id,
     * - id:     document id (tie-breaker for equal tokens),
     * - digest: hash of the document state (revision or content).
     */
    record RowDigest(long token, String id, byte[] digest) {}

    record ShardManifest(List<RowDigest> entries) {}
}
