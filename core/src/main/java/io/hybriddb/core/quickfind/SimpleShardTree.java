// file: core/src/main/java/io/hybriddb/core/quickfind/SimpleShardTree.java
package io.hybriddb.core.quickfind;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Shard tree with:
 *  - fixed shard count (power of two),
 *  - implicit array layout for nodes,
 *  - SHA-256 as the hashing function.
 * <p>
 * Tree layout:
 *  - shardCount leaves, starting at node id baseLeafId = shardCount - 1
 *  - totalNodes = 2 * shardCount - 1
 *  - for node n: left child = 2n + 1, right child = 2n + 2
 * <p>
 * Leaf hash = H(token1 || id1 || digest1 || token2 || ...), rows ordered by (token, id).
 * Internal hash = H(leftChildHash || rightChildHash).
 */
final class SimpleShardTree implements ShardTree {
    static final int HASH_LEN = 32;

    private final int shardCount;
    private final int totalNodes;
    private final int baseLeafId;
    private final byte[][] nodeHash;
    private final ShardManifest[] manifests;

    private SimpleShardTree(int shardCount) {
        requirePowerOfTwo(shardCount);
        this.shardCount = shardCount;
        this.totalNodes = (shardCount << 1) - 1;
        this.baseLeafId = shardCount - 1;
        this.nodeHash = new byte[totalNodes][];
        this.manifests = new ShardManifest[shardCount];
    }

    static SimpleShardTree fromRows(Iterable<RowDigest> rows, int shardCount) {
        SimpleShardTree t = new SimpleShardTree(shardCount);

        // 1) bucket rows into shards
        List<List<RowDigest>> buckets = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) buckets.add(new ArrayList<>());
        for (RowDigest r : rows) {
            Objects.requireNonNull(r, "RowDigest");
            buckets.get(shardOf(r.token(), shardCount)).add(r);
        }

        // 2) hash each shard in (token, id) order
        Comparator<RowDigest> order = Comparator.<RowDigest, Long>comparing(RowDigest::token, Long::compareUnsigned)
                .thenComparing(RowDigest::id);
        for (int i = 0; i < shardCount; i++) {
            List<RowDigest> bucket = buckets.get(i);
            bucket.sort(order);
            t.manifests[i] = new ShardManifest(List.copyOf(bucket));
            MessageDigest md = newDigest();
            for (RowDigest r : bucket) {
                md.update(longBE(r.token()));
                md.update(r.id().getBytes(StandardCharsets.UTF_8));
                md.update(r.digest());
            }
            t.nodeHash[t.baseLeafId + i] = md.digest();
        }

        t.hashParents();
        return t;
    }

    static SimpleShardTree fromLeafHashes(List<byte[]> leafHashes) {
        SimpleShardTree t = new SimpleShardTree(leafHashes.size());
        ShardManifest empty = new ShardManifest(List.of());
        for (int i = 0; i < leafHashes.size(); i++) {
            byte[] h = Objects.requireNonNull(leafHashes.get(i), "shard hash");
            if (h.length != HASH_LEN) throw new IllegalArgumentException("shard hash must be " + HASH_LEN + " bytes");
            t.nodeHash[t.baseLeafId + i] = h.clone();
            t.manifests[i] = empty;
        }
        t.hashParents();
        return t;
    }

    @Override public byte[] root() { return nodeHash[0]; }

    @Override public byte[][] children(int nodeId) {
        if (nodeId < 0 || nodeId >= totalNodes) throw new IllegalArgumentException("bad nodeId");
        if (isLeaf(nodeId)) return new byte[0][];
        return new byte[][] { nodeHash[leftChild(nodeId)], nodeHash[rightChild(nodeId)] };
    }

    @Override public int shardCount() { return shardCount; }

    @Override public byte[] shardHash(int shard) {
        return nodeHash[baseLeafId + checkShard(shard)];
    }

    @Override public ShardManifest manifest(int shard) {
        return manifests[checkShard(shard)];
    }

    // ---------- tree navigation (used by ShardDiff) ----------

    byte[] hashAt(int nodeId) { return nodeHash[nodeId]; }
    boolean isLeaf(int nodeId) { return nodeId >= baseLeafId; }
    int shardOfLeaf(int nodeId) { return nodeId - baseLeafId; }
    int leftChild(int n) { return (n << 1) + 1; }
    int rightChild(int n) { return (n << 1) + 2; }

    // ---------- helpers ----------

    private void hashParents() {
        for (int n = baseLeafId - 1; n >= 0; n--) {
            MessageDigest md = newDigest();
            md.update(nodeHash[leftChild(n)]);
            md.update(nodeHash[rightChild(n)]);
            nodeHash[n] = md.digest();
        }
    }

    private int checkShard(int shard) {
        if (shard < 0 || shard >= shardCount) throw new IllegalArgumentException("bad shard: " + shard);
        return shard;
    }

    /**
     * Map an unsigned 64-bit token into [0, shardCount) by taking its top k
     * bits, where shardCount = 2^k.
     */
    static int shardOf(long token, int shardCount) {
        int k = Integer.numberOfTrailingZeros(shardCount);
        if (k == 0) return 0;
        return (int) (token >>> (64 - k));
    }

    static void requirePowerOfTwo(int shardCount) {
        if (shardCount <= 0 || (shardCount & (shardCount - 1)) != 0) {
            throw new IllegalArgumentException("shardCount must be a power of two");
        }
    }

    static byte[] longBE(long v) {
        return ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(v).array();
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
