// file: core/src/main/java/io/hybriddb/core/quickfind/QuickfindProtocol.java
package io.hybriddb.core.quickfind;

import io.hybriddb.core.Document;
import io.hybriddb.core.Json;
import io.hybriddb.core.query.SortCompiler;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Both halves of the quickfind exchange.
 * <p>
 * Client: {@link #encodeRequest} hashes the rows it already holds into
 * shards. Server: {@link #respond} recomputes the same shards over its rows
 * and returns the full contents of every shard whose hash differs. Client:
 * {@link #merge} keeps its rows for unchanged shards and replaces changed
 * shards with the server's rows.
 * <p>
 * Row digest: SHA-256 of {@code _rev} when present, otherwise SHA-256 of the
 * canonical (key-sorted) JSON of the whole document.
 */
public final class QuickfindProtocol {
    public static final int DEFAULT_SHARD_COUNT = 16;

    private QuickfindProtocol() {}

    /** Result of merging a quickfind response into the client's rows. */
    public record MergeResult(List<Document> rows, List<String> removedIds) {}

    // ---------- hashing ----------

    /** First 8 bytes of SHA-256(id), read big-endian. */
    public static long token(String id) {
        MessageDigest md = SimpleShardTree.newDigest();
        byte[] h = md.digest(id.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(h, 0, 8).getLong();
    }

    public static int shardOf(String id, int shardCount) {
        SimpleShardTree.requirePowerOfTwo(shardCount);
        return SimpleShardTree.shardOf(token(id), shardCount);
    }

    public static byte[] digest(Document doc) {
        MessageDigest md = SimpleShardTree.newDigest();
        Object rev = doc.rev();
        if (rev != null) {
            md.update((byte) 'r');
            md.update(rev.toString().getBytes(StandardCharsets.UTF_8));
        } else {
            md.update((byte) 'c');
            md.update(Json.canonicalBytes(doc));
        }
        return md.digest();
    }

    public static ShardTree tree(List<Document> rows, int shardCount) {
        List<ShardTree.RowDigest> digests = new ArrayList<>(rows.size());
        for (Document d : rows) {
            digests.add(new ShardTree.RowDigest(token(d.id()), d.id(), digest(d)));
        }
        return ShardTree.build(digests, shardCount);
    }

    // ---------- client ----------

    /** @return base64 shard hashes, index = shard number. */
    public static List<String> encodeRequest(List<Document> clientRows, int shardCount) {
        ShardTree t = tree(clientRows, shardCount);
        List<String> out = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            out.add(Base64.getEncoder().encodeToString(t.shardHash(i)));
        }
        return out;
    }

    /**
     * Combine the client's rows with the server's changed shards.
     *
     * @param sort sort spec to reapply to the merged rows, or null to keep
     *             client rows first followed by server rows
     */
    public static MergeResult merge(List<Document> clientRows, List<ChangedShard> changed, int shardCount, Object sort) {
        Map<Integer, ChangedShard> byShard = new HashMap<>();
        for (ChangedShard c : changed) byShard.put(c.shard(), c);

        Set<String> serverIds = new HashSet<>();
        for (ChangedShard c : changed) {
            for (Document d : c.docs()) serverIds.add(d.id());
        }

        List<Document> rows = new ArrayList<>();
        Set<String> removed = new LinkedHashSet<>();
        for (Document d : clientRows) {
            if (!byShard.containsKey(shardOf(d.id(), shardCount))) {
                rows.add(d);
            } else if (!serverIds.contains(d.id())) {
                removed.add(d.id());
            }
        }
        for (ChangedShard c : changed) rows.addAll(c.docs());
        if (sort != null) rows.sort(SortCompiler.compile(sort));
        return new MergeResult(rows, List.copyOf(removed));
    }

    // ---------- server ----------

    /**
     * Compare the client's shard hashes with the server rows and return the
     * full contents of each differing shard, in shard order.
     */
    public static List<ChangedShard> respond(List<Document> serverRows, List<String> clientShardHashes) {
        List<byte[]> hashes = new ArrayList<>(clientShardHashes.size());
        for (String h : clientShardHashes) hashes.add(Base64.getDecoder().decode(h));
        ShardTree client = ShardTree.fromShardHashes(hashes);
        ShardTree server = tree(serverRows, client.shardCount());
        Map<String, Document> byId = new HashMap<>();
        for (Document d : serverRows) byId.put(d.id(), d);

        List<ChangedShard> out = new ArrayList<>();
        for (int shard : ShardDiff.differingShards(server, client)) {
            List<Document> docs = new ArrayList<>();
            for (ShardTree.RowDigest r : server.manifest(shard).entries()) {
                docs.add(byId.get(r.id()));
            }
            out.add(new ChangedShard(shard, docs));
        }
        return out;
    }
}
