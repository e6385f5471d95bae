// file: core/src/main/java/io/hybriddb/core/quickfind/ShardDiff.java
package io.hybriddb.core.quickfind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Diffs two shard trees of the same shape.
 *  - If root hashes are equal the trees are identical.
 *  - Otherwise descend recursively, skipping equal subtrees, and collect the
 *    differing shards in ascending order.
 */
public final class ShardDiff {

    private ShardDiff() {}

    public static List<Integer> differingShards(ShardTree left, ShardTree right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!(left instanceof SimpleShardTree l) || !(right instanceof SimpleShardTree r)) {
            throw new IllegalArgumentException("ShardDiff supports SimpleShardTree only");
        }
        if (l.shardCount() != r.shardCount()) {
            throw new IllegalArgumentException("shard counts differ: " + l.shardCount() + " vs " + r.shardCount());
        }

        List<Integer> out = new ArrayList<>();
        if (Arrays.equals(l.root(), r.root())) return out;
        diffNode(0, l, r, out);
        return out;
    }

    private static void diffNode(int nodeId, SimpleShardTree left, SimpleShardTree right, List<Integer> out) {
        if (Arrays.equals(left.hashAt(nodeId), right.hashAt(nodeId))) return;
        if (left.isLeaf(nodeId)) {
            out.add(left.shardOfLeaf(nodeId));
            return;
        }
        diffNode(left.leftChild(nodeId), left, right, out);
        diffNode(left.rightChild(nodeId), left, right, out);
    }
}
