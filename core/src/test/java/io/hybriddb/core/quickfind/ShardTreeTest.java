// file: core/src/test/java/io/hybriddb/core/quickfind/ShardTreeTest.java
package io.hybriddb.core.quickfind;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ShardTree over the token space.
 *
 * Goal is to validate:
 *  - deterministic root for the same rows regardless of input order,
 *  - root changes when one row's digest changes,
 *  - differences localize to specific shards.
 */
class ShardTreeTest {

    private static ShardTree.RowDigest row(long token, String id, String data) {
        return new ShardTree.RowDigest(token, id, data.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void equal_rows_equal_roots_in_any_order() {
        List<ShardTree.RowDigest> rows = new ArrayList<>(List.of(
                row(10, "a", "A"), row(1L << 62, "b", "B"), row(-5, "c", "C"), row(10, "d", "D")));
        ShardTree t1 = ShardTree.build(rows, 8);
        Collections.reverse(rows);
        ShardTree t2 = ShardTree.build(rows, 8);

        assertArrayEquals(t1.root(), t2.root());
        assertTrue(ShardDiff.differingShards(t1, t2).isEmpty());
    }

    @Test
    void single_row_change_dirties_one_shard() {
        ShardTree left = ShardTree.build(List.of(row(10, "a", "A"), row(1L << 62, "b", "B")), 8);
        ShardTree right = ShardTree.build(List.of(row(10, "a", "A"), row(1L << 62, "b", "X")), 8);

        assertFalse(java.util.Arrays.equals(left.root(), right.root()));
        assertEquals(List.of(2), ShardDiff.differingShards(left, right));
    }

    @Test
    void tokens_route_by_top_bits_as_unsigned() {
        ShardTree t = ShardTree.build(List.of(
                row(0, "zero", "z"), row(Long.MAX_VALUE, "max", "m"), row(Long.MIN_VALUE, "min", "n"), row(-1, "neg", "x")), 4);

        assertEquals("zero", t.manifest(0).entries().get(0).id());
        assertEquals("max", t.manifest(1).entries().get(0).id());
        assertEquals("min", t.manifest(2).entries().get(0).id());
        assertEquals("neg", t.manifest(3).entries().get(0).id());
    }

    @Test
    void changes_in_several_shards_are_all_reported_in_order() {
        ShardTree left = ShardTree.build(List.of(
                row(1, "a", "A"), row(1L << 61, "b", "B"), row(-1, "c", "C")), 8);
        ShardTree right = ShardTree.build(List.of(
                row(1, "a", "A2"), row(1L << 61, "b", "B"), row(-1, "c", "C2")), 8);

        assertEquals(List.of(0, 7), ShardDiff.differingShards(left, right));
    }

    @Test
    void tree_rebuilt_from_shard_hashes_has_the_same_root() {
        ShardTree t = ShardTree.build(List.of(row(3, "a", "A"), row(-3, "b", "B")), 16);
        List<byte[]> hashes = new ArrayList<>();
        for (int i = 0; i < t.shardCount(); i++) hashes.add(t.shardHash(i));

        ShardTree rebuilt = ShardTree.fromShardHashes(hashes);

        assertArrayEquals(t.root(), rebuilt.root());
        assertTrue(rebuilt.manifest(0).entries().isEmpty());
    }

    @Test
    void empty_tree_has_children_and_empty_manifests() {
        ShardTree t = ShardTree.build(List.of(), 8);

        assertNotNull(t.root());
        assertEquals(2, t.children(0).length);
        for (int shard = 0; shard < 8; shard++) {
            assertTrue(t.manifest(shard).entries().isEmpty());
        }
    }

    @Test
    void shard_count_must_be_a_power_of_two_and_match() {
        assertThrows(IllegalArgumentException.class, () -> ShardTree.build(List.of(), 6));
        ShardTree a = ShardTree.build(List.of(), 4);
        ShardTree b = ShardTree.build(List.of(), 8);
        assertThrows(IllegalArgumentException.class, () -> ShardDiff.differingShards(a, b));
    }
}
