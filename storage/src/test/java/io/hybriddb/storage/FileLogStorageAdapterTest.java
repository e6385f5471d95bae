// file: storage/src/test/java/io/hybriddb/storage/FileLogStorageAdapterTest.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileLogStorageAdapterTest {

    @TempDir Path dir;

    private static CollectionEntry cached(String id, int v) {
        return CollectionEntry.cached(Document.of("_id", id, "v", v));
    }

    @Test
    void latest_state_survives_restart() throws IOException {
        try (var adapter = new FileLogStorageAdapter(dir)) {
            adapter.persist(List.of(cached("a", 1), cached("b", 1)), List.of());
            adapter.persist(List.of(CollectionEntry.upserted(Document.of("_id", "a", "v", 2), Document.of("_id", "a", "v", 1))),
                    List.of("b"));
            adapter.persist(List.of(CollectionEntry.removed("c")), List.of());
        }

        try (var reopened = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(
                    CollectionEntry.upserted(Document.of("_id", "a", "v", 2), Document.of("_id", "a", "v", 1)),
                    CollectionEntry.removed("c")), reopened.loadAll());
        }
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws IOException {
        try (var adapter = new FileLogStorageAdapter(dir)) {
            adapter.persist(List.of(cached("k1", 1)), List.of());
            adapter.persist(List.of(cached("k2", 2)), List.of());
        }
        // Third record with its payload cut short, as after a crash mid-write.
        byte[] r3 = RecordCodec.encode(List.of(cached("k3", 3)), List.of());
        try (OutputStream out = Files.newOutputStream(dir.resolve("00000001.log"), APPEND)) {
            out.write(r3, 0, r3.length - 5);
        }

        try (var reopened = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(cached("k1", 1), cached("k2", 2)), reopened.loadAll());
            reopened.persist(List.of(cached("k4", 4)), List.of());
        }

        try (var again = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(cached("k1", 1), cached("k2", 2), cached("k4", 4)), again.loadAll());
        }
    }

    @Test
    void crc_valid_but_undecodable_record_fails_recovery() throws IOException {
        try (var adapter = new FileLogStorageAdapter(dir)) {
            adapter.persist(List.of(cached("k1", 1)), List.of());
        }
        byte[] payload = "{\"puts\": 42}".getBytes(StandardCharsets.UTF_8);
        ByteBuffer rec = ByteBuffer.allocate(RecordCodec.HEADER_LEN + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        rec.putShort(RecordCodec.MAGIC).put(RecordCodec.VERSION).putInt(payload.length).putInt(RecordCodec.crc32(payload));
        rec.put(payload);
        Files.write(dir.resolve("00000001.log"), rec.array(), APPEND);

        assertThrows(IOException.class, () -> new FileLogStorageAdapter(dir));
    }

    @Test
    void snapshot_truncates_log_and_recovery_uses_it() throws IOException {
        try (var adapter = new FileLogStorageAdapter(dir, 2, 1L << 30)) {
            adapter.persist(List.of(cached("a", 1)), List.of());
            adapter.persist(List.of(cached("b", 1)), List.of());
            adapter.persist(List.of(cached("c", 1)), List.of("a"));
        }

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.filter(p -> p.getFileName().toString().startsWith("snapshot-")).count());
        }
        try (var reopened = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(cached("b", 1), cached("c", 1)), reopened.loadAll());
        }
    }

    @Test
    void replay_spans_rotated_segments() throws IOException {
        try (var adapter = new FileLogStorageAdapter(dir, 1_000, 1)) {
            adapter.persist(List.of(cached("a", 1)), List.of());
            adapter.persist(List.of(cached("b", 1)), List.of());
            adapter.persist(List.of(cached("a", 2)), List.of());
        }
        assertTrue(Files.exists(dir.resolve("00000003.log")));

        try (var reopened = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(cached("a", 2), cached("b", 1)), reopened.loadAll());
        }
    }

    @Test
    void durable_collection_recovers_pending_state_from_disk() throws IOException {
        FileLogStorageProvider provider = new FileLogStorageProvider(dir);
        try (DurableCollection col = DurableCollection.open("sites", provider.open("sites"))) {
            col.cacheOne(Document.of("_id", "1", "name", "A")).join();
            col.upsert(Document.of("_id", "1", "name", "B")).join();
            col.remove("2").join();
        }

        try (DurableCollection col = DurableCollection.open("sites", provider.open("sites"))) {
            assertEquals(List.of(new PendingUpsert(Document.of("_id", "1", "name", "B"), Document.of("_id", "1", "name", "A"))),
                    col.pendingUpserts().join());
            assertEquals(List.of("2"), col.pendingRemoves().join());
            assertEquals("B", col.findOne(Map.of(), null).join().get("name"));
        }
    }

    @Test
    void failed_snapshot_does_not_fail_a_committed_write() throws IOException {
        // A directory where the snapshot temp file goes makes every snapshot attempt fail.
        Files.createDirectories(dir.resolve("snapshot-00000001.json.tmp"));

        try (var adapter = new FileLogStorageAdapter(dir, 1, 1L << 30)) {
            adapter.persist(List.of(cached("a", 1)), List.of());
            adapter.persist(List.of(cached("b", 1)), List.of());
            assertEquals(List.of(cached("a", 1), cached("b", 1)), adapter.loadAll());
        }

        try (var reopened = new FileLogStorageAdapter(dir)) {
            assertEquals(List.of(cached("a", 1), cached("b", 1)), reopened.loadAll());
        }
    }

    @Test
    void live_collection_and_disk_agree_when_compaction_fails() throws IOException {
        Path colDir = dir.resolve("sites");
        Files.createDirectories(colDir.resolve("snapshot-00000001.json.tmp"));

        try (DurableCollection col = DurableCollection.open("sites", new FileLogStorageAdapter(colDir, 1, 1L << 30))) {
            col.upsert(Document.of("_id", "x", "v", 1)).join();
            assertEquals(1, col.find(Map.of(), null).fetch().join().size());
        }

        try (DurableCollection col = DurableCollection.open("sites", new FileLogStorageAdapter(colDir))) {
            assertEquals(List.of(new PendingUpsert(Document.of("_id", "x", "v", 1), null)), col.pendingUpserts().join());
        }
    }
}
