// file: storage/src/test/java/io/hybriddb/storage/LocalStoresTest.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;
import io.hybriddb.core.query.FindOptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalStoresTest {

    @Test
    void clone_copies_cache_pending_upserts_with_bases_and_removes() throws IOException {
        try (DurableDatabase from = DurableDatabase.inMemory(); DurableDatabase to = DurableDatabase.inMemory()) {
            LocalCollection src = from.addCollection("sites").join();
            src.cacheList(List.of(Document.of("_id", "1", "v", 1), Document.of("_id", "2", "v", 1))).join();
            src.upsert(Document.of("_id", "1", "v", 2)).join();
            src.upsert(Document.of("_id", "new")).join();
            src.cacheOne(Document.of("_id", "3")).join();
            src.remove("3").join();

            LocalStores.cloneDatabase(from, to).join();

            LocalCollection dst = to.collection("sites");
            assertNotNull(dst);
            assertEquals(src.pendingUpserts().join(), dst.pendingUpserts().join());
            assertEquals(List.of("3"), dst.pendingRemoves().join());
            assertEquals(src.find(Map.of(), FindOptions.sorted("_id")).fetch().join(),
                    dst.find(Map.of(), FindOptions.sorted("_id")).fetch().join());
        }
    }

    @Test
    void migrate_moves_pending_changes_and_resolves_them_at_the_source() throws IOException {
        try (DurableDatabase from = DurableDatabase.inMemory(); DurableDatabase to = DurableDatabase.inMemory()) {
            LocalCollection src = from.addCollection("sites").join();
            from.addCollection("unmatched").join().upsert(Document.of("_id", "u")).join();
            LocalCollection dst = to.addCollection("sites").join();

            src.cacheOne(Document.of("_id", "1", "v", 1)).join();
            src.upsert(Document.of("_id", "1", "v", 2)).join();
            src.upsert(Document.of("_id", "new")).join();
            src.cacheOne(Document.of("_id", "2")).join();
            src.remove("2").join();
            src.cacheOne(Document.of("_id", "3")).join();

            LocalStores.migrateDatabase(from, to).join();

            assertEquals(List.of(
                    new PendingUpsert(Document.of("_id", "1", "v", 2), Document.of("_id", "1", "v", 1)),
                    new PendingUpsert(Document.of("_id", "new"), null)), dst.pendingUpserts().join());
            assertEquals(List.of("2"), dst.pendingRemoves().join());

            assertEquals(List.of(), src.pendingUpserts().join());
            assertEquals(List.of(), src.pendingRemoves().join());
            assertEquals(Document.of("_id", "1", "v", 2), src.findOne(Map.of("_id", "1"), null).join());
            assertNotNull(src.findOne(Map.of("_id", "3"), null).join());
            assertNull(dst.findOne(Map.of("_id", "3"), null).join());

            assertNull(to.collection("unmatched"));
            assertEquals(1, from.collection("unmatched").pendingUpserts().join().size());
        }
    }
}
