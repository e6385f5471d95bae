// file: client/src/test/java/io/hybriddb/client/HybridCollectionTest.java
package io.hybriddb.client;

import io.hybriddb.client.remote.ConflictException;
import io.hybriddb.client.remote.RemoteException;
import io.hybriddb.client.transport.TransportException;
import io.hybriddb.core.Document;
import io.hybriddb.core.query.FindOptions;
import io.hybriddb.storage.DurableDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hybrid engine against an in-process fake remote.
 *
 * Focus:
 *  - INTERIM / CONFIRMED delivery in both modes and on remote errors,
 *  - caching versus overlaying pending changes,
 *  - findOne null handling and shortcut,
 *  - upload: POST vs PATCH, batching, discards and pending failures.
 */
class HybridCollectionTest {

    private static final URI BASE = URI.create("http://remote.invalid/v3/");
    private static final FindOptions BY_ID = FindOptions.sorted("_id");

    private FakeRemote remote;
    private HybridDatabase db;
    private HybridCollection things;

    @BeforeEach
    void setUp() {
        remote = new FakeRemote();
        db = new HybridDatabase(DurableDatabase.inMemory(), remote, HybridConfig.forUrl(BASE));
        things = db.addCollection("things").join();
    }

    @AfterEach
    void tearDown() throws IOException {
        db.close();
    }

    private static List<String> ids(List<Document> docs) {
        List<String> out = new ArrayList<>();
        for (Document d : docs) out.add(d.id());
        return out;
    }

    private List<String> localIds() {
        return ids(things.local().find(Map.of(), BY_ID).fetch().join());
    }

    /** Records every delivery in order. */
    static final class Recorder<T> implements ResultListener<T> {
        final List<T> results = Collections.synchronizedList(new ArrayList<>());
        final List<Delivery> deliveries = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onResult(T result, Delivery delivery) {
            results.add(result);
            deliveries.add(delivery);
        }
    }

    // ---------- find ----------

    @Test
    void find_delivers_local_result_then_confirmed_remote_result() {
        things.local().cacheOne(Document.of("_id", "1", "v", "a")).join();
        remote.put("things", Document.of("_id", "1", "v", "a"));
        remote.put("things", Document.of("_id", "2", "v", "b"));
        Recorder<List<Document>> rec = new Recorder<>();

        List<Document> result = things.find(Map.of(), BY_ID, null, rec).join();

        assertEquals(List.of("1", "2"), ids(result));
        assertEquals(List.of(Delivery.INTERIM, Delivery.CONFIRMED), rec.deliveries);
        assertEquals(List.of("1"), ids(rec.results.get(0)));
    }

    @Test
    void find_does_not_redeliver_an_unchanged_result() {
        things.local().cacheOne(Document.of("_id", "1", "v", "a")).join();
        remote.put("things", Document.of("_id", "1", "v", "a"));
        Recorder<List<Document>> rec = new Recorder<>();

        things.find(Map.of(), BY_ID, null, rec).join();

        assertEquals(List.of(Delivery.INTERIM), rec.deliveries);
    }

    @Test
    void find_caches_remote_result_and_evicts_vanished_documents() {
        things.local().cacheList(List.of(Document.of("_id", "1"), Document.of("_id", "3"))).join();
        remote.put("things", Document.of("_id", "1"));
        remote.put("things", Document.of("_id", "2"));

        things.find(Map.of(), BY_ID).join();

        assertEquals(List.of("1", "2"), localIds());
    }

    @Test
    void find_keeps_interim_result_when_remote_fails() {
        things.local().cacheOne(Document.of("_id", "1")).join();
        remote.failAll = 500;
        Recorder<List<Document>> rec = new Recorder<>();

        List<Document> result = things.find(Map.of(), BY_ID, null, rec).join();

        assertEquals(List.of("1"), ids(result));
        assertEquals(List.of(Delivery.INTERIM), rec.deliveries);
    }

    @Test
    void non_interim_find_delivers_once_after_remote() {
        things.local().cacheOne(Document.of("_id", "1")).join();
        remote.put("things", Document.of("_id", "1"));
        remote.put("things", Document.of("_id", "2"));
        Recorder<List<Document>> rec = new Recorder<>();

        List<Document> result = things.find(Map.of(), BY_ID, HybridOptions.INHERIT.withInterim(false), rec).join();

        assertEquals(List.of("1", "2"), ids(result));
        assertEquals(List.of(Delivery.CONFIRMED), rec.deliveries);
    }

    @Test
    void non_interim_find_falls_back_to_local_on_remote_error() {
        things.local().cacheOne(Document.of("_id", "1")).join();
        remote.failAll = 503;
        Recorder<List<Document>> rec = new Recorder<>();

        List<Document> result = things.find(Map.of(), BY_ID, HybridOptions.INHERIT.withInterim(false), rec).join();

        assertEquals(List.of("1"), ids(result));
        assertEquals(List.of(Delivery.CONFIRMED), rec.deliveries);
    }

    @Test
    void non_interim_find_without_local_fallback_fails() {
        remote.failAll = 500;
        HybridOptions strict = HybridOptions.INHERIT.withInterim(false).withUseLocalOnRemoteError(false);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> things.find(Map.of(), BY_ID, strict, ResultListener.ignore()).join());
        assertInstanceOf(RemoteException.class, ex.getCause());
        assertEquals(500, ((RemoteException) ex.getCause()).status());
    }

    @Test
    void find_without_caching_overlays_pending_changes() {
        remote.put("things", Document.of("_id", "1", "x", 1));
        remote.put("things", Document.of("_id", "2", "x", 1));
        remote.put("things", Document.of("_id", "3", "x", 1));
        things.upsert(Document.of("_id", "1", "x", 2)).join();
        things.remove("2").join();
        things.upsert(Document.of("_id", "4", "x", 1)).join();

        HybridOptions noCache = HybridOptions.INHERIT.withCacheFind(false).withInterim(false);
        List<Document> result = things.find(Map.of("x", 1), BY_ID, noCache, ResultListener.ignore()).join();

        assertEquals(List.of("3", "4"), ids(result));
        // nothing cached
        assertEquals(List.of("1", "4"), localIds());
    }

    @Test
    void find_with_projection_does_not_cache_partial_documents() {
        remote.put("things", Document.of("_id", "1", "a", 1, "b", 2));

        List<Document> result = things.find(Map.of(), FindOptions.NONE.withFields(Map.of("a", 1))).join();

        assertEquals(List.of(Document.of("_id", "1", "a", 1)), result);
        assertEquals(List.of(), localIds());
    }

    @Test
    void long_selector_is_sent_as_post_find() {
        remote.put("things", Document.of("_id", "1", "tag", "x".repeat(3000)));

        List<Document> result = things.find(Map.of("tag", "x".repeat(3000)), null).join();

        assertEquals(List.of("1"), ids(result));
        assertTrue(remote.methods().contains("POST things/find"));
    }

    // ---------- findOne ----------

    @Test
    void find_one_never_delivers_interim_null() {
        remote.put("things", Document.of("_id", "1", "v", "a"));
        Recorder<Document> rec = new Recorder<>();

        Document result = things.findOne(Map.of("_id", "1"), null, null, rec).join();

        assertEquals("a", result.get("v"));
        assertEquals(List.of(Delivery.CONFIRMED), rec.deliveries);
        assertEquals(List.of("1"), localIds());
    }

    @Test
    void find_one_delivers_null_once_when_remote_fails_and_nothing_is_local() {
        remote.failAll = 500;
        Recorder<Document> rec = new Recorder<>();

        Document result = things.findOne(Map.of("_id", "1"), null, null, rec).join();

        assertNull(result);
        assertEquals(List.of(Delivery.CONFIRMED), rec.deliveries);
        assertNull(rec.results.get(0));
    }

    @Test
    void find_one_shortcut_answers_locally_without_remote_call() {
        things.local().cacheOne(Document.of("_id", "1")).join();
        Recorder<Document> rec = new Recorder<>();

        Document result = things.findOne(Map.of("_id", "1"), null, HybridOptions.INHERIT.withShortcut(true), rec).join();

        assertEquals("1", result.id());
        assertEquals(List.of(Delivery.CONFIRMED), rec.deliveries);
        assertTrue(remote.requests.isEmpty());
    }

    @Test
    void find_one_shortcut_goes_remote_when_nothing_is_local() {
        remote.put("things", Document.of("_id", "1"));

        Document result = things.findOne(Map.of("_id", "1"), null, HybridOptions.INHERIT.withShortcut(true),
                ResultListener.ignore()).join();

        assertEquals("1", result.id());
        assertEquals(1, remote.requests.size());
    }

    // ---------- upload ----------

    @Test
    void upload_posts_overwrites_and_patches_changes_with_a_base() {
        things.upsert(Document.of("_id", "1", "n", 1)).join();
        things.local().cacheOne(Document.of("_id", "2", "n", 1)).join();
        things.upsert(Document.of("_id", "2", "n", 2)).join();

        UploadReport report = things.upload().join();

        assertEquals(2, report.upserted());
        assertEquals(List.of("POST things", "PATCH things"), remote.methods());
        assertTrue(things.local().pendingUpserts().join().isEmpty());
        // the server's merged version, with its _rev, is now cached
        Document two = things.local().findOne(Map.of("_id", "2"), null).join();
        assertEquals(2, two.get("n"));
        assertNotNull(two.rev());
    }

    @Test
    void upload_splits_upserts_into_batches() throws IOException {
        db.close();
        db = new HybridDatabase(DurableDatabase.inMemory(), remote, HybridConfig.forUrl(BASE).withUploadBatchSize(2));
        HybridCollection c = db.addCollection("things").join();
        for (int i = 0; i < 5; i++) c.upsert(Document.of("_id", "d" + i)).join();

        UploadReport report = c.upload().join();

        assertEquals(5, report.upserted());
        assertEquals(List.of("POST things", "POST things", "POST things"), remote.methods());
        assertEquals(5, remote.docs("things").size());
    }

    @Test
    void upload_abandons_refused_changes_and_keeps_conflicts_pending() {
        things.upsert(Document.of("_id", "1")).join();
        things.upsert(Document.of("_id", "2")).join();
        things.upsert(Document.of("_id", "3")).join();
        remote.upsertFaults.put("2", 403);
        remote.upsertFaults.put("3", 409);

        CompletionException ex = assertThrows(CompletionException.class, () -> things.upload().join());

        UploadFailedException failed = assertInstanceOf(UploadFailedException.class, ex.getCause());
        assertInstanceOf(ConflictException.class, failed.getCause());
        assertEquals(1, failed.report().upserted());
        assertEquals(List.of(new UploadReport.Discarded("things", "2", UploadReport.Kind.UPSERT, 403)),
                failed.report().discarded());

        assertEquals(List.of("3"), ids(pendingDocs()));
        assertTrue(things.local().pendingRemoves().join().isEmpty());
        assertEquals(List.of("1", "3"), localIds());
    }

    @Test
    void upload_removes_and_drops_gone_documents() {
        things.local().cacheList(List.of(Document.of("_id", "1"), Document.of("_id", "2"))).join();
        remote.put("things", Document.of("_id", "1"));
        things.remove("1").join();
        things.remove("2").join();
        remote.removeFaults.put("2", 410);

        UploadReport report = things.upload().join();

        assertEquals(1, report.removed());
        assertEquals(List.of(new UploadReport.Discarded("things", "2", UploadReport.Kind.REMOVE, 410)),
                report.discarded());
        assertTrue(things.local().pendingRemoves().join().isEmpty());
        assertTrue(remote.docs("things").isEmpty());
    }

    @Test
    void upload_keeps_everything_pending_when_remote_is_unreachable() {
        things.upsert(Document.of("_id", "1")).join();
        things.remove("2").join();
        remote.unreachable = true;

        CompletionException ex = assertThrows(CompletionException.class, () -> things.upload().join());

        UploadFailedException failed = assertInstanceOf(UploadFailedException.class, ex.getCause());
        assertInstanceOf(TransportException.class, failed.getCause());
        assertEquals(UploadReport.EMPTY, failed.report());
        assertEquals(List.of("1"), ids(pendingDocs()));
        assertEquals(List.of("2"), things.local().pendingRemoves().join());
    }

    @Test
    void database_upload_covers_every_collection_before_failing() {
        HybridCollection other = db.addCollection("other").join();
        things.upsert(Document.of("_id", "1")).join();
        other.upsert(Document.of("_id", "9")).join();
        remote.upsertFaults.put("1", 409);

        CompletionException ex = assertThrows(CompletionException.class, () -> db.upload().join());

        UploadFailedException failed = assertInstanceOf(UploadFailedException.class, ex.getCause());
        assertInstanceOf(ConflictException.class, failed.getCause());
        assertEquals(1, failed.report().upserted());
        assertEquals(List.of("9"), ids(remote.docs("other")));
        assertEquals(List.of("things", "other"), db.getCollectionNames());
    }

    @Test
    void options_layer_call_over_collection_over_defaults() throws IOException {
        db.close();
        db = new HybridDatabase(DurableDatabase.inMemory(), remote,
                HybridConfig.forUrl(BASE)
                        .withDefaults(HybridOptions.INHERIT.withInterim(false))
                        .withCollection("things", HybridOptions.INHERIT.withInterim(true)));
        HybridCollection c = db.addCollection("things").join();
        HybridCollection plain = db.addCollection("plain").join();
        c.local().cacheOne(Document.of("_id", "1")).join();
        plain.local().cacheOne(Document.of("_id", "1")).join();
        remote.put("things", Document.of("_id", "1"));
        remote.put("plain", Document.of("_id", "1"));

        Recorder<List<Document>> collectionLevel = new Recorder<>();
        c.find(Map.of(), BY_ID, null, collectionLevel).join();
        Recorder<List<Document>> globalLevel = new Recorder<>();
        plain.find(Map.of(), BY_ID, null, globalLevel).join();
        Recorder<List<Document>> callLevel = new Recorder<>();
        c.find(Map.of(), BY_ID, HybridOptions.INHERIT.withInterim(false), callLevel).join();

        assertEquals(List.of(Delivery.INTERIM), collectionLevel.deliveries);
        assertEquals(List.of(Delivery.CONFIRMED), globalLevel.deliveries);
        assertEquals(List.of(Delivery.CONFIRMED), callLevel.deliveries);
    }

    private List<Document> pendingDocs() {
        List<Document> out = new ArrayList<>();
        things.local().pendingUpserts().join().forEach(p -> out.add(p.doc()));
        return out;
    }
}
