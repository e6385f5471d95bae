// file: storage/src/main/java/io/hybriddb/storage/DurableCollection.java
package io.hybriddb.storage;

import io.hybriddb.core.BaseIdMismatchException;
import io.hybriddb.core.Document;
import io.hybriddb.core.Ids;
import io.hybriddb.core.ValidationException;
import io.hybriddb.core.Values;
import io.hybriddb.core.query.FindOptions;
import io.hybriddb.core.query.QueryProcessor;
import io.hybriddb.core.query.SelectorCompiler;
import io.hybriddb.core.query.SortCompiler;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link LocalCollection} backed by a {@link StorageAdapter}.
 * <p>
 * Responsibilities:
 *  - Keep the committed state in memory: id -> entry, insertion order.
 *  - On write (single writer thread per collection):
 *      1) Compute every transition of the call against a {@link WriteBatch}
 *         overlay of the committed state.
 *      2) Persist the batch to the adapter in one call.
 *      3) Apply it to memory only after the adapter succeeded.
 *  - On read: copy the committed state on the writer thread (so reads see
 *    every write issued before them), then run the query on the common pool.
 */
public final class DurableCollection implements LocalCollection, Closeable {
    private static final Logger log = Logger.getLogger(DurableCollection.class.getName());

    private final String name;
    private final StorageAdapter adapter;
    private final ExecutorService writer;
    // touched only on the writer thread
    private final Map<String, CollectionEntry> entries = new LinkedHashMap<>();

    private DurableCollection(String name, StorageAdapter adapter, List<CollectionEntry> loaded) {
        this.name = name;
        this.adapter = adapter;
        for (CollectionEntry e : loaded) entries.put(e.id(), e);
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hybriddb-" + name + "-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Load the adapter's entries and open the collection.
     *
     * @throws MissingAdapterException when {@code adapter} is null
     */
    public static DurableCollection open(String name, StorageAdapter adapter) throws IOException {
        if (adapter == null) throw new MissingAdapterException("no storage adapter for collection " + name);
        List<CollectionEntry> loaded = adapter.loadAll();
        log.fine(() -> "opened collection " + name + " with " + loaded.size() + " entries");
        return new DurableCollection(name, adapter, loaded);
    }

    @Override
    public String name() {
        return name;
    }

    // ---------- reads ----------

    @Override
    public Query find(Map<String, ?> selector, FindOptions options) {
        SelectorCompiler.compile(selector);
        return () -> read(snapshot -> QueryProcessor.process(visibleDocs(snapshot), selector, options));
    }

    @Override
    public CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions options) {
        FindOptions single = FindOptions.orNone(options).withLimit(1);
        return find(selector, single).fetch().thenApply(docs -> docs.isEmpty() ? null : docs.get(0));
    }

    @Override
    public CompletableFuture<List<PendingUpsert>> pendingUpserts() {
        return read(snapshot -> {
            List<PendingUpsert> out = new ArrayList<>();
            for (CollectionEntry e : snapshot) {
                if (e.isUpserted()) out.add(new PendingUpsert(e.doc(), e.base()));
            }
            return out;
        });
    }

    @Override
    public CompletableFuture<List<String>> pendingRemoves() {
        return read(snapshot -> {
            List<String> out = new ArrayList<>();
            for (CollectionEntry e : snapshot) {
                if (e.isRemoved()) out.add(e.id());
            }
            return out;
        });
    }

    // ---------- local changes ----------

    @Override
    public CompletableFuture<List<Document>> upsert(List<Document> docs, List<Document> bases) {
        List<PendingUpsert> items = normalizeUpsert(docs, bases);
        return write(batch -> {
            List<Document> stored = new ArrayList<>(items.size());
            for (PendingUpsert item : items) {
                Document doc = item.doc();
                CollectionEntry existing = batch.get(doc.id());
                Document base;
                if (item.base() != null) {
                    base = item.base();
                } else if (existing != null && existing.isUpserted()) {
                    base = existing.base();
                } else if (existing != null && existing.isCached()) {
                    base = existing.doc();
                } else {
                    base = null;
                }
                batch.put(CollectionEntry.upserted(doc, base));
                stored.add(doc);
            }
            return stored;
        });
    }

    @Override
    public CompletableFuture<Void> remove(String id) {
        requireId(id);
        return write(batch -> {
            CollectionEntry existing = batch.get(id);
            if (existing == null || !existing.isRemoved()) batch.put(CollectionEntry.removed(id));
            return null;
        });
    }

    // ---------- server-sourced state ----------

    @Override
    public CompletableFuture<Void> cache(List<Document> docs, Map<String, ?> selector, FindOptions options) {
        Objects.requireNonNull(docs, "docs");
        SelectorCompiler.compile(selector);
        for (Document d : docs) requireDocId(d);
        FindOptions opts = FindOptions.orNone(options);
        Set<String> exclude = new HashSet<>(opts.exclude());

        return write(batch -> {
            Set<String> returned = new HashSet<>();
            for (Document d : docs) {
                returned.add(d.id());
                if (!exclude.contains(d.id())) cacheInto(batch, d);
            }

            // Only an unshaped query says anything about which cached rows should exist.
            FindOptions matchAll = new FindOptions(null, opts.sort(), null, null, null);
            List<Document> cached = new ArrayList<>();
            for (CollectionEntry e : batch.entries()) {
                if (e.isCached()) cached.add(e.doc());
            }
            boolean fullWindow = opts.hasLimit() && docs.size() >= opts.limit() && !docs.isEmpty();
            // an unordered partial window says nothing about the rows outside it
            if (opts.sort() == null && (fullWindow || opts.hasSkip())) return null;
            if (opts.hasSkip() && docs.isEmpty()) return null;

            Comparator<Document> order = opts.sort() == null ? null : SortCompiler.compile(opts.sort());
            Document first = docs.isEmpty() ? null : docs.get(0);
            Document last = docs.isEmpty() ? null : docs.get(docs.size() - 1);
            for (Document candidate : QueryProcessor.process(cached, selector, matchAll)) {
                String id = candidate.id();
                if (returned.contains(id) || exclude.contains(id)) continue;
                // before a skipped window or past the end of a full one: the server did not say it is gone
                if (order != null && opts.hasSkip() && order.compare(candidate, first) <= 0) continue;
                if (order != null && fullWindow && order.compare(candidate, last) >= 0) continue;
                batch.purge(id);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> cacheOne(Document doc) {
        requireDocId(doc);
        return write(batch -> {
            cacheInto(batch, doc);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> cacheList(List<Document> docs) {
        for (Document d : docs) requireDocId(d);
        return write(batch -> {
            for (Document d : docs) cacheInto(batch, d);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> uncache(Map<String, ?> selector) {
        SelectorCompiler.compile(selector);
        return write(batch -> {
            List<Document> cached = new ArrayList<>();
            for (CollectionEntry e : batch.entries()) {
                if (e.isCached()) cached.add(e.doc());
            }
            for (Document d : QueryProcessor.process(cached, selector, FindOptions.NONE)) batch.purge(d.id());
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> uncacheList(List<String> ids) {
        return write(batch -> {
            for (String id : ids) {
                CollectionEntry e = batch.get(id);
                if (e != null && e.isCached()) batch.purge(id);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> resolveUpserts(List<UpsertResolution> resolutions) {
        for (UpsertResolution r : resolutions) requireDocId(r.uploaded().doc());
        return write(batch -> {
            for (UpsertResolution r : resolutions) {
                PendingUpsert uploaded = r.uploaded();
                String id = uploaded.doc().id();
                CollectionEntry existing = batch.get(id);
                if (existing == null || !existing.isUpserted()) continue;

                Document resolved = r.merged() == null ? uploaded.doc() : r.merged();
                if (!id.equals(resolved.id())) resolved = resolved.withId(id);

                if (existing.doc().equals(uploaded.doc()) && Objects.equals(existing.base(), uploaded.base())) {
                    batch.put(CollectionEntry.cached(resolved));
                } else {
                    // changed locally while the upload was in flight: keep the value, advance the base
                    batch.put(CollectionEntry.upserted(existing.doc(), resolved));
                }
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> resolveRemove(String id) {
        requireId(id);
        return write(batch -> {
            CollectionEntry e = batch.get(id);
            if (e != null && e.isRemoved()) batch.purge(id);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> seed(List<Document> docs) {
        for (Document d : docs) requireDocId(d);
        return write(batch -> {
            for (Document d : docs) {
                if (batch.get(d.id()) == null) batch.put(CollectionEntry.cached(d));
            }
            return null;
        });
    }

    /** Finish queued writes, then close the adapter. */
    @Override
    public void close() throws IOException {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warning("collection " + name + " writer did not drain in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        adapter.close();
    }

    // ---------- execution ----------

    private <T> CompletableFuture<T> write(Function<WriteBatch, T> body) {
        return CompletableFuture.supplyAsync(() -> {
            WriteBatch batch = new WriteBatch(entries);
            T result = body.apply(batch);
            if (batch.isEmpty()) return result;
            try {
                adapter.persist(batch.puts(), batch.removes());
            } catch (IOException e) {
                throw new CompletionException(e);
            }
            batch.applyTo(entries);
            return result;
        }, writer);
    }

    private <T> CompletableFuture<T> read(Function<List<CollectionEntry>, T> body) {
        return CompletableFuture.supplyAsync(() -> List.copyOf(entries.values()), writer)
                .thenApplyAsync(body);
    }

    // ---------- helpers ----------

    private static void cacheInto(WriteBatch batch, Document doc) {
        CollectionEntry existing = batch.get(doc.id());
        if (existing != null) {
            if (!existing.isCached()) return;
            if (isNewer(existing.doc().rev(), doc.rev())) return;
            if (existing.doc().equals(doc)) return;
        }
        batch.put(CollectionEntry.cached(doc));
    }

    /** True when both revisions are present, comparable and {@code held} is strictly newer. */
    private static boolean isNewer(Object held, Object incoming) {
        if (held == null || incoming == null) return false;
        Integer c = Values.compareSameClass(held, incoming);
        return c != null && c > 0;
    }

    private static List<Document> visibleDocs(List<CollectionEntry> snapshot) {
        List<Document> out = new ArrayList<>(snapshot.size());
        for (CollectionEntry e : snapshot) {
            if (e.isVisible()) out.add(e.doc());
        }
        return out;
    }

    private static List<PendingUpsert> normalizeUpsert(List<Document> docs, List<Document> bases) {
        Objects.requireNonNull(docs, "docs");
        List<PendingUpsert> items = new ArrayList<>(docs.size());
        for (int i = 0; i < docs.size(); i++) {
            Document doc = docs.get(i);
            if (doc == null) throw new ValidationException("upsert document must not be null");
            if (!doc.hasId()) doc = doc.withId(Ids.newId());
            Document base = bases != null && i < bases.size() ? bases.get(i) : null;
            if (base != null) {
                if (!base.hasId()) throw new BaseIdMismatchException("base needs _id");
                if (!base.id().equals(doc.id())) {
                    throw new BaseIdMismatchException("base _id " + base.id() + " differs from document _id " + doc.id());
                }
            }
            items.add(new PendingUpsert(doc, base));
        }
        return items;
    }

    private static void requireDocId(Document doc) {
        if (doc == null || !doc.hasId()) throw new ValidationException("document needs _id");
    }

    private static void requireId(String id) {
        if (id == null || id.isEmpty()) throw new ValidationException("id must not be empty");
    }

    /**
     * Pending changes of one write call, overlaid on the committed state so
     * later steps of the same call see earlier ones.
     */
    private static final class WriteBatch {
        private final Map<String, CollectionEntry> committed;
        private final Map<String, CollectionEntry> puts = new LinkedHashMap<>();
        private final Set<String> removes = new LinkedHashSet<>();

        WriteBatch(Map<String, CollectionEntry> committed) {
            this.committed = committed;
        }

        CollectionEntry get(String id) {
            if (removes.contains(id)) return null;
            CollectionEntry e = puts.get(id);
            return e != null ? e : committed.get(id);
        }

        void put(CollectionEntry e) {
            removes.remove(e.id());
            puts.put(e.id(), e);
        }

        void purge(String id) {
            puts.remove(id);
            if (committed.containsKey(id)) removes.add(id);
        }

        List<CollectionEntry> entries() {
            List<CollectionEntry> out = new ArrayList<>(committed.size() + puts.size());
            for (CollectionEntry e : committed.values()) {
                if (removes.contains(e.id())) continue;
                CollectionEntry p = puts.get(e.id());
                out.add(p != null ? p : e);
            }
            for (CollectionEntry p : puts.values()) {
                if (!committed.containsKey(p.id())) out.add(p);
            }
            return out;
        }

        boolean isEmpty() {
            return puts.isEmpty() && removes.isEmpty();
        }

        List<CollectionEntry> puts() {
            return new ArrayList<>(puts.values());
        }

        List<String> removes() {
            return new ArrayList<>(removes);
        }

        void applyTo(Map<String, CollectionEntry> target) {
            for (String id : removes) target.remove(id);
            for (CollectionEntry e : puts.values()) target.put(e.id(), e);
        }
    }
}
