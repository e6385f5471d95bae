// file: client/src/main/java/io/hybriddb/client/HybridCollection.java
package io.hybriddb.client;

import io.hybriddb.client.remote.ItemResult;
import io.hybriddb.client.remote.RemoteCollection;
import io.hybriddb.client.remote.RemoteException;
import io.hybriddb.core.Document;
import io.hybriddb.core.query.CompiledSelector;
import io.hybriddb.core.query.FindOptions;
import io.hybriddb.core.query.QueryProcessor;
import io.hybriddb.core.query.SelectorCompiler;
import io.hybriddb.storage.LocalCollection;
import io.hybriddb.storage.PendingUpsert;
import io.hybriddb.storage.UpsertResolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A collection that answers from the local store and keeps it in sync with the remote.
 *
 * Responsibilities:
 *  - Run local and remote queries side by side and deliver INTERIM / CONFIRMED results.
 *  - Cache remote results locally, or overlay pending local changes when caching is off.
 *  - Upload pending upserts and removes, abandoning changes the server refuses for good.
 *
 * Local writes ({@link #upsert}, {@link #remove}) never touch the network.
 */
public final class HybridCollection {
    private static final Logger log = Logger.getLogger(HybridCollection.class.getName());

    private final LocalCollection local;
    private final RemoteCollection remote;
    private final HybridOptions options;
    private final QuickfindEngine quickfind;
    private final int uploadBatchSize;

    /**
     * @param options         resolved collection options (defaults and globals already overlaid)
     * @param uploadBatchSize maximum items per upload request
     * @param quickfindShards shard count used by quickfind
     */
    public HybridCollection(LocalCollection local, RemoteCollection remote, HybridOptions options,
                            int uploadBatchSize, int quickfindShards) {
        if (uploadBatchSize <= 0) throw new IllegalArgumentException("uploadBatchSize must be > 0");
        this.local = Objects.requireNonNull(local, "local");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.options = HybridOptions.DEFAULTS.overlay(options);
        this.quickfind = new QuickfindEngine(remote, quickfindShards);
        this.uploadBatchSize = uploadBatchSize;
    }

    public String name() {
        return local.name();
    }

    public LocalCollection local() {
        return local;
    }

    public RemoteCollection remote() {
        return remote;
    }

    // ---------- queries ----------

    public CompletableFuture<List<Document>> find(Map<String, ?> selector, FindOptions findOptions) {
        return find(selector, findOptions, null, ResultListener.ignore());
    }

    /**
     * Query local and remote concurrently.
     *
     * @param callOptions per-call overrides, or null
     * @param listener    receives the INTERIM and/or CONFIRMED results
     * @return the final result
     */
    public CompletableFuture<List<Document>> find(Map<String, ?> selector, FindOptions findOptions,
                                                  HybridOptions callOptions, ResultListener<List<Document>> listener) {
        HybridOptions opts = options.overlay(callOptions);
        FindOptions fo = FindOptions.orNone(findOptions);
        boolean cache = opts.isCacheFind() && fo.fields() == null;
        return run(selector, fo, opts, cache, Function.identity(), docs -> true, listener);
    }

    public CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions findOptions) {
        return findOne(selector, findOptions, null, ResultListener.ignore());
    }

    /** Like {@link #find}, limited to one document; an interim null is never delivered. */
    public CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions findOptions,
                                               HybridOptions callOptions, ResultListener<Document> listener) {
        HybridOptions opts = options.overlay(callOptions);
        FindOptions fo = FindOptions.orNone(findOptions).withLimit(1);
        boolean cache = opts.isCacheFindOne() && fo.fields() == null;
        Function<List<Document>, Document> first = docs -> docs.isEmpty() ? null : docs.get(0);

        if (!opts.isShortcut()) {
            return run(selector, fo, opts, cache, first, Objects::nonNull, listener);
        }
        return local.findOne(selector, fo).thenCompose(doc -> {
            if (doc != null) {
                deliver(listener, doc, Delivery.CONFIRMED);
                return CompletableFuture.completedFuture(doc);
            }
            return run(selector, fo, opts, cache, first, Objects::nonNull, listener);
        });
    }

    /**
     * Shared two-phase pipeline of find and findOne.
     *
     * @param shape          turns the document list into the delivered result
     * @param deliverInterim whether a local result is worth delivering as INTERIM
     */
    private <R> CompletableFuture<R> run(Map<String, ?> selector, FindOptions fo, HybridOptions opts, boolean cache,
                                         Function<List<Document>, R> shape, Predicate<R> deliverInterim,
                                         ResultListener<R> listener) {
        CompletableFuture<List<Document>> localFuture = local.find(selector, fo).fetch();
        CompletableFuture<List<Document>> remoteFuture = remoteFind(selector, fo, opts, localFuture);

        if (!opts.isInterim()) {
            return remoteFuture
                    .handle((remoteDocs, remoteErr) -> {
                        if (remoteErr == null) return confirm(selector, fo, remoteDocs, cache);
                        Throwable cause = unwrap(remoteErr);
                        if (!opts.isUseLocalOnRemoteError()) return CompletableFuture.<List<Document>>failedFuture(cause);
                        log.log(Level.WARNING, "remote find on " + name() + " failed, answering locally", cause);
                        return localFuture;
                    })
                    .thenCompose(Function.identity())
                    .thenApply(docs -> {
                        R result = shape.apply(docs);
                        deliver(listener, result, Delivery.CONFIRMED);
                        return result;
                    });
        }

        CompletableFuture<R> out = new CompletableFuture<>();
        localFuture.whenComplete((localDocs, localErr) -> {
            if (localErr != null) {
                out.completeExceptionally(unwrap(localErr));
                return;
            }
            R interim = shape.apply(localDocs);
            boolean delivered = deliverInterim.test(interim);
            if (delivered) deliver(listener, interim, Delivery.INTERIM);

            remoteFuture.whenComplete((remoteDocs, remoteErr) -> {
                if (remoteErr != null) {
                    log.log(Level.WARNING, "remote find on " + name() + " failed, keeping local result", unwrap(remoteErr));
                    if (!delivered) deliver(listener, interim, Delivery.CONFIRMED);
                    out.complete(interim);
                    return;
                }
                confirm(selector, fo, remoteDocs, cache).whenComplete((docs, err) -> {
                    if (err != null) {
                        out.completeExceptionally(unwrap(err));
                        return;
                    }
                    R confirmed = shape.apply(docs);
                    if (!delivered || !Objects.equals(confirmed, interim)) deliver(listener, confirmed, Delivery.CONFIRMED);
                    out.complete(confirmed);
                });
            });
        });
        return out;
    }

    private CompletableFuture<List<Document>> remoteFind(Map<String, ?> selector, FindOptions fo, HybridOptions opts,
                                                         CompletableFuture<List<Document>> localFuture) {
        if (opts.isQuickfind() && QuickfindEngine.eligible(fo)) {
            return localFuture.thenCompose(rows -> quickfind.find(selector, fo.sort(), rows));
        }
        return remote.find(selector, fo);
    }

    /** Turn a remote result into the confirmed one: cache and re-query, or overlay pending changes. */
    private CompletableFuture<List<Document>> confirm(Map<String, ?> selector, FindOptions fo,
                                                      List<Document> remoteDocs, boolean cache) {
        if (cache) {
            return local.cache(remoteDocs, selector, fo)
                    .thenCompose(v -> local.find(selector, fo).fetch());
        }
        return local.pendingUpserts().thenCombine(local.pendingRemoves(), (upserts, removes) -> {
            CompiledSelector matcher = SelectorCompiler.compile(selector);
            Set<String> hidden = new HashSet<>(removes);
            for (PendingUpsert p : upserts) hidden.add(p.doc().id());

            Map<String, Document> byId = new LinkedHashMap<>();
            for (Document d : remoteDocs) {
                if (!hidden.contains(d.id())) byId.put(d.id(), d);
            }
            for (PendingUpsert p : upserts) {
                if (matcher.test(p.doc())) byId.put(p.doc().id(), p.doc());
            }
            return QueryProcessor.process(byId.values(), selector, fo);
        });
    }

    // ---------- local changes ----------

    public CompletableFuture<Document> upsert(Document doc) {
        return local.upsert(doc);
    }

    public CompletableFuture<Document> upsert(Document doc, Document base) {
        return local.upsert(doc, base);
    }

    public CompletableFuture<List<Document>> upsert(List<Document> docs, List<Document> bases) {
        return local.upsert(docs, bases);
    }

    public CompletableFuture<Void> remove(String id) {
        return local.remove(id);
    }

    // ---------- upload ----------

    /**
     * Upload pending upserts, then pending removes.
     * <p>
     * Every item is attempted. If any failed, the future fails with
     * {@link UploadFailedException} carrying the report and the first error;
     * failed items stay pending.
     */
    public CompletableFuture<UploadReport> upload() {
        UploadProgress progress = new UploadProgress();
        return local.pendingUpserts()
                .thenCompose(upserts -> uploadUpserts(upserts, progress))
                .thenCompose(v -> local.pendingRemoves())
                .thenCompose(ids -> uploadRemoves(ids, progress))
                .thenCompose(v -> {
                    UploadReport report = progress.report();
                    Throwable first = progress.firstError();
                    if (first != null) {
                        log.warning(() -> String.format("upload %s incomplete: %d errors, first: %s",
                                name(), progress.errorCount(), first.getMessage()));
                        return CompletableFuture.<UploadReport>failedFuture(new UploadFailedException(report, first));
                    }
                    log.fine(() -> String.format("upload %s: %d upserted, %d removed, %d discarded",
                            name(), report.upserted(), report.removed(), report.discarded().size()));
                    return CompletableFuture.completedFuture(report);
                });
    }

    private CompletableFuture<Void> uploadUpserts(List<PendingUpsert> upserts, UploadProgress progress) {
        List<PendingUpsert> overwrites = new ArrayList<>();
        List<PendingUpsert> patches = new ArrayList<>();
        for (PendingUpsert p : upserts) {
            (p.base() == null ? overwrites : patches).add(p);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (List<PendingUpsert> batch : batches(overwrites)) {
            chain = chain.thenCompose(v -> uploadBatch(batch, false, progress));
        }
        for (List<PendingUpsert> batch : batches(patches)) {
            chain = chain.thenCompose(v -> uploadBatch(batch, true, progress));
        }
        return chain;
    }

    private CompletableFuture<Void> uploadBatch(List<PendingUpsert> batch, boolean patch, UploadProgress progress) {
        CompletableFuture<List<ItemResult>> call;
        if (patch) {
            call = remote.patch(batch);
        } else {
            List<Document> docs = new ArrayList<>(batch.size());
            for (PendingUpsert p : batch) docs.add(p.doc());
            call = remote.upsert(docs);
        }

        return call.handle((results, err) -> {
            if (err != null) {
                // the whole batch stays pending
                progress.error(unwrap(err));
                return CompletableFuture.<Void>completedFuture(null);
            }
            List<UpsertResolution> resolved = new ArrayList<>();
            List<String> abandoned = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                PendingUpsert item = batch.get(i);
                ItemResult r = results.get(i);
                if (r instanceof ItemResult.Ok) {
                    resolved.add(new UpsertResolution(item, ((ItemResult.Ok) r).doc()));
                } else {
                    ItemResult.Fault fault = (ItemResult.Fault) r;
                    if (isFinalRefusal(fault.status())) {
                        abandoned.add(item.doc().id());
                        progress.discard(new UploadReport.Discarded(name(), item.doc().id(),
                                UploadReport.Kind.UPSERT, fault.status()));
                    } else {
                        progress.error(fault.toException());
                    }
                }
            }
            progress.upserted(resolved.size());

            CompletableFuture<Void> done = local.resolveUpserts(resolved);
            for (String id : abandoned) {
                done = done.thenCompose(v -> abandon(id));
            }
            return done;
        }).thenCompose(Function.identity());
    }

    private CompletableFuture<Void> uploadRemoves(List<String> ids, UploadProgress progress) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String id : ids) {
            chain = chain.thenCompose(v -> remote.remove(id).handle((ok, err) -> {
                if (err == null) {
                    progress.removed();
                    return local.resolveRemove(id);
                }
                Throwable cause = unwrap(err);
                if (cause instanceof RemoteException && isFinalRefusal(((RemoteException) cause).status())) {
                    log.warning(() -> "discarding refused remove " + name() + "/" + id + ": " + cause.getMessage());
                    progress.discard(new UploadReport.Discarded(name(), id, UploadReport.Kind.REMOVE,
                            ((RemoteException) cause).status()));
                    return local.resolveRemove(id);
                }
                progress.error(cause);
                return CompletableFuture.<Void>completedFuture(null);
            }).thenCompose(Function.identity()));
        }
        return chain;
    }

    /** Drop a refused local change entirely: tombstone it, then resolve the tombstone. */
    private CompletableFuture<Void> abandon(String id) {
        log.warning(() -> "discarding refused upsert " + name() + "/" + id);
        return local.remove(id).thenCompose(v -> local.resolveRemove(id));
    }

    // ---------- helpers ----------

    private static boolean isFinalRefusal(int status) {
        return status == 403 || status == 410;
    }

    private List<List<PendingUpsert>> batches(List<PendingUpsert> items) {
        List<List<PendingUpsert>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += uploadBatchSize) {
            out.add(items.subList(i, Math.min(items.size(), i + uploadBatchSize)));
        }
        return out;
    }

    private <R> void deliver(ResultListener<R> listener, R result, Delivery delivery) {
        try {
            listener.onResult(result, delivery);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "result listener for " + name() + " threw on " + delivery, e);
        }
    }

    static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        return t;
    }

    /** Mutable tally of one upload pass; callbacks run one at a time. */
    private static final class UploadProgress {
        private int upserted;
        private int removed;
        private final List<UploadReport.Discarded> discarded = Collections.synchronizedList(new ArrayList<>());
        private final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        synchronized void upserted(int n) { upserted += n; }
        synchronized void removed() { removed++; }
        void discard(UploadReport.Discarded d) { discarded.add(d); }
        void error(Throwable t) { errors.add(t); }

        Throwable firstError() {
            synchronized (errors) {
                return errors.isEmpty() ? null : errors.get(0);
            }
        }

        int errorCount() {
            return errors.size();
        }

        synchronized UploadReport report() {
            return new UploadReport(upserted, removed, new ArrayList<>(discarded));
        }
    }
}
