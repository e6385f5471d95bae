// file: client/src/main/java/io/hybriddb/client/remote/RemoteCollection.java
package io.hybriddb.client.remote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.hybriddb.client.transport.Transport;
import io.hybriddb.client.transport.TransportException;
import io.hybriddb.client.transport.TransportRequest;
import io.hybriddb.client.transport.TransportResponse;
import io.hybriddb.core.Document;
import io.hybriddb.core.Json;
import io.hybriddb.core.Values;
import io.hybriddb.core.query.FindOptions;
import io.hybriddb.core.quickfind.ChangedShard;
import io.hybriddb.storage.PendingUpsert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Client for one collection of the remote database.
 *
 * Wire format:
 *  - find:      GET /{col}?selector=&fields=&sort=&limit=&skip= (JSON-encoded values),
 *               or POST /{col}/find with the same keys as a body when the URL is too long,
 *  - upsert:    POST /{col} with a document or an array of documents,
 *  - patch:     PATCH /{col} with {doc, base}, both arrays for batches,
 *  - remove:    DELETE /{col}/{id},
 *  - quickfind: POST /{col}/quickfind with {selector, sort, shardCount, shards}.
 *
 * Non-200 answers to find, remove and quickfind fail the future with a
 * {@link RemoteException}. Upsert and patch answer per item.
 */
public final class RemoteCollection {
    private static final Logger log = Logger.getLogger(RemoteCollection.class.getName());

    private final String name;
    private final String path;
    private final Transport transport;
    private final boolean usePostFind;
    private final int maxUrlLength;

    public RemoteCollection(String name, Transport transport, boolean usePostFind, int maxUrlLength) {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.path = encodeSegment(name);
        this.usePostFind = usePostFind;
        this.maxUrlLength = maxUrlLength;
    }

    public String name() {
        return name;
    }

    // ---------- queries ----------

    public CompletableFuture<List<Document>> find(Map<String, ?> selector, FindOptions options) {
        FindOptions opts = FindOptions.orNone(options);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("selector", selector == null ? Map.of() : selector);
        if (opts.fields() != null) params.put("fields", opts.fields());
        if (opts.sort() != null) params.put("sort", opts.sort());
        if (opts.hasLimit()) params.put("limit", opts.limit());
        if (opts.hasSkip()) params.put("skip", opts.skip());

        TransportRequest request = usePostFind ? null : getFind(params);
        if (request == null || transport.urlLength(request) > maxUrlLength) {
            request = TransportRequest.post(path + "/find", params);
        }
        return transport.send(request).thenApply(resp -> {
            requireOk(resp);
            Object body = parse(resp);
            if (!(body instanceof List)) throw new TransportException("find on " + name + " did not return an array");
            List<Document> out = new ArrayList<>();
            for (Object o : (List<?>) body) out.add(toDocument(o));
            return out;
        });
    }

    public CompletableFuture<Document> findOne(Map<String, ?> selector, FindOptions options) {
        return find(selector, FindOptions.orNone(options).withLimit(1))
                .thenApply(docs -> docs.isEmpty() ? null : docs.get(0));
    }

    /**
     * Ask for the shards whose contents differ from the client's hashes.
     *
     * @param shardHashes base64 shard hashes, index = shard number
     */
    public CompletableFuture<List<ChangedShard>> quickfind(Map<String, ?> selector, Object sort, List<String> shardHashes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("selector", selector == null ? Map.of() : selector);
        if (sort != null) body.put("sort", sort);
        body.put("shardCount", shardHashes.size());
        body.put("shards", shardHashes);

        return transport.send(TransportRequest.post(path + "/quickfind", body)).thenApply(resp -> {
            requireOk(resp);
            try {
                return Json.MAPPER.readValue(resp.body(), QuickfindReply.class).shards;
            } catch (JsonProcessingException e) {
                throw new TransportException("undecodable quickfind reply for " + name, e);
            }
        });
    }

    // ---------- changes ----------

    /** Overwrite documents; one result per document, in order. */
    public CompletableFuture<List<ItemResult>> upsert(List<Document> docs) {
        Object body = docs.size() == 1 ? docs.get(0) : docs;
        return transport.send(TransportRequest.post(path, body))
                .thenApply(resp -> itemResults(resp, docs.size()));
    }

    /** Upload changes together with their bases so the server can merge them. */
    public CompletableFuture<List<ItemResult>> patch(List<PendingUpsert> items) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (items.size() == 1) {
            body.put("doc", items.get(0).doc());
            body.put("base", items.get(0).base());
        } else {
            List<Document> docs = new ArrayList<>(items.size());
            List<Document> bases = new ArrayList<>(items.size());
            for (PendingUpsert p : items) {
                docs.add(p.doc());
                bases.add(p.base());
            }
            body.put("doc", docs);
            body.put("base", bases);
        }
        return transport.send(TransportRequest.patch(path, body))
                .thenApply(resp -> itemResults(resp, items.size()));
    }

    public CompletableFuture<Void> remove(String id) {
        return transport.send(TransportRequest.delete(path + "/" + encodeSegment(id))).thenApply(resp -> {
            requireOk(resp);
            return null;
        });
    }

    // ---------- helpers ----------

    private TransportRequest getFind(Map<String, Object> params) {
        Map<String, String> query = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object v = e.getValue();
            query.put(e.getKey(), v instanceof Integer ? v.toString() : Json.write(v));
        }
        return TransportRequest.get(path, query);
    }

    /**
     * A non-200 status applies to every item. In a 200 array, an element with
     * no _id and an integer status is that item's fault.
     */
    private List<ItemResult> itemResults(TransportResponse resp, int expected) {
        List<ItemResult> out = new ArrayList<>(expected);
        if (!resp.isOk()) {
            String message = errorMessage(resp);
            for (int i = 0; i < expected; i++) out.add(new ItemResult.Fault(resp.status(), message));
            return out;
        }

        Object body = parse(resp);
        List<?> elements = body instanceof List ? (List<?>) body : Collections.singletonList(body);
        if (elements.size() != expected) {
            throw new TransportException("expected " + expected + " results from " + name + ", got " + elements.size());
        }
        for (Object o : elements) {
            if (o instanceof Map && !((Map<?, ?>) o).containsKey(Document.ID)
                    && ((Map<?, ?>) o).get("status") instanceof Integer) {
                Map<?, ?> m = (Map<?, ?>) o;
                Object msg = m.get("error");
                out.add(new ItemResult.Fault((Integer) m.get("status"), msg == null ? "refused" : msg.toString()));
            } else {
                out.add(new ItemResult.Ok(toDocument(o)));
            }
        }
        return out;
    }

    private Document toDocument(Object o) {
        if (!(o instanceof Map<?, ?> m)) throw new TransportException("expected a document from " + name + ", got " + o);
        return Document.of(Values.copyMap(m));
    }

    private static void requireOk(TransportResponse resp) {
        if (!resp.isOk()) throw RemoteException.forStatus(resp.status(), errorMessage(resp));
    }

    private static Object parse(TransportResponse resp) {
        try {
            return Json.MAPPER.readValue(resp.body(), Object.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransportException("undecodable response body", e);
        }
    }

    static String errorMessage(TransportResponse resp) {
        String body = resp.body();
        if (body == null || body.isBlank()) return "no body";
        try {
            Object parsed = Json.MAPPER.readValue(body, Object.class);
            if (parsed instanceof Map && ((Map<?, ?>) parsed).get("error") != null) {
                return ((Map<?, ?>) parsed).get("error").toString();
            }
        } catch (JsonProcessingException e) {
            log.fine("plain-text error body: " + e.getOriginalMessage());
        }
        return body;
    }

    private static String encodeSegment(String s) {
        return Transport.encode(s);
    }

    /** Body of a quickfind reply. */
    static final class QuickfindReply {
        final List<ChangedShard> shards;

        @JsonCreator
        QuickfindReply(@JsonProperty("shards") List<ChangedShard> shards) {
            this.shards = shards == null ? List.of() : shards;
        }
    }
}
