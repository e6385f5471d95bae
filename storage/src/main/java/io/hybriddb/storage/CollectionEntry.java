// file: storage/src/main/java/io/hybriddb/storage/CollectionEntry.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;

import java.util.Objects;

/**
 * Stored state of one id inside a local collection.
 * <p>
 *  - CACHED:   read-only copy obtained from the remote,
 *  - UPSERTED: local change pending upload, with an optional base
 *              (null base = overwrite without merge),
 *  - REMOVED:  tombstone pending upload; doc and base are null.
 */
public record CollectionEntry(String id, State state, Document doc, Document base) {

    public enum State { CACHED, UPSERTED, REMOVED }

    public CollectionEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        if (state == State.REMOVED) {
            doc = null;
            base = null;
        } else {
            Objects.requireNonNull(doc, "doc");
        }
        if (state == State.CACHED) base = null;
    }

    public static CollectionEntry cached(Document doc) {
        return new CollectionEntry(doc.id(), State.CACHED, doc, null);
    }

    public static CollectionEntry upserted(Document doc, Document base) {
        return new CollectionEntry(doc.id(), State.UPSERTED, doc, base);
    }

    public static CollectionEntry removed(String id) {
        return new CollectionEntry(id, State.REMOVED, null, null);
    }

    public boolean isCached() { return state == State.CACHED; }
    public boolean isUpserted() { return state == State.UPSERTED; }
    public boolean isRemoved() { return state == State.REMOVED; }

    /** Cached and upserted entries are visible to queries; tombstones are not. */
    public boolean isVisible() { return state != State.REMOVED; }
}
