// file: storage/src/main/java/io/hybriddb/storage/StorageAdapter.java
package io.hybriddb.storage;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Durable backing store for a single collection.
 * <p>
 * Contract:
 *  - loadAll() returns every entry persisted so far, in insertion order,
 *  - persist() is atomic per call: after a failure none of its puts or
 *    removes may be visible to a later loadAll(),
 *  - a put replaces any previous entry with the same id.
 */
public interface StorageAdapter extends Closeable {

    List<CollectionEntry> loadAll() throws IOException;

    /**
     * @param puts       entries to insert or replace
     * @param removedIds ids whose entries are purged entirely
     */
    void persist(List<CollectionEntry> puts, List<String> removedIds) throws IOException;
}
