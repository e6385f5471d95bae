// file: storage/src/main/java/io/hybriddb/storage/Snapshotter.java
package io.hybriddb.storage;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of a collection's entries at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records written after that snapshot.
 */
interface Snapshotter {

    /**
     * Persist a full copy of the current entries.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Collection<CollectionEntry> current) throws IOException;

    /** Load the latest snapshot, or null when none has been written. */
    LoadedSnapshot loadLatest() throws IOException;

    /** Simple holder for snapshot id and its data. */
    record LoadedSnapshot(String id, List<CollectionEntry> entries) {}
}
