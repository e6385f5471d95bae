// file: storage/src/main/java/io/hybriddb/storage/LocalDatabase.java
package io.hybriddb.storage;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A named set of local collections. Each database owns its registry.
 */
public interface LocalDatabase extends Closeable {

    /** Open (or return the already open) collection with the given name. */
    CompletableFuture<LocalCollection> addCollection(String name);

    /** Close the collection and drop its stored data. Unknown names are ignored. */
    CompletableFuture<Void> removeCollection(String name);

    List<String> getCollectionNames();

    /** @return the open collection, or null when none has that name */
    LocalCollection collection(String name);
}
