// file: storage/src/main/java/io/hybriddb/storage/StorageProvider.java
package io.hybriddb.storage;

import java.io.IOException;

/**
 * Source of per-collection storage adapters.
 * <p>
 *  - name():        short identifier used in configuration and logs,
 *  - isAvailable(): cheap probe used by {@link StorageSelector},
 *  - open():        adapter for a collection, creating it when absent,
 *  - drop():        delete a collection's data.
 */
public interface StorageProvider {

    String name();

    boolean isAvailable();

    StorageAdapter open(String collection) throws IOException;

    void drop(String collection) throws IOException;
}
