// file: client/src/main/java/io/hybriddb/client/remote/ItemResult.java
package io.hybriddb.client.remote;

import io.hybriddb.core.Document;

/**
 * Outcome of one item of an upsert or patch batch.
 */
public interface ItemResult {

    /** The server stored the item and returned its merged document. */
    record Ok(Document doc) implements ItemResult {}

    /** The server refused the item. */
    record Fault(int status, String message) implements ItemResult {
        public RemoteException toException() {
            return RemoteException.forStatus(status, message);
        }
    }
}
