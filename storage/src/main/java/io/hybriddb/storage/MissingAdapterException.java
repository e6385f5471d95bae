// file: storage/src/main/java/io/hybriddb/storage/MissingAdapterException.java
package io.hybriddb.storage;

import io.hybriddb.core.HybridDbException;

/** A storage provider produced no adapter for a collection. */
public class MissingAdapterException extends HybridDbException {
    public MissingAdapterException(String message) {
        super(message);
    }
}
