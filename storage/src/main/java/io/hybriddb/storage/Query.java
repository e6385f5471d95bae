// file: storage/src/main/java/io/hybriddb/storage/Query.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Deferred local query; nothing runs until {@link #fetch()}. */
@FunctionalInterface
public interface Query {
    CompletableFuture<List<Document>> fetch();
}
