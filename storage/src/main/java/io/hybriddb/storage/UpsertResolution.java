// file: storage/src/main/java/io/hybriddb/storage/UpsertResolution.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;

/**
 * Server outcome of one uploaded upsert.
 *
 * @param uploaded the exact pending snapshot that was sent
 * @param merged   the document the server stored, or null to keep {@code uploaded.doc()}
 */
public record UpsertResolution(PendingUpsert uploaded, Document merged) {}
