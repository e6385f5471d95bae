// file: storage/src/main/java/io/hybriddb/storage/PendingUpsert.java
package io.hybriddb.storage;

import io.hybriddb.core.Document;

/**
 * A local change awaiting upload.
 *
 * @param doc  the value to store remotely
 * @param base the value {@code doc} was derived from, or null to overwrite
 */
public record PendingUpsert(Document doc, Document base) {}
