// file: client/src/main/java/io/hybriddb/client/UploadReport.java
package io.hybriddb.client;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an upload pass.
 *
 * @param upserted  documents the server accepted
 * @param removed   removes the server accepted
 * @param discarded local changes the server refused for good (403/410) and that were abandoned
 */
public record UploadReport(int upserted, int removed, List<Discarded> discarded) {

    public static final UploadReport EMPTY = new UploadReport(0, 0, List.of());

    public UploadReport {
        discarded = List.copyOf(discarded);
    }

    public enum Kind { UPSERT, REMOVE }

    public record Discarded(String collection, String id, Kind kind, int status) {}

    public UploadReport plus(UploadReport other) {
        List<Discarded> all = new ArrayList<>(discarded);
        all.addAll(other.discarded);
        return new UploadReport(upserted + other.upserted, removed + other.removed, all);
    }
}
