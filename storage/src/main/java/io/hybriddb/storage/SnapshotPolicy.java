// file: storage/src/main/java/io/hybriddb/storage/SnapshotPolicy.java
package io.hybriddb.storage;

/**
 * Snapshot policy that triggers a full snapshot after every N persists.
 * <p>
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time.
 */
final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable persist; true when a snapshot is due (and resets the count). */
    boolean recordAndCheck() {
        if (++sinceLast >= everyOps) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
