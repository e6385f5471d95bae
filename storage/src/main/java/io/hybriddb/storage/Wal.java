// file: storage/src/main/java/io/hybriddb/storage/Wal.java
package io.hybriddb.storage;

import java.io.IOException;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - truncate() drops every record; used once a snapshot covers them.
 */
interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord) throws IOException;

    /** Rotate log segment if the size threshold is hit. Called after each append. */
    void rotateIfNeeded() throws IOException;

    /** Delete all segments and start again from an empty first segment. */
    void truncate() throws IOException;

    /**
     * Open a sequential reader over all segments, oldest first.
     * The reader stops at the first corrupt header, truncated payload or CRC mismatch.
     */
    WalReader openReader() throws IOException;

    @Override
    void close() throws IOException;

    /** Reader abstraction used during recovery. */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at the end of the last segment, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next() throws IOException;

        /** True once next() has returned null because of a torn or corrupt record. */
        boolean stoppedAtTear();

        @Override
        void close() throws IOException;
    }
}
