// file: storage/src/main/java/io/hybriddb/storage/FileLogStorageAdapter.java
package io.hybriddb.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only log adapter for one collection directory.
 * <p>
 * Responsibilities:
 *  - Mirror the persisted entries in memory (id -> entry, insertion order).
 *  - On persist:
 *      1) Encode the whole batch as one WAL record.
 *      2) Append+fsync to the WAL. This is the commit point.
 *      3) Apply the batch to the mirror.
 *      4) Rotate the WAL segment if needed.
 *      5) Every N persists, write a full snapshot and truncate the WAL.
 *      Steps 4 and 5 only compact; a failure there is logged and the
 *      record stays in the WAL.
 * <p>
 *  - On construction (recovery):
 *      1) Load the latest snapshot (if any).
 *      2) Replay WAL records in order; an undecodable but CRC-valid record
 *         fails recovery.
 *      3) A torn tail is ignored; the recovered state is then snapshotted and
 *         the WAL truncated so later appends stay reachable.
 * <p>
 * Replaying a record twice is harmless because every record carries absolute
 * entry states, so a crash between snapshot and truncate loses nothing.
 */
public final class FileLogStorageAdapter implements StorageAdapter {
    private static final Logger log = Logger.getLogger(FileLogStorageAdapter.class.getName());

    public static final int DEFAULT_SNAPSHOT_EVERY = 1_000;
    public static final long DEFAULT_ROTATE_BYTES = 8L << 20;

    private final Path dir;
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Map<String, CollectionEntry> mem = new LinkedHashMap<>();

    public FileLogStorageAdapter(Path dir) throws IOException {
        this(dir, DEFAULT_SNAPSHOT_EVERY, DEFAULT_ROTATE_BYTES);
    }

    public FileLogStorageAdapter(Path dir, int snapshotEvery, long rotateBytes) throws IOException {
        this.dir = dir;
        this.snapPolicy = new SnapshotPolicy(snapshotEvery);
        this.wal = new FileWal(dir, rotateBytes);
        this.snaps = new FileSnapshotter(dir);
        try {
            recover();
        } catch (IOException e) {
            wal.close();
            throw e;
        }
    }

    @Override
    public synchronized List<CollectionEntry> loadAll() {
        return new ArrayList<>(mem.values());
    }

    @Override
    public synchronized void persist(List<CollectionEntry> puts, List<String> removedIds) throws IOException {
        if (puts.isEmpty() && removedIds.isEmpty()) return;

        wal.append(RecordCodec.encode(puts, removedIds));
        apply(puts, removedIds);

        // The record is durable from here on; compaction failures must not fail the write.
        try {
            wal.rotateIfNeeded();
            if (snapPolicy.recordAndCheck()) {
                snaps.writeSnapshot(mem.values());
                wal.truncate();
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "WAL compaction failed in " + dir + "; log kept for replay", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        wal.close();
    }

    private void recover() throws IOException {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            for (CollectionEntry e : loaded.entries()) mem.put(e.id(), e);
        }

        int replayed = 0;
        boolean torn;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                List<CollectionEntry> puts = new ArrayList<>(rec.puts().size());
                for (RecordCodec.StoredEntry e : rec.puts()) puts.add(e.toEntry());
                apply(puts, rec.removes());
                replayed++;
            }
            torn = r.stoppedAtTear();
        }
        if (torn) {
            // New appends would land behind the tear and be unreachable on the next replay.
            snaps.writeSnapshot(mem.values());
            wal.truncate();
            log.info("torn WAL tail in " + dir + " discarded after snapshot");
        }
        final int records = replayed;
        log.fine(() -> "recovered " + dir + ": snapshot=" + (loaded == null ? "none" : loaded.id())
                + ", replayed=" + records + ", entries=" + mem.size());
    }

    private void apply(List<CollectionEntry> puts, List<String> removedIds) {
        for (CollectionEntry e : puts) mem.put(e.id(), e);
        for (String id : removedIds) mem.remove(id);
    }
}
