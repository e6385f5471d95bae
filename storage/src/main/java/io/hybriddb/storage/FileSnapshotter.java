// file: storage/src/main/java/io/hybriddb/storage/FileSnapshotter.java
package io.hybriddb.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.hybriddb.core.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format: a JSON array of stored entries, in collection order.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-NNNNNNNN.json.tmp" first,
 *   - then move to "snapshot-NNNNNNNN.json" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final TypeReference<List<RecordCodec.StoredEntry>> ENTRIES = new TypeReference<>() {};

    private final Path dir;

    FileSnapshotter(Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
    }

    @Override
    public String writeSnapshot(Collection<CollectionEntry> current) throws IOException {
        List<Path> previous = snapshots();
        int seq = previous.isEmpty() ? 1 : sequenceOf(previous.get(previous.size() - 1)) + 1;
        String name = String.format("snapshot-%08d.json", seq);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        List<RecordCodec.StoredEntry> stored = new ArrayList<>(current.size());
        for (CollectionEntry e : current) stored.add(RecordCodec.StoredEntry.of(e));
        Files.write(tmp, Json.MAPPER.writeValueAsBytes(stored));
        Files.move(tmp, dst, ATOMIC_MOVE);

        for (Path old : previous) Files.deleteIfExists(old);
        log.fine(() -> "snapshot " + dst + " written with " + stored.size() + " entries");
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() throws IOException {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);
        try {
            List<RecordCodec.StoredEntry> stored = Json.MAPPER.readValue(Files.readAllBytes(snap), ENTRIES);
            List<CollectionEntry> entries = new ArrayList<>(stored.size());
            for (RecordCodec.StoredEntry e : stored) entries.add(e.toEntry());
            return new LoadedSnapshot(snap.getFileName().toString(), entries);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new IOException("unreadable snapshot " + snap, e);
        }
    }

    private List<Path> snapshots() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".json");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static int sequenceOf(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Integer.parseInt(n.substring("snapshot-".length(), n.length() - ".json".length()));
    }
}
