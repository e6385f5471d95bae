// file: storage/src/main/java/io/hybriddb/storage/FileLogStorageProvider.java
package io.hybriddb.storage;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One {@link FileLogStorageAdapter} directory per collection under a root directory.
 * Collection names are URL-encoded into directory names.
 */
public final class FileLogStorageProvider implements StorageProvider {
    public static final String NAME = "file";

    private final Path root;
    private final int snapshotEvery;

    public FileLogStorageProvider(Path root) {
        this(root, FileLogStorageAdapter.DEFAULT_SNAPSHOT_EVERY);
    }

    public FileLogStorageProvider(Path root, int snapshotEvery) {
        this.root = root;
        this.snapshotEvery = snapshotEvery;
    }

    @Override
    public String name() {
        return NAME;
    }

    /** The root must exist (or be creatable) and be writable. */
    @Override
    public boolean isAvailable() {
        try {
            Files.createDirectories(root);
            return Files.isDirectory(root) && Files.isWritable(root);
        } catch (IOException | SecurityException e) {
            return false;
        }
    }

    @Override
    public StorageAdapter open(String collection) throws IOException {
        return new FileLogStorageAdapter(dirOf(collection), snapshotEvery, FileLogStorageAdapter.DEFAULT_ROTATE_BYTES);
    }

    @Override
    public void drop(String collection) throws IOException {
        Path dir = dirOf(collection);
        if (!Files.exists(dir)) return;
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path p : paths) Files.delete(p);
    }

    Path dirOf(String collection) {
        return root.resolve(URLEncoder.encode(collection, StandardCharsets.UTF_8));
    }
}
