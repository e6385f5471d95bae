// file: client/src/main/java/io/hybriddb/client/HybridConfig.java
package io.hybriddb.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hybriddb.client.dto.JsonConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validated client configuration.
 * <p>
 * Every constructor argument is checked; invalid values raise
 * {@link IllegalArgumentException}. Missing JSON keys take the defaults below.
 */
public final class HybridConfig {

    public static final String STORAGE_MEMORY = "memory";
    public static final String STORAGE_FILE = "file";

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final int DEFAULT_UPLOAD_BATCH_SIZE = 100;
    public static final int DEFAULT_QUICKFIND_SHARDS = 16;
    public static final int DEFAULT_MAX_URL_LENGTH = 2000;

    private final URI baseUrl;
    private final String clientId;
    private final String storage;
    private final Path storageDir;
    private final int timeoutMillis;
    private final int uploadBatchSize;
    private final int quickfindShards;
    private final boolean usePostFind;
    private final int maxUrlLength;
    private final HybridOptions defaults;
    private final Map<String, HybridOptions> collections;

    public HybridConfig(
            URI baseUrl,
            String clientId,
            String storage,
            Path storageDir,
            int timeoutMillis,
            int uploadBatchSize,
            int quickfindShards,
            boolean usePostFind,
            int maxUrlLength,
            HybridOptions defaults,
            Map<String, HybridOptions> collections
    ) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (!"http".equals(baseUrl.getScheme()) && !"https".equals(baseUrl.getScheme())) {
            throw new IllegalArgumentException("baseUrl must be http or https: " + baseUrl);
        }
        if (!STORAGE_MEMORY.equals(storage) && !STORAGE_FILE.equals(storage)) {
            throw new IllegalArgumentException("storage must be 'memory' or 'file': " + storage);
        }
        if (STORAGE_FILE.equals(storage) && storageDir == null) {
            throw new IllegalArgumentException("storageDir is required for file storage");
        }
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be > 0");
        if (uploadBatchSize <= 0) throw new IllegalArgumentException("uploadBatchSize must be > 0");
        if (quickfindShards <= 0 || Integer.bitCount(quickfindShards) != 1) {
            throw new IllegalArgumentException("quickfindShards must be a power of two");
        }
        if (maxUrlLength <= 0) throw new IllegalArgumentException("maxUrlLength must be > 0");

        // paths resolve against the base, so it has to end with a slash
        String url = baseUrl.toString();
        this.baseUrl = url.endsWith("/") ? baseUrl : URI.create(url + "/");
        this.clientId = clientId;
        this.storage = storage;
        this.storageDir = storageDir;
        this.timeoutMillis = timeoutMillis;
        this.uploadBatchSize = uploadBatchSize;
        this.quickfindShards = quickfindShards;
        this.usePostFind = usePostFind;
        this.maxUrlLength = maxUrlLength;
        this.defaults = HybridOptions.DEFAULTS.overlay(defaults);
        this.collections = collections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(collections));
    }

    /** In-memory configuration with every default, for the given endpoint. */
    public static HybridConfig forUrl(URI baseUrl) {
        return new HybridConfig(baseUrl, null, STORAGE_MEMORY, null, DEFAULT_TIMEOUT_MILLIS,
                DEFAULT_UPLOAD_BATCH_SIZE, DEFAULT_QUICKFIND_SHARDS, false, DEFAULT_MAX_URL_LENGTH, null, null);
    }

    public static HybridConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        JsonConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid HybridConfig in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load HybridConfig from " + path, e);
        }

        if (cfg.baseUrl == null || cfg.baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is required");
        URI base;
        try {
            base = new URI(cfg.baseUrl);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("baseUrl is not a URI: " + cfg.baseUrl, e);
        }
        String storage = cfg.storage == null ? STORAGE_MEMORY : cfg.storage;
        Path dir = cfg.storageDir == null ? null : path.toAbsolutePath().getParent().resolve(cfg.storageDir);

        return new HybridConfig(
                base,
                cfg.clientId,
                storage,
                dir,
                orDefault(cfg.timeoutMillis, DEFAULT_TIMEOUT_MILLIS),
                orDefault(cfg.uploadBatchSize, DEFAULT_UPLOAD_BATCH_SIZE),
                orDefault(cfg.quickfindShards, DEFAULT_QUICKFIND_SHARDS),
                Boolean.TRUE.equals(cfg.usePostFind),
                orDefault(cfg.maxUrlLength, DEFAULT_MAX_URL_LENGTH),
                cfg.defaults,
                cfg.collections
        );
    }

    public HybridConfig withDefaults(HybridOptions defaults) {
        return new HybridConfig(baseUrl, clientId, storage, storageDir, timeoutMillis, uploadBatchSize,
                quickfindShards, usePostFind, maxUrlLength, defaults, collections);
    }

    public HybridConfig withCollection(String name, HybridOptions options) {
        Map<String, HybridOptions> next = new LinkedHashMap<>(collections);
        next.put(name, options);
        return new HybridConfig(baseUrl, clientId, storage, storageDir, timeoutMillis, uploadBatchSize,
                quickfindShards, usePostFind, maxUrlLength, defaults, next);
    }

    public HybridConfig withUploadBatchSize(int uploadBatchSize) {
        return new HybridConfig(baseUrl, clientId, storage, storageDir, timeoutMillis, uploadBatchSize,
                quickfindShards, usePostFind, maxUrlLength, defaults, collections);
    }

    public HybridConfig withFileStorage(Path storageDir) {
        return new HybridConfig(baseUrl, clientId, STORAGE_FILE, storageDir, timeoutMillis, uploadBatchSize,
                quickfindShards, usePostFind, maxUrlLength, defaults, collections);
    }

    public URI baseUrl() {
        return baseUrl;
    }

    public String clientId() {
        return clientId;
    }

    public String storage() {
        return storage;
    }

    public Path storageDir() {
        return storageDir;
    }

    public int timeoutMillis() {
        return timeoutMillis;
    }

    public int uploadBatchSize() {
        return uploadBatchSize;
    }

    public int quickfindShards() {
        return quickfindShards;
    }

    public boolean usePostFind() {
        return usePostFind;
    }

    public int maxUrlLength() {
        return maxUrlLength;
    }

    /** Global defaults, already overlaid on {@link HybridOptions#DEFAULTS}. */
    public HybridOptions defaults() {
        return defaults;
    }

    /** Per-collection overrides by collection name. */
    public Map<String, HybridOptions> collections() {
        return collections;
    }

    private static int orDefault(Integer v, int dflt) {
        return v == null ? dflt : v;
    }
}
