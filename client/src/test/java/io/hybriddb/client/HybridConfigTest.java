// file: client/src/test/java/io/hybriddb/client/HybridConfigTest.java
package io.hybriddb.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HybridConfigTest {

    @TempDir
    Path dir;

    private Path write(String json) throws IOException {
        Path p = dir.resolve("hybrid.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void full_file_is_loaded_and_layered_on_defaults() throws IOException {
        Path p = write("""
                {
                  "baseUrl": "https://api.example.com/v3",
                  "clientId": "c-123",
                  "storage": "file",
                  "storageDir": "data",
                  "timeoutMillis": 2500,
                  "uploadBatchSize": 50,
                  "quickfindShards": 32,
                  "usePostFind": true,
                  "maxUrlLength": 1000,
                  "defaults": { "interim": false },
                  "collections": { "sites": { "quickfind": true }, "notes": { "shortcut": true } }
                }
                """);

        HybridConfig cfg = HybridConfig.fromJsonFile(p);

        assertEquals(URI.create("https://api.example.com/v3/"), cfg.baseUrl());
        assertEquals("c-123", cfg.clientId());
        assertEquals(HybridConfig.STORAGE_FILE, cfg.storage());
        assertEquals(dir.resolve("data").toAbsolutePath(), cfg.storageDir());
        assertEquals(2500, cfg.timeoutMillis());
        assertEquals(50, cfg.uploadBatchSize());
        assertEquals(32, cfg.quickfindShards());
        assertTrue(cfg.usePostFind());
        assertEquals(1000, cfg.maxUrlLength());
        assertEquals(HybridOptions.DEFAULTS.withInterim(false), cfg.defaults());
        assertEquals(List.of("sites", "notes"), List.copyOf(cfg.collections().keySet()));
        assertEquals(Boolean.TRUE, cfg.collections().get("sites").quickfind());
        assertNull(cfg.collections().get("sites").interim());
    }

    @Test
    void missing_keys_take_defaults() throws IOException {
        HybridConfig cfg = HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://localhost:8080/\"}"));

        assertEquals(HybridConfig.STORAGE_MEMORY, cfg.storage());
        assertNull(cfg.clientId());
        assertEquals(HybridConfig.DEFAULT_TIMEOUT_MILLIS, cfg.timeoutMillis());
        assertEquals(HybridConfig.DEFAULT_UPLOAD_BATCH_SIZE, cfg.uploadBatchSize());
        assertEquals(HybridConfig.DEFAULT_QUICKFIND_SHARDS, cfg.quickfindShards());
        assertFalse(cfg.usePostFind());
        assertEquals(HybridOptions.DEFAULTS, cfg.defaults());
        assertEquals(Map.of(), cfg.collections());
    }

    @Test
    void invalid_values_are_rejected() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> HybridConfig.fromJsonFile(write("{}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"ftp://x/\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://x/\", \"storage\": \"cloud\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://x/\", \"storage\": \"file\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://x/\", \"quickfindShards\": 12}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://x/\", \"uploadBatchSize\": 0}")));
        assertThrows(IllegalArgumentException.class,
                () -> HybridConfig.fromJsonFile(write("{\"baseUrl\": \"http://x/\", \"defaults\": {\"fast\": true}}")));
        assertThrows(IllegalArgumentException.class, () -> HybridConfig.fromJsonFile(write("{not json")));
    }

    @Test
    void unreadable_file_is_an_io_error() {
        assertThrows(UncheckedIOException.class, () -> HybridConfig.fromJsonFile(dir.resolve("missing.json")));
    }
}
